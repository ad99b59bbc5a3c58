package com.autotrader.repository;

import com.autotrader.entity.StrategyEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for Strategy entity operations.
 */
@Repository
public interface StrategyRepository extends JpaRepository<StrategyEntity, String> {

    List<StrategyEntity> findAllByOrderByCreatedAtAsc();
}
