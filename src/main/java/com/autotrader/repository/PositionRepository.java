package com.autotrader.repository;

import com.autotrader.entity.PositionEntity;
import com.autotrader.model.PositionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for Position entity operations.
 */
@Repository
public interface PositionRepository extends JpaRepository<PositionEntity, String> {

    // Find by status (active set is OPEN + PARTIALLY_CLOSED)
    List<PositionEntity> findByStatusInOrderByEntryTimestampAsc(Collection<PositionStatus> statuses);

    // Find by strategy
    List<PositionEntity> findByStrategyIdOrderByEntryTimestampDesc(String strategyId);

}
