package com.autotrader.repository;

import com.autotrader.entity.AlertHistoryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for Alert History entity operations.
 */
@Repository
public interface AlertHistoryRepository extends JpaRepository<AlertHistoryEntity, Long> {

    // Find recent alerts
    List<AlertHistoryEntity> findTop100ByOrderByTimestampDesc();

    // Find by position
    List<AlertHistoryEntity> findByPositionIdOrderByTimestampDesc(String positionId);
}
