package com.autotrader.service.persistence;

import com.autotrader.entity.AlertHistoryEntity;
import com.autotrader.repository.AlertHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Alert history persistence.
 * Writes are asynchronous and never block notification delivery.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertHistoryService {

    private final AlertHistoryRepository alertHistoryRepository;

    /**
     * Persist an alert asynchronously.
     */
    @Async("persistenceExecutor")
    @Transactional
    public CompletableFuture<AlertHistoryEntity> recordAlertAsync(AlertHistoryEntity alert) {
        try {
            AlertHistoryEntity saved = alertHistoryRepository.save(alert);
            log.debug("Persisted alert: type={}, position={}", alert.getAlertType(), alert.getPositionId());
            return CompletableFuture.completedFuture(saved);
        } catch (Exception e) {
            log.error("Failed to persist alert: type={}, position={}", alert.getAlertType(), alert.getPositionId(), e);
            return CompletableFuture.failedFuture(e);
        }
    }

    @Transactional(readOnly = true)
    public List<AlertHistoryEntity> getRecentAlerts() {
        return alertHistoryRepository.findTop100ByOrderByTimestampDesc();
    }

    @Transactional(readOnly = true)
    public List<AlertHistoryEntity> getAlertsForPosition(String positionId) {
        return alertHistoryRepository.findByPositionIdOrderByTimestampDesc(positionId);
    }
}
