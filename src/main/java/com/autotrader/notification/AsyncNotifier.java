package com.autotrader.notification;

import com.autotrader.entity.AlertHistoryEntity;
import com.autotrader.model.NotificationSettings;
import com.autotrader.model.Strategy;
import com.autotrader.service.persistence.AlertHistoryService;
import com.autotrader.service.strategy.StrategyService;
import com.autotrader.util.TradingConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Notifier that hands every event to the notification executor and returns immediately.
 * <p>
 * On the executor each event is logged, republished as a {@link PositionEvent} for
 * in-process listeners and, unless the owning strategy has muted its category, recorded
 * in alert history.
 */
@Slf4j
@Component
public class AsyncNotifier implements Notifier {

    private final Executor notificationExecutor;
    private final ApplicationEventPublisher eventPublisher;
    private final AlertHistoryService alertHistoryService;
    private final StrategyService strategyService;
    private final Clock clock;

    public AsyncNotifier(@Qualifier("notificationExecutor") Executor notificationExecutor,
                         ApplicationEventPublisher eventPublisher,
                         AlertHistoryService alertHistoryService,
                         StrategyService strategyService,
                         Clock clock) {
        this.notificationExecutor = notificationExecutor;
        this.eventPublisher = eventPublisher;
        this.alertHistoryService = alertHistoryService;
        this.strategyService = strategyService;
        this.clock = clock;
    }

    @Override
    public void emit(NotificationEventType type, Map<String, Object> payload) {
        Map<String, Object> copy = Collections.unmodifiableMap(
                payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>());
        try {
            notificationExecutor.execute(() -> deliver(type, copy));
        } catch (RejectedExecutionException e) {
            log.warn("Notification dropped: type={}, position={}", type, copy.get(TradingConstants.KEY_POSITION_ID));
        }
    }

    void deliver(NotificationEventType type, Map<String, Object> payload) {
        String message = formatMessage(type, payload);
        switch (type.getSeverity()) {
            case CRITICAL -> log.error("[ALERT] {}", message);
            case WARNING -> log.warn("[ALERT] {}", message);
            default -> log.info("[EVENT] {}", message);
        }

        try {
            eventPublisher.publishEvent(new PositionEvent(this, type, payload));
        } catch (RuntimeException e) {
            log.warn("Listener failed for {} event: {}", type, e.getMessage(), e);
        }

        if (!isEnabledForStrategy(type, payload)) {
            log.debug("{} muted by strategy notification settings", type);
            return;
        }
        alertHistoryService.recordAlertAsync(AlertHistoryEntity.builder()
                .timestamp(clock.instant())
                .alertType(type.name())
                .severity(type.getSeverity().name())
                .strategyId(asString(payload.get(TradingConstants.KEY_STRATEGY_ID)))
                .positionId(asString(payload.get(TradingConstants.KEY_POSITION_ID)))
                .tokenId(asString(payload.get(TradingConstants.KEY_TOKEN_ID)))
                .message(truncate(message, 2000))
                .build());
    }

    private boolean isEnabledForStrategy(NotificationEventType type, Map<String, Object> payload) {
        String strategyId = asString(payload.get(TradingConstants.KEY_STRATEGY_ID));
        if (strategyId == null) {
            return true;
        }
        Optional<Strategy> strategy = strategyService.findStrategy(strategyId);
        if (strategy.isEmpty()) {
            return true;
        }
        NotificationSettings settings = strategy.get().getNotifications();
        return switch (type.getCategory()) {
            case ENTRY -> settings.isOnEntry();
            case EXIT -> settings.isOnExit();
            case ERROR -> settings.isOnError();
        };
    }

    static String formatMessage(NotificationEventType type, Map<String, Object> payload) {
        StringBuilder sb = new StringBuilder(128).append(type.name());
        for (Map.Entry<String, Object> entry : payload.entrySet()) {
            if (entry.getValue() != null) {
                sb.append(' ').append(entry.getKey()).append('=').append(entry.getValue());
            }
        }
        return sb.toString();
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }

    private static String truncate(String value, int max) {
        return value.length() > max ? value.substring(0, max) : value;
    }
}
