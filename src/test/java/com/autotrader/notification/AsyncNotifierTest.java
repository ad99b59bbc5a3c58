package com.autotrader.notification;

import com.autotrader.entity.AlertHistoryEntity;
import com.autotrader.model.NotificationSettings;
import com.autotrader.model.Strategy;
import com.autotrader.service.persistence.AlertHistoryService;
import com.autotrader.service.strategy.StrategyService;
import com.autotrader.util.TradingConstants;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AsyncNotifierTest {

    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");

    private ApplicationEventPublisher publisher;
    private AlertHistoryService alertHistoryService;
    private StrategyService strategyService;
    private AsyncNotifier notifier;

    @BeforeEach
    void setUp() {
        publisher = mock(ApplicationEventPublisher.class);
        alertHistoryService = mock(AlertHistoryService.class);
        strategyService = mock(StrategyService.class);
        notifier = newNotifier(Runnable::run);
    }

    private AsyncNotifier newNotifier(Executor executor) {
        return new AsyncNotifier(executor, publisher, alertHistoryService, strategyService,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Map<String, Object> payload(String strategyId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(TradingConstants.KEY_POSITION_ID, "pos_1");
        payload.put(TradingConstants.KEY_TOKEN_ID, "T");
        payload.put(TradingConstants.KEY_STRATEGY_ID, strategyId);
        return payload;
    }

    @Test
    @DisplayName("Should publish a PositionEvent and record alert history")
    void deliversEvent() {
        notifier.emit(NotificationEventType.POSITION_CLOSED, payload(null));

        ArgumentCaptor<PositionEvent> event = ArgumentCaptor.forClass(PositionEvent.class);
        verify(publisher).publishEvent(event.capture());
        assertEquals(NotificationEventType.POSITION_CLOSED, event.getValue().type());
        assertEquals("pos_1", event.getValue().positionId());

        ArgumentCaptor<AlertHistoryEntity> alert = ArgumentCaptor.forClass(AlertHistoryEntity.class);
        verify(alertHistoryService).recordAlertAsync(alert.capture());
        assertEquals("POSITION_CLOSED", alert.getValue().getAlertType());
        assertEquals("INFO", alert.getValue().getSeverity());
        assertEquals("pos_1", alert.getValue().getPositionId());
        assertEquals(NOW, alert.getValue().getTimestamp());
    }

    @Test
    @DisplayName("Should not record alerts for categories the strategy has muted")
    void respectsStrategySettings() {
        Strategy strategy = Strategy.builder().id("strat_1").name("Quiet")
                .notifications(new NotificationSettings(true, false, true)).build();
        when(strategyService.findStrategy("strat_1")).thenReturn(Optional.of(strategy));

        notifier.emit(NotificationEventType.POSITION_CLOSED, payload("strat_1"));
        notifier.emit(NotificationEventType.ACTION_FAILED, payload("strat_1"));

        verify(publisher, times(2)).publishEvent(any(PositionEvent.class));
        ArgumentCaptor<AlertHistoryEntity> alert = ArgumentCaptor.forClass(AlertHistoryEntity.class);
        verify(alertHistoryService, times(1)).recordAlertAsync(alert.capture());
        assertEquals("ACTION_FAILED", alert.getValue().getAlertType());
        assertEquals("WARNING", alert.getValue().getSeverity());
    }

    @Test
    @DisplayName("Should return without delivering when the executor rejects the task")
    void droppedWhenExecutorFull() {
        AsyncNotifier saturated = newNotifier(task -> {
            throw new RejectedExecutionException("queue full");
        });

        assertDoesNotThrow(() -> saturated.emit(NotificationEventType.ACTION_ABANDONED, payload(null)));
        verifyNoInteractions(publisher, alertHistoryService);
    }

    @Test
    @DisplayName("Should keep recording alerts when a listener fails")
    void listenerFailureIsContained() {
        doThrow(new IllegalStateException("listener down")).when(publisher).publishEvent(any(PositionEvent.class));

        notifier.emit(NotificationEventType.ACTION_ABANDONED, payload(null));

        verify(alertHistoryService).recordAlertAsync(any(AlertHistoryEntity.class));
    }

    @Test
    @DisplayName("Should snapshot the payload at emit time")
    void payloadIsCopied() {
        Map<String, Object> payload = new HashMap<>(payload(null));
        Executor deferred = mock(Executor.class);
        AsyncNotifier deferredNotifier = newNotifier(deferred);

        deferredNotifier.emit(NotificationEventType.POSITION_OPENED, payload);
        payload.put(TradingConstants.KEY_POSITION_ID, "changed");

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(deferred).execute(task.capture());
        task.getValue().run();

        ArgumentCaptor<PositionEvent> event = ArgumentCaptor.forClass(PositionEvent.class);
        verify(publisher).publishEvent(event.capture());
        assertEquals("pos_1", event.getValue().positionId());
    }

    @Test
    @DisplayName("Should format type and non-null payload entries")
    void formatsMessage() {
        String message = AsyncNotifier.formatMessage(NotificationEventType.POSITION_OPENED, payload(null));

        assertTrue(message.startsWith("POSITION_OPENED"));
        assertTrue(message.contains(TradingConstants.KEY_POSITION_ID + "=pos_1"));
        assertFalse(message.contains(TradingConstants.KEY_STRATEGY_ID + "="));
    }
}
