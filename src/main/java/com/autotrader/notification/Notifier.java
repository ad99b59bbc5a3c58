package com.autotrader.notification;

import java.util.Map;

/**
 * Fire-and-forget sink for position lifecycle events.
 * <p>
 * Implementations must return quickly and must never throw into the caller:
 * the monitoring loop emits from its worker threads.
 */
public interface Notifier {

    /**
     * @param type    event type
     * @param payload event details keyed by the {@code KEY_*} constants in
     *                {@link com.autotrader.util.TradingConstants}; null values are allowed
     */
    void emit(NotificationEventType type, Map<String, Object> payload);
}
