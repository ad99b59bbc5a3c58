package com.autotrader.notification;

import com.autotrader.util.TradingConstants;

import java.util.Map;

/**
 * In-process event republished for every notification.
 */
public record PositionEvent(Object source, NotificationEventType type, Map<String, Object> payload) {

    public String positionId() {
        return asString(payload.get(TradingConstants.KEY_POSITION_ID));
    }

    public String strategyId() {
        return asString(payload.get(TradingConstants.KEY_STRATEGY_ID));
    }

    public double doubleValue(String key) {
        Object value = payload.get(key);
        return value instanceof Number ? ((Number) value).doubleValue() : 0.0;
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
