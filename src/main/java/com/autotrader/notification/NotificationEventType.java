package com.autotrader.notification;

/**
 * Events emitted by the position manager and the auto-trader.
 * <p>
 * Each type belongs to a category that the strategy notification flags gate
 * (onEntry, onExit, onError) and carries the severity recorded in alert history.
 */
public enum NotificationEventType {

    POSITION_OPENED(Category.ENTRY, Severity.INFO),
    SCALE_IN_EXECUTED(Category.ENTRY, Severity.INFO),
    STRATEGY_TRADE_EXECUTED(Category.ENTRY, Severity.INFO),
    PARTIAL_SELL_EXECUTED(Category.EXIT, Severity.INFO),
    POSITION_CLOSED(Category.EXIT, Severity.INFO),
    ACTION_FAILED(Category.ERROR, Severity.WARNING),
    ACTION_ABANDONED(Category.ERROR, Severity.CRITICAL),
    STRATEGY_TRADE_FAILED(Category.ERROR, Severity.WARNING);

    public enum Category {
        ENTRY,
        EXIT,
        ERROR
    }

    public enum Severity {
        INFO,
        WARNING,
        CRITICAL
    }

    private final Category category;
    private final Severity severity;

    NotificationEventType(Category category, Severity severity) {
        this.category = category;
        this.severity = severity;
    }

    public Category getCategory() {
        return category;
    }

    public Severity getSeverity() {
        return severity;
    }
}
