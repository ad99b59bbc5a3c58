package com.autotrader.model;

/**
 * Lifecycle state of a monitored position.
 */
public enum PositionStatus {
    /** Full amount still held */
    OPEN,
    /** At least one partial sell executed, some amount still held */
    PARTIALLY_CLOSED,
    /** Nothing left to sell; retained only in persistence */
    CLOSED;

    public boolean isActive() {
        return this != CLOSED;
    }
}
