package com.autotrader.exception;

/**
 * An action was attempted on a position that already has one in flight.
 * The duplicate attempt is dropped.
 */
public class ConcurrencyViolationException extends RuntimeException {

    private final String positionId;

    public ConcurrencyViolationException(String positionId, String message) {
        super(message);
        this.positionId = positionId;
    }

    public String getPositionId() {
        return positionId;
    }
}
