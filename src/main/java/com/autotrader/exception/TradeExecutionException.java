package com.autotrader.exception;

/**
 * A buy or sell could not be executed.
 * Carries the trade side so callers can report it without parsing the message.
 */
public class TradeExecutionException extends RuntimeException {

    public enum Side {
        BUY,
        SELL
    }

    private final Side side;

    public TradeExecutionException(Side side, String message) {
        super(message);
        this.side = side;
    }

    public TradeExecutionException(Side side, String message, Throwable cause) {
        super(message, cause);
        this.side = side;
    }

    public Side getSide() {
        return side;
    }
}
