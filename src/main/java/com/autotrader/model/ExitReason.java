package com.autotrader.model;

/**
 * Structured reasons why a sell was executed against a position.
 */
public enum ExitReason {

    STOP_LOSS,

    MAX_HOLD,

    TAKE_PROFIT,

    TRAILING_STOP,

    /**
     * A partial profit level fired. Closes the position only if the level
     * sold everything that remained.
     */
    PARTIAL_TAKE_PROFIT,

    /**
     * Operator override from the REST surface.
     */
    MANUAL;

    /**
     * Stop-loss style exits are sold with the wider slippage tolerance.
     */
    public boolean isProtective() {
        return this == STOP_LOSS || this == TRAILING_STOP;
    }
}
