package com.autotrader.gateway;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of a buy or sell.
 * <p>
 * For a buy {@code amountOut} is the base amount received; for a sell it is the
 * quote amount received.
 */
@Getter
@ToString
@AllArgsConstructor
public final class TradeResult {

    private final boolean success;

    private final double amountOut;

    /** Effective fill price, 0 when unknown */
    private final double executionPrice;

    private final String txRef;

    private final String error;

    public static TradeResult success(double amountOut, double executionPrice, String txRef) {
        return new TradeResult(true, amountOut, executionPrice, txRef, null);
    }

    public static TradeResult failure(String error) {
        return new TradeResult(false, 0.0, 0.0, null, error);
    }
}
