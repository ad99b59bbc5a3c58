package com.autotrader.gateway;

import lombok.Builder;
import lombok.Value;

/**
 * Per-trade execution options passed through to the trade executor.
 */
@Value
@Builder
public class TradeOptions {

    /** Maximum tolerated slippage in percent */
    double slippagePercent;

    /** Retries the executor itself may perform before reporting failure */
    int maxRetries;
}
