package com.autotrader.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Running trade totals for a strategy.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StrategyStats {

    private int totalTrades;
    private int successfulTrades;
    private int failedTrades;

    /** Realised profit in quote currency across closed positions */
    private double realizedProfit;

    public StrategyStats copy() {
        return new StrategyStats(totalTrades, successfulTrades, failedTrades, realizedProfit);
    }
}
