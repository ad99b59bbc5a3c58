package com.autotrader.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate statistics across all strategies.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PerformanceStatsResponse {

    private int strategyCount;
    private int activeStrategies;
    private int totalTrades;
    private int successfulTrades;
    private int failedTrades;
    private double winRate; // percent of successful trades
    private double totalProfit;
}
