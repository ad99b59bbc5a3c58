package com.autotrader.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One rung of the partial profit-taking ladder.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PartialProfitLevel {

    /** Stable identifier used for idempotent execution */
    private String levelId;

    /** Profit percent (against cost basis) at which this level fires */
    private double thresholdPercent;

    /** Fraction of amountTotal sold when this level fires, in (0, 1] */
    private double sellFraction;

    private boolean executed;

    private Instant executedAt;

    public PartialProfitLevel copy() {
        return new PartialProfitLevel(levelId, thresholdPercent, sellFraction, executed, executedAt);
    }
}
