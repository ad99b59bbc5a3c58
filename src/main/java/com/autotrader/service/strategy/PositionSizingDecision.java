package com.autotrader.service.strategy;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of sizing a new strategy entry.
 */
@Getter
@ToString
@AllArgsConstructor
public final class PositionSizingDecision {

    private final boolean allowed;

    private final String reason;

    /** Quote budget reserved for the new position (initial buy plus all scale-in phases) */
    private final double positionBudget;

    /** Quote spent on the initial buy */
    private final double initialBuyQuote;

    public static PositionSizingDecision allow(double positionBudget, double initialBuyQuote) {
        return new PositionSizingDecision(true, null, positionBudget, initialBuyQuote);
    }

    public static PositionSizingDecision refuse(String reason) {
        return new PositionSizingDecision(false, reason, 0.0, 0.0);
    }
}
