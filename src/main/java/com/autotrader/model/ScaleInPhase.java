package com.autotrader.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A pre-planned additional buy triggered by a drop from the original entry price.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScaleInPhase {

    private int phaseNumber;

    /** Percent drop from the original entry price that fires this phase */
    private double triggerDropPercent;

    /** Fraction of the position budget spent by this phase, in (0, 1] */
    private double sizeFraction;

    private boolean executed;

    private Instant executedAt;

    private Double executionPrice;

    private Double amountBought;

    public ScaleInPhase copy() {
        return new ScaleInPhase(phaseNumber, triggerDropPercent, sizeFraction,
                executed, executedAt, executionPrice, amountBought);
    }
}
