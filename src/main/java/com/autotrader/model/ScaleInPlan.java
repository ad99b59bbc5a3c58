package com.autotrader.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered scale-in phases plus a pointer to the next phase to execute.
 * Phases run strictly in order and each runs at most once.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScaleInPlan {

    private boolean enabled;

    @Builder.Default
    private List<ScaleInPhase> phases = new ArrayList<>();

    /** Index into {@link #phases} of the next phase to execute */
    private int currentPhase;

    public boolean hasRemainingPhases() {
        return enabled && currentPhase < phases.size();
    }

    public ScaleInPhase nextPendingPhase() {
        return hasRemainingPhases() ? phases.get(currentPhase) : null;
    }

    public double totalSizeFraction() {
        double sum = 0.0;
        for (ScaleInPhase phase : phases) {
            sum += phase.getSizeFraction();
        }
        return sum;
    }

    public double executedSizeFraction() {
        double sum = 0.0;
        for (ScaleInPhase phase : phases) {
            if (phase.isExecuted()) {
                sum += phase.getSizeFraction();
            }
        }
        return sum;
    }

    public ScaleInPlan copy() {
        List<ScaleInPhase> copies = new ArrayList<>(phases.size());
        for (ScaleInPhase phase : phases) {
            copies.add(phase.copy());
        }
        return new ScaleInPlan(enabled, copies, currentPhase);
    }
}
