package com.autotrader.service.position;

import com.autotrader.exception.InvalidInputException;
import com.autotrader.model.ExitRules;
import com.autotrader.model.PartialProfitLevel;
import com.autotrader.model.ScaleInPhase;
import com.autotrader.model.ScaleInPlan;
import com.autotrader.model.TrailingStopConfig;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validation and normalization of exit rules and scale-in plans.
 * <p>
 * Every method either returns a fresh normalized copy or throws {@link InvalidInputException};
 * the input is never modified.
 */
public final class PositionValidator {

    /** Tolerance for fraction sums such as 0.1 + 0.2 + 0.7 */
    private static final double FRACTION_EPSILON = 1e-9;

    private PositionValidator() {
    }

    public static void requirePositive(double value, String name) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new InvalidInputException(name + " must be a positive number, got " + value);
        }
    }

    /**
     * Deep copy of the rules with levels sorted by threshold and missing level ids assigned.
     */
    public static ExitRules normalizeExitRules(ExitRules rules) {
        if (rules == null) {
            throw new InvalidInputException("Exit rules are required");
        }
        requireFiniteOrNull(rules.getStopLossPercent(), "stopLossPercent");
        requireFiniteOrNull(rules.getTakeProfitPercent(), "takeProfitPercent");

        TrailingStopConfig trailing = rules.getTrailingStop();
        if (trailing != null && trailing.isEnabled()) {
            if (!(trailing.getDistancePercent() > 0) || trailing.getDistancePercent() >= 100) {
                throw new InvalidInputException("Trailing stop distancePercent must be in (0, 100)");
            }
            if (!(trailing.getTriggerPercent() >= 0) || Double.isInfinite(trailing.getTriggerPercent())) {
                throw new InvalidInputException("Trailing stop triggerPercent must be >= 0");
            }
        }

        List<PartialProfitLevel> levels = rules.getPartialProfitLevels() != null
                ? rules.getPartialProfitLevels() : List.of();
        double fractionSum = 0.0;
        for (PartialProfitLevel level : levels) {
            if (level == null) {
                throw new InvalidInputException("Partial profit level must not be null");
            }
            requirePositive(level.getThresholdPercent(), "Partial profit thresholdPercent");
            requireFraction(level.getSellFraction(), "Partial profit sellFraction");
            fractionSum += level.getSellFraction();
        }
        if (fractionSum > 1.0 + FRACTION_EPSILON) {
            throw new InvalidInputException("Partial profit sell fractions sum to " + fractionSum + ", must not exceed 1.0");
        }

        ExitRules copy = new ExitRules(rules.getStopLossPercent(), rules.getTakeProfitPercent(),
                trailing != null ? trailing : TrailingStopConfig.disabled(),
                new ArrayList<>(levels), rules.getMaxHoldTimeSeconds()).copy();

        Set<String> ids = new HashSet<>();
        for (PartialProfitLevel level : copy.getPartialProfitLevels()) {
            String id = level.getLevelId();
            if (id != null && !id.isBlank() && !ids.add(id)) {
                throw new InvalidInputException("Duplicate partial profit level id: " + id);
            }
        }
        int n = 1;
        for (PartialProfitLevel level : copy.getPartialProfitLevels()) {
            if (level.getLevelId() == null || level.getLevelId().isBlank()) {
                String id;
                do {
                    id = "L" + n++;
                } while (!ids.add(id));
                level.setLevelId(id);
            }
        }
        return copy;
    }

    /**
     * Deep copy of the plan with phases ordered by phase number and missing numbers assigned.
     * Returns null for a null plan.
     */
    public static ScaleInPlan normalizeScaleInPlan(ScaleInPlan plan) {
        if (plan == null) {
            return null;
        }
        List<ScaleInPhase> phases = new ArrayList<>();
        double fractionSum = 0.0;
        for (ScaleInPhase phase : plan.getPhases() != null ? plan.getPhases() : List.<ScaleInPhase>of()) {
            if (phase == null) {
                throw new InvalidInputException("Scale-in phase must not be null");
            }
            if (!(phase.getTriggerDropPercent() > 0) || phase.getTriggerDropPercent() >= 100) {
                throw new InvalidInputException("Scale-in triggerDropPercent must be in (0, 100)");
            }
            requireFraction(phase.getSizeFraction(), "Scale-in sizeFraction");
            fractionSum += phase.getSizeFraction();
            phases.add(phase.copy());
        }
        if (fractionSum > 1.0 + FRACTION_EPSILON) {
            throw new InvalidInputException("Scale-in size fractions sum to " + fractionSum + ", must not exceed 1.0");
        }

        if (phases.stream().allMatch(p -> p.getPhaseNumber() > 0)) {
            phases.sort(Comparator.comparingInt(ScaleInPhase::getPhaseNumber));
        } else {
            for (int i = 0; i < phases.size(); i++) {
                phases.get(i).setPhaseNumber(i + 1);
            }
        }
        Set<Integer> numbers = new HashSet<>();
        for (ScaleInPhase phase : phases) {
            if (!numbers.add(phase.getPhaseNumber())) {
                throw new InvalidInputException("Duplicate scale-in phase number: " + phase.getPhaseNumber());
            }
        }

        int currentPhase = plan.getCurrentPhase();
        if (currentPhase < 0 || currentPhase > phases.size()) {
            throw new InvalidInputException("Scale-in currentPhase out of range: " + currentPhase);
        }
        return new ScaleInPlan(plan.isEnabled(), phases, currentPhase);
    }

    private static void requireFraction(double value, String name) {
        if (!(value > 0) || value > 1.0) {
            throw new InvalidInputException(name + " must be in (0, 1], got " + value);
        }
    }

    private static void requireFiniteOrNull(Double value, String name) {
        if (value != null && (value.isNaN() || value.isInfinite())) {
            throw new InvalidInputException(name + " must be a finite number");
        }
    }
}
