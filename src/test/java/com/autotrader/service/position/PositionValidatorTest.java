package com.autotrader.service.position;

import com.autotrader.exception.InvalidInputException;
import com.autotrader.model.ExitRules;
import com.autotrader.model.PartialProfitLevel;
import com.autotrader.model.ScaleInPhase;
import com.autotrader.model.ScaleInPlan;
import com.autotrader.model.TrailingStopConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PositionValidatorTest {

    private static PartialProfitLevel level(String id, double threshold, double fraction) {
        return PartialProfitLevel.builder().levelId(id).thresholdPercent(threshold).sellFraction(fraction).build();
    }

    private static ExitRules withLevels(PartialProfitLevel... levels) {
        return ExitRules.builder()
                .stopLossPercent(10.0)
                .partialProfitLevels(new ArrayList<>(List.of(levels)))
                .build();
    }

    private static ScaleInPhase phase(int number, double drop, double fraction) {
        return ScaleInPhase.builder().phaseNumber(number).triggerDropPercent(drop).sizeFraction(fraction).build();
    }

    @Nested
    @DisplayName("Exit Rules")
    class ExitRulesTests {

        @Test
        @DisplayName("Should sort levels by threshold and assign missing ids")
        void normalizesLevels() {
            ExitRules normalized = PositionValidator.normalizeExitRules(withLevels(
                    level(null, 30.0, 0.2),
                    level("L1", 10.0, 0.2),
                    level(null, 20.0, 0.2)));

            List<PartialProfitLevel> levels = normalized.getPartialProfitLevels();
            assertEquals(List.of(10.0, 20.0, 30.0),
                    levels.stream().map(PartialProfitLevel::getThresholdPercent).toList());
            assertEquals("L1", levels.get(0).getLevelId());
            assertEquals("L2", levels.get(1).getLevelId());
            assertEquals("L3", levels.get(2).getLevelId());
        }

        @Test
        @DisplayName("Should return a copy and leave the input untouched")
        void doesNotModifyInput() {
            ExitRules input = withLevels(level(null, 30.0, 0.2), level(null, 10.0, 0.2));

            ExitRules normalized = PositionValidator.normalizeExitRules(input);
            normalized.getPartialProfitLevels().get(0).setExecuted(true);

            assertNull(input.getPartialProfitLevels().get(0).getLevelId());
            assertEquals(30.0, input.getPartialProfitLevels().get(0).getThresholdPercent());
            assertFalse(input.getPartialProfitLevels().get(1).isExecuted());
        }

        @Test
        @DisplayName("Should reject fractions summing above one")
        void rejectsOverselling() {
            assertThrows(InvalidInputException.class, () -> PositionValidator.normalizeExitRules(
                    withLevels(level("A", 10.0, 0.6), level("B", 20.0, 0.5))));
        }

        @Test
        @DisplayName("Should accept fractions summing to exactly one")
        void acceptsFullLadder() {
            assertDoesNotThrow(() -> PositionValidator.normalizeExitRules(
                    withLevels(level("A", 10.0, 0.1), level("B", 20.0, 0.2), level("C", 30.0, 0.7))));
        }

        @Test
        @DisplayName("Should reject duplicate level ids, zero thresholds and fractions outside (0, 1]")
        void rejectsInvalidLevels() {
            assertThrows(InvalidInputException.class, () -> PositionValidator.normalizeExitRules(
                    withLevels(level("A", 10.0, 0.1), level("A", 20.0, 0.1))));
            assertThrows(InvalidInputException.class, () -> PositionValidator.normalizeExitRules(
                    withLevels(level("A", 0.0, 0.1))));
            assertThrows(InvalidInputException.class, () -> PositionValidator.normalizeExitRules(
                    withLevels(level("A", 10.0, 0.0))));
            assertThrows(InvalidInputException.class, () -> PositionValidator.normalizeExitRules(
                    withLevels(level("A", 10.0, 1.5))));
        }

        @Test
        @DisplayName("Should reject trailing distances outside (0, 100)")
        void rejectsTrailingDistance() {
            ExitRules zero = withLevels();
            zero.setTrailingStop(new TrailingStopConfig(true, 10.0, 0.0));
            ExitRules hundred = withLevels();
            hundred.setTrailingStop(new TrailingStopConfig(true, 10.0, 100.0));
            ExitRules disabled = withLevels();
            disabled.setTrailingStop(new TrailingStopConfig(false, 0.0, 0.0));

            assertThrows(InvalidInputException.class, () -> PositionValidator.normalizeExitRules(zero));
            assertThrows(InvalidInputException.class, () -> PositionValidator.normalizeExitRules(hundred));
            assertDoesNotThrow(() -> PositionValidator.normalizeExitRules(disabled));
        }

        @Test
        @DisplayName("Should require exit rules")
        void rejectsNull() {
            assertThrows(InvalidInputException.class, () -> PositionValidator.normalizeExitRules(null));
        }
    }

    @Nested
    @DisplayName("Scale-In Plans")
    class ScaleInPlanTests {

        @Test
        @DisplayName("Should pass through a null plan")
        void nullPlan() {
            assertNull(PositionValidator.normalizeScaleInPlan(null));
        }

        @Test
        @DisplayName("Should order phases by number")
        void sortsPhases() {
            ScaleInPlan plan = ScaleInPlan.builder().enabled(true)
                    .phases(new ArrayList<>(List.of(phase(2, 20.0, 0.2), phase(1, 10.0, 0.2))))
                    .build();

            ScaleInPlan normalized = PositionValidator.normalizeScaleInPlan(plan);

            assertEquals(1, normalized.getPhases().get(0).getPhaseNumber());
            assertEquals(10.0, normalized.getPhases().get(0).getTriggerDropPercent());
        }

        @Test
        @DisplayName("Should number phases in list order when numbers are missing")
        void numbersPhases() {
            ScaleInPlan plan = ScaleInPlan.builder().enabled(true)
                    .phases(new ArrayList<>(List.of(phase(0, 10.0, 0.2), phase(0, 20.0, 0.2))))
                    .build();

            ScaleInPlan normalized = PositionValidator.normalizeScaleInPlan(plan);

            assertEquals(1, normalized.getPhases().get(0).getPhaseNumber());
            assertEquals(2, normalized.getPhases().get(1).getPhaseNumber());
        }

        @Test
        @DisplayName("Should reject invalid drops, oversized fractions and duplicate numbers")
        void rejectsInvalidPlans() {
            assertThrows(InvalidInputException.class, () -> PositionValidator.normalizeScaleInPlan(
                    ScaleInPlan.builder().enabled(true).phases(new ArrayList<>(List.of(phase(1, 0.0, 0.2)))).build()));
            assertThrows(InvalidInputException.class, () -> PositionValidator.normalizeScaleInPlan(
                    ScaleInPlan.builder().enabled(true).phases(new ArrayList<>(List.of(phase(1, 100.0, 0.2)))).build()));
            assertThrows(InvalidInputException.class, () -> PositionValidator.normalizeScaleInPlan(
                    ScaleInPlan.builder().enabled(true)
                            .phases(new ArrayList<>(List.of(phase(1, 10.0, 0.6), phase(2, 20.0, 0.6)))).build()));
            assertThrows(InvalidInputException.class, () -> PositionValidator.normalizeScaleInPlan(
                    ScaleInPlan.builder().enabled(true)
                            .phases(new ArrayList<>(List.of(phase(1, 10.0, 0.2), phase(1, 20.0, 0.2)))).build()));
        }

        @Test
        @DisplayName("Should reject a current phase beyond the plan")
        void rejectsCurrentPhaseOutOfRange() {
            ScaleInPlan plan = ScaleInPlan.builder().enabled(true)
                    .phases(new ArrayList<>(List.of(phase(1, 10.0, 0.2))))
                    .currentPhase(2)
                    .build();

            assertThrows(InvalidInputException.class, () -> PositionValidator.normalizeScaleInPlan(plan));
        }
    }

    @Test
    @DisplayName("Should reject zero, negative, NaN and infinite values")
    void requirePositive() {
        assertThrows(InvalidInputException.class, () -> PositionValidator.requirePositive(0.0, "x"));
        assertThrows(InvalidInputException.class, () -> PositionValidator.requirePositive(-1.0, "x"));
        assertThrows(InvalidInputException.class, () -> PositionValidator.requirePositive(Double.NaN, "x"));
        assertThrows(InvalidInputException.class, () -> PositionValidator.requirePositive(Double.POSITIVE_INFINITY, "x"));
        assertDoesNotThrow(() -> PositionValidator.requirePositive(1e-9, "x"));
    }
}
