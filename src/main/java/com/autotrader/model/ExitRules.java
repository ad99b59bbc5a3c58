package com.autotrader.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Exit rule snapshot attached to a position at creation time.
 * <p>
 * Percent thresholds are measured against the position's cost basis. A null or
 * non-positive threshold disables the corresponding rule. Only the executed flags
 * of the partial profit levels change after the snapshot is taken.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExitRules {

    private Double stopLossPercent;

    private Double takeProfitPercent;

    @Builder.Default
    private TrailingStopConfig trailingStop = TrailingStopConfig.disabled();

    /** Kept sorted by ascending threshold */
    @Builder.Default
    private List<PartialProfitLevel> partialProfitLevels = new ArrayList<>();

    private Long maxHoldTimeSeconds;

    public boolean hasStopLoss() {
        return stopLossPercent != null && stopLossPercent > 0;
    }

    public boolean hasTakeProfit() {
        return takeProfitPercent != null && takeProfitPercent > 0;
    }

    public boolean hasMaxHoldTime() {
        return maxHoldTimeSeconds != null && maxHoldTimeSeconds > 0;
    }

    public boolean hasTrailingStop() {
        return trailingStop != null && trailingStop.isEnabled();
    }

    /**
     * Sum of sell fractions over levels already executed.
     */
    public PartialProfitLevel findLevel(String levelId) {
        for (PartialProfitLevel level : partialProfitLevels) {
            if (level.getLevelId().equals(levelId)) {
                return level;
            }
        }
        return null;
    }

    /**
     * Deep copy so that templates are never shared between positions.
     */
    public ExitRules copy() {
        List<PartialProfitLevel> levels = new ArrayList<>(partialProfitLevels.size());
        for (PartialProfitLevel level : partialProfitLevels) {
            levels.add(level.copy());
        }
        levels.sort(Comparator.comparingDouble(PartialProfitLevel::getThresholdPercent));
        return new ExitRules(stopLossPercent, takeProfitPercent,
                trailingStop != null ? trailingStop.copy() : TrailingStopConfig.disabled(),
                levels, maxHoldTimeSeconds);
    }
}
