package com.autotrader.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Trailing stop settings.
 * <p>
 * Activation happens once the peak price profit reaches {@code triggerPercent};
 * after that the position is closed when price retraces {@code distancePercent}
 * from the peak.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrailingStopConfig {

    private boolean enabled;

    private double triggerPercent;

    private double distancePercent;

    public TrailingStopConfig copy() {
        return new TrailingStopConfig(enabled, triggerPercent, distancePercent);
    }

    public static TrailingStopConfig disabled() {
        return new TrailingStopConfig(false, 0.0, 0.0);
    }
}
