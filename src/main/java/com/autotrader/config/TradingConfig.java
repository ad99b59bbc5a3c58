package com.autotrader.config;

import com.autotrader.model.ExitRules;
import com.autotrader.model.PartialProfitLevel;
import com.autotrader.model.TrailingStopConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Trading defaults: exit rules applied when a request supplies none, and
 * the slippage used for each kind of trade.
 */
@Configuration
@ConfigurationProperties(prefix = "trading")
@Data
public class TradingConfig {

    // Default exit rules (can be overridden per position or per strategy)
    private double defaultStopLossPercent = 10.0;
    private double defaultTakeProfitPercent = 30.0;
    private boolean defaultTrailingStopEnabled = false;
    private double defaultTrailingTriggerPercent = 10.0;
    private double defaultTrailingDistancePercent = 12.0;
    private long defaultMaxHoldTimeSeconds = 4 * 60 * 60;

    /** Default partial profit ladder: at 30% sell 20%, at 50% sell 30%, at 100% sell 40% */
    private List<Level> defaultPartialLevels = new ArrayList<>(List.of(
            new Level(30.0, 0.20),
            new Level(50.0, 0.30),
            new Level(100.0, 0.40)));

    // Execution options
    private double buySlippagePercent = 1.0;
    private double sellSlippagePercent = 2.0;

    /** Wider tolerance so protective exits go through in a falling market */
    private double stopLossSellSlippagePercent = 5.0;

    private int executorMaxRetries = 2;

    public ExitRules defaultExitRules() {
        List<PartialProfitLevel> levels = new ArrayList<>();
        int i = 1;
        for (Level level : defaultPartialLevels) {
            levels.add(PartialProfitLevel.builder()
                    .levelId("L" + i++)
                    .thresholdPercent(level.getThresholdPercent())
                    .sellFraction(level.getSellFraction())
                    .build());
        }
        return ExitRules.builder()
                .stopLossPercent(defaultStopLossPercent)
                .takeProfitPercent(defaultTakeProfitPercent)
                .trailingStop(new TrailingStopConfig(defaultTrailingStopEnabled,
                        defaultTrailingTriggerPercent, defaultTrailingDistancePercent))
                .partialProfitLevels(levels)
                .maxHoldTimeSeconds(defaultMaxHoldTimeSeconds)
                .build();
    }

    @Data
    public static class Level {
        private double thresholdPercent;
        private double sellFraction;

        public Level() {
        }

        public Level(double thresholdPercent, double sellFraction) {
            this.thresholdPercent = thresholdPercent;
            this.sellFraction = sellFraction;
        }
    }
}
