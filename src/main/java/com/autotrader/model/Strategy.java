package com.autotrader.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Named configuration template governing how positions are sized and exited.
 * <p>
 * The monitoring engine only reads strategies: budget limits cap new entries and the
 * default templates are copied into each position at creation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Strategy {

    private String id;

    private String name;

    @Builder.Default
    private boolean enabled = true;

    private Instant createdAt;

    private Instant lastRunAt;

    // Budget limits
    private int maxConcurrentPositions;
    private double maxPositionSize;
    private double totalBudget;

    // Templates copied into new positions
    private ExitRules defaultExitRules;
    private ScaleInPlan defaultScaleInPlan;

    @Builder.Default
    private NotificationSettings notifications = new NotificationSettings();

    @Builder.Default
    private StrategyStats stats = new StrategyStats();

    public synchronized Strategy snapshot() {
        return Strategy.builder()
                .id(id)
                .name(name)
                .enabled(enabled)
                .createdAt(createdAt)
                .lastRunAt(lastRunAt)
                .maxConcurrentPositions(maxConcurrentPositions)
                .maxPositionSize(maxPositionSize)
                .totalBudget(totalBudget)
                .defaultExitRules(defaultExitRules != null ? defaultExitRules.copy() : null)
                .defaultScaleInPlan(defaultScaleInPlan != null ? defaultScaleInPlan.copy() : null)
                .notifications(notifications != null ? notifications.copy() : new NotificationSettings())
                .stats(stats != null ? stats.copy() : new StrategyStats())
                .build();
    }
}
