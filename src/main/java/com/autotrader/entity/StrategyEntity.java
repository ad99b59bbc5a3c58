package com.autotrader.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Entity for persisting strategies with their default templates and running stats.
 */
@Entity
@Table(name = "strategies", indexes = {
    @Index(name = "idx_strategy_name", columnList = "name")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StrategyEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 100)
    private String name;

    private boolean enabled;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant lastRunAt;

    // Budget limits
    private int maxConcurrentPositions;

    private double maxPositionSize;

    private double totalBudget;

    @Column(nullable = false)
    private int schemaVersion;

    @Column(columnDefinition = "TEXT")
    private String defaultExitRulesJson;

    @Column(columnDefinition = "TEXT")
    private String defaultScaleInPlanJson;

    // Notification flags
    private boolean notifyOnEntry;

    private boolean notifyOnExit;

    private boolean notifyOnError;

    // Stats
    private int totalTrades;

    private int successfulTrades;

    private int failedTrades;

    private double realizedProfit;
}
