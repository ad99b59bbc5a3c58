package com.autotrader.entity;

import com.autotrader.model.ExitReason;
import com.autotrader.model.PositionStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Entity for persisting positions.
 * Exit rules, scale-in plan and sell history are stored as versioned JSON text.
 */
@Entity
@Table(name = "positions", indexes = {
    @Index(name = "idx_position_status", columnList = "status"),
    @Index(name = "idx_position_strategy", columnList = "strategyId"),
    @Index(name = "idx_position_token", columnList = "tokenId")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 128)
    private String tokenId;

    @Column(length = 32)
    private String tokenSymbol;

    @Column(length = 64)
    private String strategyId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PositionStatus status;

    @Column(nullable = false)
    private double entryPrice;

    @Column(nullable = false)
    private Instant entryTimestamp;

    private double averageEntryPrice;

    private double amountTotal;

    private double amountRemaining;

    private double budgetQuote;

    private double investedQuote;

    private double currentPrice;

    private double highestPriceSeen;

    private boolean trailingStopActivated;

    @Column(nullable = false)
    private int schemaVersion;

    @Column(columnDefinition = "TEXT")
    private String exitRulesJson;

    @Column(columnDefinition = "TEXT")
    private String scaleInPlanJson;

    @Column(columnDefinition = "TEXT")
    private String sellHistoryJson;

    // Exit details
    private Double exitPrice;

    private Double realizedProfitPercent;

    @Enumerated(EnumType.STRING)
    @Column(length = 30)
    private ExitReason closeReason;

    private Instant closedAt;

    @Column(length = 128)
    private String exitTxRef;

    private double quoteReceived;

    // Failure details
    @Column(length = 1000)
    private String lastError;

    private Instant lastActionAttemptAt;

    private boolean manualInterventionRequired;

    private Instant lastCheckedAt;

    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
