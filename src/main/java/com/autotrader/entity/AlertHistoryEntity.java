package com.autotrader.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Persisted record of a delivered notification.
 * Every notification that passes the strategy flags is recorded here.
 */
@Entity
@Table(name = "alert_history", indexes = {
    @Index(name = "idx_alert_timestamp", columnList = "timestamp"),
    @Index(name = "idx_alert_type", columnList = "alertType"),
    @Index(name = "idx_alert_position", columnList = "positionId")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertHistoryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Instant timestamp;

    @Column(nullable = false, length = 50)
    private String alertType; // NotificationEventType name

    @Column(length = 20)
    private String severity; // INFO, WARNING, CRITICAL

    @Column(length = 64)
    private String strategyId;

    @Column(length = 64)
    private String positionId;

    @Column(length = 128)
    private String tokenId;

    @Column(length = 2000)
    private String message;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        if (timestamp == null) {
            timestamp = createdAt;
        }
    }
}
