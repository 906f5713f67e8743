package com.example.alertengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Immutable audit record of one suppression decision, whatever its outcome.
 */
@Entity
@Table(name = "alert_suppression_log", indexes = {
        @Index(name = "idx_suppression_log_alert", columnList = "alert_id"),
        @Index(name = "idx_suppression_log_created", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuppressionLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "alert_id", nullable = false)
    private String alertId;

    @Column(nullable = false)
    private boolean suppressed;

    @Column(nullable = false, length = 100)
    private String reason;

    @Column(name = "suppression_rule_id")
    private String suppressionRuleId;

    @Column(name = "maintenance_window_id")
    private String maintenanceWindowId;

    @Column(name = "suppress_until")
    private Instant suppressUntil;

    /** JSON details of the decision */
    @Column(length = 4096)
    private String metadata;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
