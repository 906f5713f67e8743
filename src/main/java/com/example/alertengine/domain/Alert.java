package com.example.alertengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * An alert produced by the detection pipeline. The engine reads it and annotates
 * suppression, escalation and lifecycle state; the id is assigned upstream.
 */
@Entity
@Table(name = "alerts", indexes = {
        @Index(name = "idx_alerts_rule_status", columnList = "rule_id, status"),
        @Index(name = "idx_alerts_next_escalation", columnList = "next_escalation_at"),
        @Index(name = "idx_alerts_team_status", columnList = "team_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    /** Escalation level of an alert nobody has been assigned to yet. */
    public static final int UNASSIGNED_LEVEL = -1;

    @Id
    private String id;

    @Column(name = "rule_id", nullable = false)
    private String ruleId;

    @Column(name = "team_id")
    private String teamId;

    @Column(name = "metric_name", nullable = false)
    private String metricName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Severity severity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AlertStatus status;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "alert_dimensions", joinColumns = @JoinColumn(name = "alert_id"))
    @MapKeyColumn(name = "dimension_name")
    @Column(name = "dimension_value")
    @Builder.Default
    private Map<String, String> dimensions = new HashMap<>();

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "acknowledged_at")
    private Instant acknowledgedAt;

    @Column(name = "acknowledged_by")
    private String acknowledgedBy;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolved_by")
    private String resolvedBy;

    @Column(name = "auto_resolved")
    private boolean autoResolved;

    @Column(name = "suppressed_until")
    private Instant suppressedUntil;

    @Column(name = "escalation_level")
    @Builder.Default
    private int escalationLevel = UNASSIGNED_LEVEL;

    @Column(name = "last_escalated_at")
    private Instant lastEscalatedAt;

    @Column(name = "next_escalation_at")
    private Instant nextEscalationAt;

    @Version
    private Long version;

    public boolean isOpen() {
        return status == AlertStatus.ACTIVE || status == AlertStatus.ACKNOWLEDGED;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        if (status == null) status = AlertStatus.ACTIVE;
    }
}
