package com.example.alertengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Immutable trail entry for an alert: suppression, assignment, escalation,
 * acknowledgment, resolution and routing gaps.
 */
@Entity
@Table(name = "alert_history", indexes = {
        @Index(name = "idx_alert_history_alert", columnList = "alert_id"),
        @Index(name = "idx_alert_history_event", columnList = "event_type"),
        @Index(name = "idx_alert_history_created", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "alert_id", nullable = false)
    private String alertId;

    /** suppressed, assigned, escalated, acknowledged, auto_acknowledged, auto_resolved,
     *  resolved, routing_gap, maintenance_scheduled */
    @Column(name = "event_type", nullable = false, length = 50)
    private String eventType;

    @Column(name = "event_description", length = 1024)
    private String description;

    @Column(name = "performed_by")
    private String performedBy;

    /** JSON details about the event */
    @Column(length = 8192)
    private String metadata;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
