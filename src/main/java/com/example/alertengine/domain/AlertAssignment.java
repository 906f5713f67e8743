package com.example.alertengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Records one handoff of responsibility for an alert. Only the acknowledgment
 * fields are written after creation.
 */
@Entity
@Table(name = "alert_assignments", indexes = {
        @Index(name = "idx_assignments_alert", columnList = "alert_id"),
        @Index(name = "idx_assignments_assignee", columnList = "assigned_to")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "alert_id", nullable = false)
    private String alertId;

    @Column(name = "assigned_to", nullable = false)
    private String assignedTo;

    @Column(name = "assigned_by")
    private String assignedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "assignment_reason", nullable = false)
    private AssignmentReason assignmentReason;

    @Column(name = "assignment_level", nullable = false)
    private int assignmentLevel;

    /** Minutes, derived from the alert's severity. */
    @Column(name = "expected_response_time", nullable = false)
    private int expectedResponseTime;

    @Column(name = "acknowledged_at")
    private Instant acknowledgedAt;

    @Column(name = "response_time_minutes")
    private Integer responseTimeMinutes;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public boolean isAcknowledged() {
        return acknowledgedAt != null;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
