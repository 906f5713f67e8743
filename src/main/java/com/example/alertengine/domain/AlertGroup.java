package com.example.alertengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * A rolling cluster of related alerts collapsed under one group key.
 */
@Entity
@Table(name = "alert_groups",
        uniqueConstraints = @UniqueConstraint(name = "uq_alert_groups_key_start",
                columnNames = {"group_key", "team_id", "first_alert_at"}),
        indexes = {
                @Index(name = "idx_alert_groups_key", columnList = "group_key"),
                @Index(name = "idx_alert_groups_last_alert", columnList = "last_alert_at")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "group_key", nullable = false, length = 500)
    private String groupKey;

    @Column(name = "team_id")
    private String teamId;

    @Column(name = "metric_name", nullable = false)
    private String metricName;

    @Column(name = "first_alert_id", nullable = false)
    private String firstAlertId;

    @Column(name = "last_alert_id", nullable = false)
    private String lastAlertId;

    @Column(name = "alert_count", nullable = false)
    @Builder.Default
    private int alertCount = 1;

    /** Most urgent severity observed in the group. */
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Severity severity;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "alert_group_severities", joinColumns = @JoinColumn(name = "group_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "severity")
    @Builder.Default
    private Set<Severity> severities = new HashSet<>();

    @Column(name = "first_alert_at", nullable = false)
    private Instant firstAlertAt;

    @Column(name = "last_alert_at", nullable = false)
    private Instant lastAlertAt;

    @Column(name = "suppression_applied")
    private boolean suppressionApplied;

    @Column(name = "suppressed_at")
    private Instant suppressedAt;

    @Version
    private Long version;

    /** Computed at read time rather than maintained, so writers with skewed clocks cannot drift it. */
    @Transient
    public Duration getTimeSpan() {
        if (firstAlertAt == null || lastAlertAt == null) return Duration.ZERO;
        return Duration.between(firstAlertAt, lastAlertAt);
    }
}
