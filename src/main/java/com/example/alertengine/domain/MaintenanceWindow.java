package com.example.alertengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.Set;

/**
 * Scheduled suppression window. Active purely by virtue of {@code now} falling
 * inside [startTime, endTime].
 */
@Entity
@Table(name = "maintenance_windows", indexes = {
        @Index(name = "idx_maintenance_windows_range", columnList = "start_time, end_time"),
        @Index(name = "idx_maintenance_windows_team", columnList = "team_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceWindow {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(length = 2048)
    private String description;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Column(name = "time_zone")
    @Builder.Default
    private String timezone = "UTC";

    /** Metric names targeted by the window. */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "maintenance_window_systems", joinColumns = @JoinColumn(name = "window_id"))
    @Column(name = "metric_name")
    @Builder.Default
    private Set<String> affectedSystems = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "maintenance_window_severities", joinColumns = @JoinColumn(name = "window_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "severity")
    @Builder.Default
    private Set<Severity> affectedSeverities = new HashSet<>();

    @Column(name = "suppress_all")
    private boolean suppressAll;

    /** Higher wins when several windows match the same alert. */
    @Builder.Default
    private int priority = 0;

    @Column(name = "notify_before_minutes")
    @Builder.Default
    private int notifyBeforeMinutes = 30;

    @Builder.Default
    private boolean enabled = true;

    private boolean recurring;

    @Embedded
    private Recurrence recurrence;

    @Column(name = "occurrence")
    @Builder.Default
    private int occurrence = 1;

    /** Start of the first occurrence; later occurrences are counted from it. */
    @Column(name = "recurrence_anchor")
    private Instant recurrenceAnchor;

    @Column(name = "team_id")
    private String teamId;

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean isActiveAt(Instant now) {
        return enabled && !now.isBefore(startTime) && !now.isAfter(endTime);
    }

    public boolean matches(String metricName, Severity severity) {
        return suppressAll
                || (metricName != null && affectedSystems.contains(metricName))
                || (severity != null && affectedSeverities.contains(severity));
    }

    public ZoneId zone() {
        return timezone == null || timezone.isBlank() ? ZoneId.of("UTC") : ZoneId.of(timezone);
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        if (recurrenceAnchor == null) recurrenceAnchor = startTime;
        updatedAt = createdAt;
    }
}
