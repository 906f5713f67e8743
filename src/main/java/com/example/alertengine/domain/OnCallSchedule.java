package com.example.alertengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

@Entity
@Table(name = "on_call_schedules",
        uniqueConstraints = @UniqueConstraint(name = "uq_on_call_schedule_name", columnNames = {"team_id", "name"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OnCallSchedule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "team_id", nullable = false)
    private String teamId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "schedule_type", nullable = false)
    @Builder.Default
    private ScheduleType scheduleType = ScheduleType.ROTATION;

    @Column(name = "time_zone")
    @Builder.Default
    private String timezone = "UTC";

    @Column(name = "effective_from")
    private Instant effectiveFrom;

    @Column(name = "effective_until")
    private Instant effectiveUntil;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "on_call_schedule_severities", joinColumns = @JoinColumn(name = "schedule_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "severity")
    @Builder.Default
    private Set<Severity> applicableSeverities = new HashSet<>(EnumSet.allOf(Severity.class));

    @Builder.Default
    private boolean enabled = true;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public enum ScheduleType {
        ROTATION, FIXED, FOLLOW_THE_SUN
    }

    public boolean appliesTo(Severity severity, Instant now) {
        return enabled
                && applicableSeverities.contains(severity)
                && (effectiveFrom == null || !now.isBefore(effectiveFrom))
                && (effectiveUntil == null || now.isBefore(effectiveUntil));
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
