package com.example.alertengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One concrete on-call shift. Override entries stand in for {@code originalUserId}
 * over their range without removing the original shift.
 */
@Entity
@Table(name = "on_call_schedule_entries", indexes = {
        @Index(name = "idx_on_call_entries_range", columnList = "start_time, end_time"),
        @Index(name = "idx_on_call_entries_user", columnList = "user_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OnCallScheduleEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "schedule_id", nullable = false)
    private OnCallSchedule schedule;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Column(name = "is_primary")
    @Builder.Default
    private boolean primary = true;

    @Column(name = "backup_user_id")
    private String backupUserId;

    @Column(name = "is_override")
    private boolean override;

    @Column(name = "override_reason", length = 1024)
    private String overrideReason;

    @Column(name = "original_user_id")
    private String originalUserId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    /** Half-open containment: a shift ending at {@code now} no longer covers it. */
    public boolean covers(Instant now) {
        return !now.isBefore(startTime) && now.isBefore(endTime);
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
