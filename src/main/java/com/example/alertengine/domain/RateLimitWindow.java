package com.example.alertengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Counter for one rate-limit scope. The count is only ever changed through
 * atomic update statements, never by saving a loaded copy.
 */
@Entity
@Table(name = "alert_rate_limits", indexes = {
        @Index(name = "idx_rate_limits_type", columnList = "limit_type"),
        @Index(name = "idx_rate_limits_window", columnList = "window_start, next_reset_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitWindow {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "limit_type", nullable = false)
    private LimitType limitType;

    @Column(name = "rule_id")
    private String ruleId;

    @Column(name = "team_id")
    private String teamId;

    @Column(name = "metric_name")
    private String metricName;

    @Enumerated(EnumType.STRING)
    private Severity severity;

    @Column(name = "max_alerts", nullable = false)
    private int maxAlerts;

    @Column(name = "window_minutes", nullable = false)
    private int windowMinutes;

    @Column(name = "current_count", nullable = false)
    private int currentCount;

    @Column(name = "window_start")
    private Instant windowStart;

    @Column(name = "next_reset_at")
    private Instant nextResetAt;

    @Column(name = "last_alert_at")
    private Instant lastAlertAt;

    public enum LimitType {
        RULE, TEAM, METRIC, SEVERITY, GLOBAL
    }

    /** Count as observed at {@code now}: a window past its reset point counts as empty. */
    public int effectiveCount(Instant now) {
        if (nextResetAt == null || !now.isBefore(nextResetAt)) return 0;
        return currentCount;
    }

    public String scope() {
        return switch (limitType) {
            case RULE -> ruleId;
            case TEAM -> teamId;
            case METRIC -> metricName;
            case SEVERITY -> severity == null ? null : severity.code();
            case GLOBAL -> "global";
        };
    }
}
