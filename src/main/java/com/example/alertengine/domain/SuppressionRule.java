package com.example.alertengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Team-defined (or global, when teamId is null) suppression rule.
 * Conditions are stored as a JSON predicate document, see
 * {@link com.example.alertengine.suppression.condition.ConditionCodec}.
 */
@Entity
@Table(name = "alert_suppression_rules", indexes = {
        @Index(name = "idx_suppression_rules_team", columnList = "team_id"),
        @Index(name = "idx_suppression_rules_priority", columnList = "priority")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuppressionRule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(length = 2048)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "rule_type", nullable = false)
    private RuleType ruleType;

    @Column(name = "conditions", length = 8192)
    private String conditions;

    @Column(name = "suppression_duration_minutes", nullable = false)
    @Builder.Default
    private int suppressionDurationMinutes = 60;

    @Column(name = "max_alerts_per_window", nullable = false)
    @Builder.Default
    private int maxAlertsPerWindow = 5;

    @Column(name = "window_size_minutes", nullable = false)
    @Builder.Default
    private int windowSizeMinutes = 60;

    /** Higher number is evaluated first. */
    @Column(nullable = false)
    @Builder.Default
    private int priority = 1;

    @Builder.Default
    private boolean enabled = true;

    @Column(name = "team_id")
    private String teamId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public enum RuleType {
        DUPLICATE, RATE_LIMIT, MAINTENANCE, GROUPING, THRESHOLD, CUSTOM
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
