package com.example.alertengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Routing policy for one team and severity.
 */
@Entity
@Table(name = "alert_severity_routing",
        uniqueConstraints = @UniqueConstraint(name = "uq_severity_routing", columnNames = {"team_id", "severity"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeverityRouting {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "team_id", nullable = false)
    private String teamId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Severity severity;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "severity_routing_users", joinColumns = @JoinColumn(name = "routing_id"))
    @OrderColumn(name = "user_position")
    @Column(name = "user_id")
    @Builder.Default
    private List<String> assignedUsers = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "severity_routing_channels", joinColumns = @JoinColumn(name = "routing_id"))
    @OrderColumn(name = "channel_position")
    @Column(name = "channel")
    @Builder.Default
    private List<String> assignedChannels = new ArrayList<>();

    @Column(name = "initial_delay_minutes")
    @Builder.Default
    private int initialDelayMinutes = 0;

    @Column(name = "escalation_interval_minutes")
    @Builder.Default
    private int escalationIntervalMinutes = 30;

    @Column(name = "max_escalation_level")
    @Builder.Default
    private int maxEscalationLevel = 3;

    @Column(name = "business_hours_only")
    private boolean businessHoursOnly;

    @Column(name = "weekend_escalation")
    @Builder.Default
    private boolean weekendEscalation = true;

    @Column(name = "auto_acknowledge_minutes")
    private Integer autoAcknowledgeMinutes;

    @Column(name = "auto_resolve_minutes")
    private Integer autoResolveMinutes;

    @Builder.Default
    private boolean enabled = true;

    /** Lower number wins when several rows could apply. */
    @Builder.Default
    private int priority = 1;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
