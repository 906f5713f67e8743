package com.example.alertengine.domain;

import com.example.alertengine.domain.converter.AutoResolutionConverter;
import com.example.alertengine.domain.converter.ChannelPreferencesConverter;
import com.example.alertengine.domain.converter.SeverityOverridesConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-team escalation settings: business hours, the escalation chain, channel
 * preferences and auto-resolution per severity. Maps are keyed by severity code.
 */
@Entity
@Table(name = "team_escalation_configs",
        uniqueConstraints = @UniqueConstraint(name = "uq_escalation_config_team", columnNames = "team_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "team_id", nullable = false)
    private String teamId;

    @Embedded
    @Builder.Default
    private BusinessHours businessHours = BusinessHours.standard();

    /** Responder per escalation level: element 0 serves level 1. */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "escalation_chain", joinColumns = @JoinColumn(name = "config_id"))
    @OrderColumn(name = "chain_position")
    @Column(name = "responder")
    @Builder.Default
    private List<String> escalationChain = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "escalation_primary_contacts", joinColumns = @JoinColumn(name = "config_id"))
    @OrderColumn(name = "contact_position")
    @Column(name = "user_id")
    @Builder.Default
    private List<String> primaryContacts = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "escalation_contacts", joinColumns = @JoinColumn(name = "config_id"))
    @OrderColumn(name = "contact_position")
    @Column(name = "user_id")
    @Builder.Default
    private List<String> escalationContacts = new ArrayList<>();

    /** Remaps the severity used to look up the team's routing row. */
    @Convert(converter = SeverityOverridesConverter.class)
    @Column(name = "severity_overrides", length = 1024)
    @Builder.Default
    private Map<String, String> severityOverrides = new HashMap<>();

    @Convert(converter = ChannelPreferencesConverter.class)
    @Column(name = "notification_preferences", length = 4096)
    @Builder.Default
    private Map<String, ChannelPreference> notificationPreferences = defaultNotificationPreferences();

    @Convert(converter = AutoResolutionConverter.class)
    @Column(name = "auto_resolution", length = 2048)
    @Builder.Default
    private Map<String, AutoResolutionPolicy> autoResolution = defaultAutoResolution();

    @Builder.Default
    private boolean enabled = true;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public static EscalationConfig defaultsFor(String teamId) {
        return EscalationConfig.builder().teamId(teamId).build();
    }

    public Severity routingSeverity(Severity severity) {
        String override = severityOverrides == null ? null : severityOverrides.get(severity.code());
        return override == null ? severity : Severity.fromCode(override);
    }

    public ChannelPreference channelsFor(Severity severity) {
        ChannelPreference preference = notificationPreferences == null
                ? null : notificationPreferences.get(severity.code());
        if (preference == null) preference = defaultNotificationPreferences().get(severity.code());
        return preference;
    }

    public AutoResolutionPolicy autoResolutionFor(Severity severity) {
        AutoResolutionPolicy policy = autoResolution == null ? null : autoResolution.get(severity.code());
        return policy == null ? AutoResolutionPolicy.disabled() : policy;
    }

    public static Map<String, ChannelPreference> defaultNotificationPreferences() {
        Map<String, ChannelPreference> preferences = new HashMap<>();
        preferences.put("critical", new ChannelPreference(
                List.of("push", "sms", "in_app"), List.of("email", "slack", "webhook")));
        preferences.put("high", new ChannelPreference(List.of("push", "in_app"), List.of("email", "slack")));
        preferences.put("medium", new ChannelPreference(List.of("in_app"), List.of("email")));
        preferences.put("low", new ChannelPreference(List.of("in_app"), List.of()));
        preferences.put("info", new ChannelPreference(List.of("in_app"), List.of()));
        return preferences;
    }

    public static Map<String, AutoResolutionPolicy> defaultAutoResolution() {
        Map<String, AutoResolutionPolicy> policies = new HashMap<>();
        policies.put("critical", AutoResolutionPolicy.disabled());
        policies.put("high", AutoResolutionPolicy.disabled());
        policies.put("medium", new AutoResolutionPolicy(true, 8 * 60));
        policies.put("low", new AutoResolutionPolicy(true, 24 * 60));
        policies.put("info", new AutoResolutionPolicy(true, 48 * 60));
        return policies;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
