package com.example.alertengine.routing;

import com.example.alertengine.config.AlertingProperties.RoutingConfig.RoutingDefaults;
import com.example.alertengine.domain.Severity;
import com.example.alertengine.domain.SeverityRouting;

import java.util.List;

/**
 * Effective routing for one team and severity: who gets the alert and on what timetable.
 *
 * @param routingSeverity severity the routing row was looked up under, after team overrides
 * @param routingId       id of the routing row, null when built from configured defaults
 */
public record RoutingPolicy(String teamId,
                            Severity severity,
                            Severity routingSeverity,
                            String routingId,
                            List<String> assignedUsers,
                            List<String> assignedChannels,
                            int initialDelayMinutes,
                            int escalationIntervalMinutes,
                            int maxEscalationLevel,
                            boolean businessHoursOnly,
                            boolean weekendEscalation,
                            Integer autoAcknowledgeMinutes,
                            Integer autoResolveMinutes) {

    public RoutingPolicy {
        assignedUsers = assignedUsers == null ? List.of() : List.copyOf(assignedUsers);
        assignedChannels = assignedChannels == null ? List.of() : List.copyOf(assignedChannels);
    }

    static RoutingPolicy of(SeverityRouting row, Severity requested) {
        return new RoutingPolicy(row.getTeamId(), requested, row.getSeverity(), row.getId(),
                row.getAssignedUsers(), row.getAssignedChannels(),
                row.getInitialDelayMinutes(), row.getEscalationIntervalMinutes(), row.getMaxEscalationLevel(),
                row.isBusinessHoursOnly(), row.isWeekendEscalation(),
                row.getAutoAcknowledgeMinutes(), row.getAutoResolveMinutes());
    }

    static RoutingPolicy of(RoutingDefaults defaults, String teamId, Severity requested, Severity routingSeverity) {
        return new RoutingPolicy(teamId, requested, routingSeverity, null, List.of(), List.of(),
                defaults.getInitialDelayMinutes(), defaults.getEscalationIntervalMinutes(),
                defaults.getMaxEscalationLevel(), defaults.isBusinessHoursOnly(), defaults.isWeekendEscalation(),
                defaults.getAutoAcknowledgeMinutes(), defaults.getAutoResolveMinutes());
    }

    public boolean isFromDefaults() {
        return routingId == null;
    }
}
