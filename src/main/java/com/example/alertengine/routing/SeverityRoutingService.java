package com.example.alertengine.routing;

import com.example.alertengine.config.AlertingProperties;
import com.example.alertengine.config.AlertingProperties.RoutingConfig.RoutingDefaults;
import com.example.alertengine.domain.EscalationConfig;
import com.example.alertengine.domain.Severity;
import com.example.alertengine.exception.ConfigurationException;
import com.example.alertengine.repository.SeverityRoutingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves the routing policy for a team and severity.
 * <p>
 * The team's severity overrides pick the severity to look up; among the enabled routing
 * rows for it the lowest priority value wins, id breaking ties. Without a row the
 * configured per-severity defaults apply.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SeverityRoutingService {

    private final SeverityRoutingRepository routingRepository;
    private final EscalationConfigService escalationConfigService;
    private final AlertingProperties properties;

    public RoutingPolicy resolveRouting(String teamId, Severity severity) {
        EscalationConfig config = escalationConfigService.configFor(teamId);
        return resolveRouting(teamId, severity, config);
    }

    public RoutingPolicy resolveRouting(String teamId, Severity severity, EscalationConfig config) {
        Severity routingSeverity = config.routingSeverity(severity);
        return routingRepository
                .findByTeamIdAndSeverityAndEnabledTrueOrderByPriorityAscIdAsc(teamId, routingSeverity)
                .stream()
                .findFirst()
                .map(row -> RoutingPolicy.of(row, severity))
                .orElseGet(() -> defaults(teamId, severity, routingSeverity));
    }

    private RoutingPolicy defaults(String teamId, Severity severity, Severity routingSeverity) {
        RoutingDefaults defaults = properties.getRouting().getDefaults().get(routingSeverity);
        if (defaults == null) {
            throw new ConfigurationException("No routing for team " + teamId
                    + " and no default routing for severity " + routingSeverity.code());
        }
        log.debug("Team {} has no routing row for {}, using defaults", teamId, routingSeverity.code());
        return RoutingPolicy.of(defaults, teamId, severity, routingSeverity);
    }
}
