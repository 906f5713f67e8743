package com.example.alertengine.suppression;

import com.example.alertengine.config.AlertingProperties;
import com.example.alertengine.domain.AlertRule;
import com.example.alertengine.domain.AlertStatus;
import com.example.alertengine.domain.MaintenanceWindow;
import com.example.alertengine.domain.Severity;
import com.example.alertengine.domain.SuppressionRule;
import com.example.alertengine.exception.ConfigurationException;
import com.example.alertengine.repository.AlertRepository;
import com.example.alertengine.repository.AlertRuleRepository;
import com.example.alertengine.repository.MaintenanceWindowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether an alert is suppressed. Checks run in a fixed order and the first
 * match wins:
 * <ol>
 *   <li>an active maintenance window covering the alert's metric or severity</li>
 *   <li>another open alert on the same rule within the duplicate window</li>
 *   <li>the rule's hourly cap, then the configured rate-limit windows</li>
 *   <li>team and global custom suppression rules, by descending priority</li>
 * </ol>
 * The engine reads current state only; persisting the decision is the caller's job.
 * Lookup failures surface as {@link ConfigurationException} and never default to an outcome.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SuppressionDecisionEngine {

    private static final EnumSet<AlertStatus> OPEN = EnumSet.of(AlertStatus.ACTIVE, AlertStatus.ACKNOWLEDGED);

    private final AlertRuleRepository alertRuleRepository;
    private final AlertRepository alertRepository;
    private final MaintenanceWindowRepository maintenanceWindowRepository;
    private final RateLimitTracker rateLimitTracker;
    private final SuppressionRuleMatcher ruleMatcher;
    private final AlertingProperties properties;
    private final Clock clock;

    public SuppressionDecision evaluate(String alertId, String ruleId, String metricName,
                                        Severity severity, String teamId) {
        return evaluate(new AlertFacts(alertId, ruleId, teamId, metricName, severity, Map.of()));
    }

    public SuppressionDecision evaluate(AlertFacts alert) {
        if (alert.alertId() == null || alert.ruleId() == null || alert.severity() == null) {
            throw new ConfigurationException("Alert id, rule id and severity are required for evaluation");
        }
        AlertRule rule = alertRuleRepository.findById(alert.ruleId())
                .orElseThrow(() -> new ConfigurationException("Unknown alert rule: " + alert.ruleId()));
        Instant now = clock.instant();

        SuppressionDecision decision = checkMaintenanceWindows(alert, now)
                .or(() -> checkDuplicates(alert, now))
                .or(() -> checkRateLimits(alert, rule, now))
                .or(() -> checkCustomRules(alert, now))
                .orElseGet(SuppressionDecision::allow);

        log.debug("Alert {} ({} / {}): {}", alert.alertId(), alert.metricName(),
                alert.severity().code(), decision.reason().code());
        return decision;
    }

    private Optional<SuppressionDecision> checkMaintenanceWindows(AlertFacts alert, Instant now) {
        return maintenanceWindowRepository.findActive(now, alert.teamId()).stream()
                .filter(window -> window.matches(alert.metricName(), alert.severity()))
                .findFirst()
                .map(window -> SuppressionDecision.suppress(
                        SuppressionReason.MAINTENANCE_WINDOW, window.getEndTime(), windowMetadata(window)));
    }

    private Optional<SuppressionDecision> checkDuplicates(AlertFacts alert, Instant now) {
        Duration window = Duration.ofMinutes(properties.getSuppression().getDuplicateWindowMinutes());
        long duplicates = alertRepository.countForRuleWithStatusSince(
                alert.ruleId(), alert.alertId(), OPEN, now.minus(window));
        if (duplicates == 0) return Optional.empty();
        return Optional.of(SuppressionDecision.suppress(SuppressionReason.DUPLICATE_ALERT, now.plus(window),
                Map.of("duplicate_count", duplicates, "window_minutes", window.toMinutes())));
    }

    private Optional<SuppressionDecision> checkRateLimits(AlertFacts alert, AlertRule rule, Instant now) {
        Duration window = Duration.ofMinutes(properties.getSuppression().getRateLimitWindowMinutes());
        long recent = alertRepository.countForRuleSince(rule.getId(), alert.alertId(), now.minus(window));
        if (recent >= rule.getMaxAlertsPerHour()) {
            return Optional.of(SuppressionDecision.suppress(SuppressionReason.RATE_LIMIT_EXCEEDED, now.plus(window),
                    Map.of("limit_scope", "rule",
                            "alert_count", recent,
                            "max_alerts_per_hour", rule.getMaxAlertsPerHour())));
        }
        return rateLimitTracker.check(alert, now);
    }

    private Optional<SuppressionDecision> checkCustomRules(AlertFacts alert, Instant now) {
        return ruleMatcher.firstMatch(alert, now).map(rule -> SuppressionDecision.suppress(
                SuppressionReason.CUSTOM_RULE,
                now.plus(Duration.ofMinutes(rule.getSuppressionDurationMinutes())),
                ruleMetadata(rule)));
    }

    private static Map<String, Object> windowMetadata(MaintenanceWindow window) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("maintenance_window_id", window.getId());
        metadata.put("window_name", window.getName());
        metadata.put("suppress_all", window.isSuppressAll());
        metadata.put("priority", window.getPriority());
        return metadata;
    }

    private static Map<String, Object> ruleMetadata(SuppressionRule rule) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("rule_id", rule.getId());
        metadata.put("rule_name", rule.getName());
        metadata.put("rule_type", rule.getRuleType().name().toLowerCase(Locale.ROOT));
        metadata.put("priority", rule.getPriority());
        return metadata;
    }
}
