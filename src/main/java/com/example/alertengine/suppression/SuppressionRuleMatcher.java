package com.example.alertengine.suppression;

import com.example.alertengine.domain.AlertStatus;
import com.example.alertengine.domain.SuppressionRule;
import com.example.alertengine.repository.AlertRepository;
import com.example.alertengine.repository.SuppressionRuleRepository;
import com.example.alertengine.suppression.condition.ConditionCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;

/**
 * Evaluates team-defined suppression rules against an alert. Rules are visited
 * highest priority first; the first whose conditions hold wins.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SuppressionRuleMatcher {

    private static final EnumSet<AlertStatus> OPEN = EnumSet.of(AlertStatus.ACTIVE, AlertStatus.ACKNOWLEDGED);

    private final SuppressionRuleRepository ruleRepository;
    private final AlertRepository alertRepository;
    private final ConditionCodec conditionCodec;

    /**
     * First suppressing rule matching the alert. Grouping rules never suppress and are skipped.
     *
     * @throws com.example.alertengine.exception.ConfigurationException if a visited rule has a malformed condition
     */
    public Optional<SuppressionRule> firstMatch(AlertFacts alert, Instant now) {
        for (SuppressionRule rule : ruleRepository.findCandidates(alert.teamId())) {
            if (rule.getRuleType() == SuppressionRule.RuleType.GROUPING) continue;
            if (!conditionCodec.parse(rule.getConditions()).test(alert)) continue;
            if (typeSpecificMatch(rule, alert, now)) {
                log.debug("Suppression rule '{}' ({}) matches alert {}", rule.getName(), rule.getId(), alert.alertId());
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    /**
     * Highest-priority grouping rule whose conditions hold for the alert.
     */
    public Optional<SuppressionRule> groupingRuleFor(AlertFacts alert) {
        return ruleRepository.findCandidates(alert.teamId()).stream()
                .filter(rule -> rule.getRuleType() == SuppressionRule.RuleType.GROUPING)
                .filter(rule -> conditionCodec.parse(rule.getConditions()).test(alert))
                .findFirst();
    }

    private boolean typeSpecificMatch(SuppressionRule rule, AlertFacts alert, Instant now) {
        Instant since = now.minus(Duration.ofMinutes(rule.getWindowSizeMinutes()));
        return switch (rule.getRuleType()) {
            case RATE_LIMIT -> alertRepository.countForMetricSince(alert.metricName(), alert.teamId(),
                    alert.alertId(), EnumSet.allOf(AlertStatus.class), since) >= rule.getMaxAlertsPerWindow();
            case DUPLICATE -> alertRepository.countForMetricSince(alert.metricName(), alert.teamId(),
                    alert.alertId(), OPEN, since) > 0;
            default -> true;
        };
    }
}
