package com.example.alertengine.suppression;

import com.example.alertengine.domain.SuppressionRule;
import com.example.alertengine.exception.ConfigurationException;
import com.example.alertengine.exception.UnknownEntityException;
import com.example.alertengine.repository.SuppressionRuleRepository;
import com.example.alertengine.suppression.condition.ConditionCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Admin writes of suppression rules. Conditions are parsed on the way in so a rule
 * that could never be evaluated is refused instead of failing every later alert.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SuppressionRuleService {

    private final SuppressionRuleRepository ruleRepository;
    private final ConditionCodec conditionCodec;
    private final Clock clock;

    @Transactional
    public SuppressionRule create(SuppressionRule rule) {
        if (rule.getName() == null || rule.getName().isBlank()) {
            throw new ConfigurationException("Suppression rule name is required");
        }
        if (rule.getRuleType() == null) {
            throw new ConfigurationException("Suppression rule '" + rule.getName() + "' needs a rule type");
        }
        if (rule.getSuppressionDurationMinutes() < 0 || rule.getWindowSizeMinutes() <= 0
                || rule.getMaxAlertsPerWindow() < 0) {
            throw new ConfigurationException("Suppression rule '" + rule.getName() + "' has a negative duration or limit");
        }
        conditionCodec.parse(rule.getConditions());
        rule.setId(null);
        rule.setCreatedAt(clock.instant());
        SuppressionRule saved = ruleRepository.save(rule);
        log.info("Suppression rule '{}' ({}, priority {}) created for {}", saved.getName(), saved.getRuleType(),
                saved.getPriority(), saved.getTeamId() == null ? "all teams" : "team " + saved.getTeamId());
        return saved;
    }

    public SuppressionRule get(String id) {
        return ruleRepository.findById(id)
                .orElseThrow(() -> new UnknownEntityException("Suppression rule", id));
    }

    @Transactional
    public void delete(String id) {
        SuppressionRule rule = get(id);
        ruleRepository.delete(rule);
        log.info("Suppression rule '{}' ({}) deleted", rule.getName(), id);
    }
}
