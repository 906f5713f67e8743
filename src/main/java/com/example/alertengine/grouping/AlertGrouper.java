package com.example.alertengine.grouping;

import com.example.alertengine.config.AlertingProperties;
import com.example.alertengine.domain.Alert;
import com.example.alertengine.domain.AlertGroup;
import com.example.alertengine.domain.AlertGroupMember;
import com.example.alertengine.domain.Severity;
import com.example.alertengine.domain.SuppressionRule;
import com.example.alertengine.exception.UnknownEntityException;
import com.example.alertengine.repository.AlertGroupMemberRepository;
import com.example.alertengine.repository.AlertGroupRepository;
import com.example.alertengine.suppression.AlertFacts;
import com.example.alertengine.suppression.SuppressionDecision;
import com.example.alertengine.suppression.SuppressionRuleMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Collapses bursts of related alerts into groups. An alert joins the newest group for its
 * key whose last alert lies within the grouping window, or seeds a new group.
 * <p>
 * Writers for the same key take the key's lock row first, so concurrent first alerts
 * cannot seed two groups. Appends also go through the group's version column; a lost
 * race makes the enclosing unit of work fail and be replayed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertGrouper {

    private final AlertGroupRepository groupRepository;
    private final AlertGroupMemberRepository memberRepository;
    private final SuppressionRuleMatcher ruleMatcher;
    private final GroupKeyLocks keyLocks;
    private final AlertingProperties properties;
    private final Clock clock;

    /**
     * Attach the alert to its group. Idempotent per alert.
     *
     * @param decision the suppression verdict for this alert; marks the membership and,
     *                 for suppress-all maintenance, the group itself
     * @return the group id
     */
    @Transactional
    public String attachToGroup(Alert alert, SuppressionDecision decision) {
        Optional<AlertGroupMember> existing = memberRepository.findFirstByAlertId(alert.getId());
        if (existing.isPresent()) return existing.get().getGroupId();

        AlertFacts facts = AlertFacts.of(alert);
        String key = GroupKey.of(alert.getMetricName(), alert.getDimensions(),
                properties.getGrouping().getKeyDimensions());
        Duration window = groupingWindow(facts);
        Instant alertTime = alert.getCreatedAt() != null ? alert.getCreatedAt() : clock.instant();

        keyLocks.acquire(alert.getTeamId(), key);
        List<AlertGroup> open = groupRepository.findOpen(key, alert.getTeamId(), alertTime.minus(window));
        AlertGroup group = open.isEmpty() ? startGroup(alert, key, alertTime) : append(open.get(0), alert, alertTime);

        if (decision.isSuppressAll() && !group.isSuppressionApplied()) {
            group.setSuppressionApplied(true);
            group.setSuppressedAt(clock.instant());
        }
        group = groupRepository.saveAndFlush(group);

        memberRepository.save(AlertGroupMember.builder()
                .groupId(group.getId())
                .alertId(alert.getId())
                .suppressed(decision.suppressed())
                .joinedAt(clock.instant())
                .build());
        return group.getId();
    }

    public AlertGroup get(String groupId) {
        return groupRepository.findById(groupId)
                .orElseThrow(() -> new UnknownEntityException("Alert group", groupId));
    }

    public List<AlertGroupMember> members(String groupId) {
        return memberRepository.findByGroupIdOrderByJoinedAtAsc(groupId);
    }

    private Duration groupingWindow(AlertFacts facts) {
        int minutes = ruleMatcher.groupingRuleFor(facts)
                .map(SuppressionRule::getWindowSizeMinutes)
                .orElse(properties.getGrouping().getDefaultWindowMinutes());
        return Duration.ofMinutes(minutes);
    }

    private AlertGroup startGroup(Alert alert, String key, Instant alertTime) {
        HashSet<Severity> severities = new HashSet<>();
        severities.add(alert.getSeverity());
        log.debug("New alert group '{}' for team {} seeded by alert {}", key, alert.getTeamId(), alert.getId());
        return AlertGroup.builder()
                .groupKey(key)
                .teamId(alert.getTeamId())
                .metricName(alert.getMetricName())
                .firstAlertId(alert.getId())
                .lastAlertId(alert.getId())
                .alertCount(1)
                .severity(alert.getSeverity())
                .severities(severities)
                .firstAlertAt(alertTime)
                .lastAlertAt(alertTime)
                .build();
    }

    private AlertGroup append(AlertGroup group, Alert alert, Instant alertTime) {
        group.setAlertCount(group.getAlertCount() + 1);
        if (!alertTime.isBefore(group.getLastAlertAt())) {
            group.setLastAlertAt(alertTime);
            group.setLastAlertId(alert.getId());
        }
        group.getSeverities().add(alert.getSeverity());
        if (alert.getSeverity().isMoreUrgentThan(group.getSeverity())) {
            group.setSeverity(alert.getSeverity());
        }
        log.debug("Alert {} joined group '{}' ({} alerts)", alert.getId(), group.getGroupKey(), group.getAlertCount());
        return group;
    }
}
