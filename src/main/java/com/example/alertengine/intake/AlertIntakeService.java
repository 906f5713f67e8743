package com.example.alertengine.intake;

import com.example.alertengine.domain.Alert;
import com.example.alertengine.domain.AlertAssignment;
import com.example.alertengine.domain.AlertGroupMember;
import com.example.alertengine.domain.AlertStatus;
import com.example.alertengine.domain.Severity;
import com.example.alertengine.domain.SuppressionLogEntry;
import com.example.alertengine.grouping.AlertGrouper;
import com.example.alertengine.repository.AlertGroupMemberRepository;
import com.example.alertengine.repository.AlertRepository;
import com.example.alertengine.routing.EscalationPolicy;
import com.example.alertengine.routing.EscalationService;
import com.example.alertengine.routing.RoutingPolicy;
import com.example.alertengine.routing.SeverityRoutingService;
import com.example.alertengine.service.AlertHistoryService;
import com.example.alertengine.suppression.AlertFacts;
import com.example.alertengine.suppression.RateLimitTracker;
import com.example.alertengine.suppression.SuppressionDecision;
import com.example.alertengine.suppression.SuppressionDecisionEngine;
import com.example.alertengine.suppression.SuppressionLogService;
import com.example.alertengine.suppression.SuppressionReason;
import com.example.alertengine.support.ConflictRetrier;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for alerts from the detection pipeline.
 * <p>
 * Storing the alert, the suppression verdict, the rate-limit counting and the group
 * attachment form one transaction, replayed on write conflicts. The initial assignment
 * of an allowed alert runs in a second transaction once that one committed; when it
 * cannot happen right away the alert stays due and the escalation sweep picks it up.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertIntakeService {

    private final AlertRepository alertRepository;
    private final AlertGroupMemberRepository memberRepository;
    private final SuppressionDecisionEngine decisionEngine;
    private final RateLimitTracker rateLimitTracker;
    private final AlertGrouper grouper;
    private final SeverityRoutingService routingService;
    private final EscalationPolicy escalationPolicy;
    private final EscalationService escalationService;
    private final SuppressionLogService suppressionLogService;
    private final AlertHistoryService historyService;
    private final ConflictRetrier retrier;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private record Staged(String alertId, SuppressionDecision decision, String groupId,
                          boolean assignNow, boolean replayed) {
    }

    public IntakeResult ingest(IncomingAlert incoming) {
        Staged staged = retrier.inTransaction("intake", () -> stage(incoming));
        if (staged.replayed() || !staged.assignNow()) {
            return new IntakeResult(staged.alertId(), staged.decision(), staged.groupId(), null, null, staged.replayed());
        }

        Optional<AlertAssignment> assignment = retrier.inTransaction("initial-assignment",
                () -> escalationService.assignLevel(staged.alertId(), 0));
        return new IntakeResult(staged.alertId(), staged.decision(), staged.groupId(),
                assignment.map(AlertAssignment::getId).orElse(null),
                assignment.map(AlertAssignment::getAssignedTo).orElse(null),
                false);
    }

    private Staged stage(IncomingAlert incoming) {
        Optional<Alert> known = alertRepository.findById(incoming.id());
        if (known.isPresent()) {
            log.info("Alert {} already ingested, returning recorded outcome", incoming.id());
            return replay(known.get());
        }

        Instant now = clock.instant();
        Alert alert = alertRepository.saveAndFlush(Alert.builder()
                .id(incoming.id())
                .ruleId(incoming.ruleId())
                .teamId(incoming.teamId())
                .metricName(incoming.metricName())
                .severity(incoming.severity())
                .status(AlertStatus.ACTIVE)
                .dimensions(new HashMap<>(incoming.dimensions()))
                .createdAt(incoming.createdAt() != null ? incoming.createdAt() : now)
                .build());

        AlertFacts facts = AlertFacts.of(alert);
        SuppressionDecision decision = decisionEngine.evaluate(facts);
        boolean assignNow = false;
        if (decision.suppressed()) {
            alert.setSuppressedUntil(decision.suppressUntil());
        } else {
            rateLimitTracker.record(facts, now);
            RoutingPolicy routing = routingService.resolveRouting(alert.getTeamId(), alert.getSeverity());
            Instant firstAssignment = escalationPolicy.initialAssignmentAt(routing, alert.getCreatedAt());
            alert.setNextEscalationAt(firstAssignment);
            assignNow = !firstAssignment.isAfter(now);
        }
        String groupId = grouper.attachToGroup(alert, decision);
        alertRepository.save(alert);

        audit(alert, decision);
        return new Staged(alert.getId(), decision, groupId, assignNow, false);
    }

    private void audit(Alert alert, SuppressionDecision decision) {
        suppressionLogService.record(alert.getId(), decision);
        meterRegistry.counter("alerting.decisions", "reason", decision.reason().code()).increment();
        if (!decision.suppressed()) {
            log.info("Alert {} ({} / {}, team {}) allowed", alert.getId(), alert.getMetricName(),
                    alert.getSeverity().code(), alert.getTeamId());
            return;
        }
        if (alert.getSeverity() == Severity.CRITICAL) {
            log.warn("Critical alert {} ({}) suppressed: {} until {}", alert.getId(), alert.getMetricName(),
                    decision.reason().code(), decision.suppressUntil());
        } else {
            log.info("Alert {} ({}) suppressed: {} until {}", alert.getId(), alert.getMetricName(),
                    decision.reason().code(), decision.suppressUntil());
        }
        Map<String, Object> metadata = new HashMap<>(decision.metadata());
        metadata.put("reason", decision.reason().code());
        historyService.record(alert.getId(), AlertHistoryService.SUPPRESSED,
                "Suppressed: " + decision.reason().code(), AlertLifecycleService.SYSTEM, metadata);
    }

    private Staged replay(Alert alert) {
        SuppressionDecision decision = suppressionLogService.entriesFor(alert.getId()).stream()
                .findFirst()
                .map(AlertIntakeService::decisionOf)
                .orElseGet(SuppressionDecision::allow);
        String groupId = memberRepository.findFirstByAlertId(alert.getId())
                .map(AlertGroupMember::getGroupId)
                .orElse(null);
        return new Staged(alert.getId(), decision, groupId, false, true);
    }

    private static SuppressionDecision decisionOf(SuppressionLogEntry entry) {
        return new SuppressionDecision(entry.isSuppressed(), SuppressionReason.fromCode(entry.getReason()),
                entry.getSuppressUntil(), Map.of());
    }
}
