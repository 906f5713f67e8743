package com.example.alertengine.routing;

import com.example.alertengine.assignment.AssignmentTracker;
import com.example.alertengine.config.AlertingProperties;
import com.example.alertengine.dispatch.DispatchRequest;
import com.example.alertengine.dispatch.DispatchService;
import com.example.alertengine.domain.Alert;
import com.example.alertengine.domain.AlertAssignment;
import com.example.alertengine.domain.AlertStatus;
import com.example.alertengine.domain.AssignmentReason;
import com.example.alertengine.domain.AutoResolutionPolicy;
import com.example.alertengine.domain.EscalationConfig;
import com.example.alertengine.exception.RoutingGapException;
import com.example.alertengine.exception.UnknownEntityException;
import com.example.alertengine.intake.AlertLifecycleService;
import com.example.alertengine.repository.AlertRepository;
import com.example.alertengine.service.AlertHistoryService;
import com.example.alertengine.support.AfterCommit;
import com.example.alertengine.support.ConflictRetrier;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Escalation engine: assigns alerts level by level while they stay unacknowledged.
 * <p>
 * A periodic sweep visits every active, unacknowledged alert in its own transaction.
 * Each level change is a compare-and-set on the alert's escalation level, so a level
 * fires at most once however many sweeps run concurrently, and never after the alert
 * was acknowledged or resolved.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EscalationService {

    private enum Outcome { NONE, ASSIGNED, ESCALATED, DEFERRED, AUTO_ACKNOWLEDGED, AUTO_RESOLVED }

    private final AlertRepository alertRepository;
    private final SeverityRoutingService routingService;
    private final EscalationConfigService configService;
    private final EscalationPolicy policy;
    private final ResponderSelector responderSelector;
    private final AssignmentTracker assignmentTracker;
    private final AlertLifecycleService lifecycleService;
    private final AlertHistoryService historyService;
    private final DispatchService dispatchService;
    private final ConflictRetrier retrier;
    private final AlertingProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${alerting.escalation.sweep-interval-ms:60000}")
    public void checkEscalations() {
        SweepResult result = sweep();
        if (result.assigned() + result.escalated() + result.autoResolved() + result.autoAcknowledged() > 0) {
            log.info("Escalation sweep: {}", result);
        }
    }

    public SweepResult sweep() {
        int assigned = 0, escalated = 0, deferred = 0, autoAcknowledged = 0, autoResolved = 0, failed = 0;
        for (String alertId : alertRepository.findUnacknowledgedIds(AlertStatus.ACTIVE)) {
            try {
                Outcome outcome = retrier.inTransaction("escalation", () -> process(alertId));
                switch (outcome) {
                    case ASSIGNED -> assigned++;
                    case ESCALATED -> escalated++;
                    case DEFERRED -> deferred++;
                    case AUTO_ACKNOWLEDGED -> autoAcknowledged++;
                    case AUTO_RESOLVED -> autoResolved++;
                    case NONE -> { }
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Escalation failed for alert {}: {}", alertId, e.getMessage());
            }
        }
        return new SweepResult(assigned, escalated, deferred, autoAcknowledged, autoResolved, failed);
    }

    /**
     * Whether the alert should move past {@code currentLevel} now, under its team's business hours.
     */
    public boolean shouldEscalate(Alert alert, int currentLevel, RoutingPolicy routing) {
        EscalationConfig config = configService.configFor(alert.getTeamId());
        return policy.shouldEscalate(alert, currentLevel, routing, config.getBusinessHours(), clock.instant());
    }

    /**
     * Move the alert to {@code level} and assign the responder for it.
     *
     * @return the new assignment, empty when the alert already left level {@code level - 1}
     * @throws RoutingGapException when nobody can be found and no catch-all is configured
     */
    @Transactional
    public Optional<AlertAssignment> assignLevel(String alertId, int level) {
        Alert alert = alertRepository.findById(alertId)
                .orElseThrow(() -> new UnknownEntityException("Alert", alertId));
        EscalationConfig config = configService.configFor(alert.getTeamId());
        RoutingPolicy routing = routingService.resolveRouting(alert.getTeamId(), alert.getSeverity(), config);
        return assignLevel(alert, level, routing, config, clock.instant());
    }

    private Outcome process(String alertId) {
        Alert alert = alertRepository.findById(alertId).orElse(null);
        if (alert == null || alert.getStatus() != AlertStatus.ACTIVE || alert.getAcknowledgedAt() != null) {
            return Outcome.NONE;
        }
        Instant now = clock.instant();
        EscalationConfig config = configService.configFor(alert.getTeamId());
        RoutingPolicy routing = routingService.resolveRouting(alert.getTeamId(), alert.getSeverity(), config);

        Integer resolveAfter = autoResolveMinutes(alert, routing, config);
        if (resolveAfter != null && elapsed(alert, resolveAfter, now)) {
            lifecycleService.autoResolve(alert, resolveAfter, now);
            return Outcome.AUTO_RESOLVED;
        }
        Integer ackAfter = routing.autoAcknowledgeMinutes();
        if (ackAfter != null && alert.getEscalationLevel() != Alert.UNASSIGNED_LEVEL && elapsed(alert, ackAfter, now)) {
            lifecycleService.autoAcknowledge(alert, ackAfter, now);
            return Outcome.AUTO_ACKNOWLEDGED;
        }

        if (!policy.isDue(alert, now)) return Outcome.NONE;
        int level = alert.getEscalationLevel();
        if (level == Alert.UNASSIGNED_LEVEL) {
            return assignLevel(alert, 0, routing, config, now).isPresent() ? Outcome.ASSIGNED : Outcome.NONE;
        }
        if (level >= routing.maxEscalationLevel()) {
            alertRepository.clearNextEscalation(alert.getId());
            log.debug("Alert {} reached max escalation level {}", alert.getId(), level);
            return Outcome.NONE;
        }
        if (!policy.shouldEscalate(alert, level, routing, config.getBusinessHours(), now)) {
            Instant resume = policy.resumeAt(routing, config.getBusinessHours(), now);
            alertRepository.scheduleEscalation(alert.getId(), resume);
            log.info("Escalation of alert {} paused outside business hours until {}", alert.getId(), resume);
            historyService.record(alert.getId(), AlertHistoryService.ESCALATION_DEFERRED,
                    "Escalation paused outside business hours", AlertLifecycleService.SYSTEM,
                    Map.of("resume_at", resume.toString(), "level", level));
            return Outcome.DEFERRED;
        }
        return assignLevel(alert, level + 1, routing, config, now).isPresent() ? Outcome.ESCALATED : Outcome.NONE;
    }

    private Optional<AlertAssignment> assignLevel(Alert alert, int level, RoutingPolicy routing,
                                                  EscalationConfig config, Instant now) {
        Instant nextAt = level < routing.maxEscalationLevel() ? policy.nextLevelAt(routing, now) : null;
        int updated = alertRepository.advanceEscalation(alert.getId(), level - 1, level, nextAt, now, AlertStatus.ACTIVE);
        if (updated == 0) {
            log.debug("Alert {} no longer at level {}, skipping", alert.getId(), level - 1);
            return Optional.empty();
        }

        Responder responder = selectResponder(alert, level, routing, config);
        AlertAssignment assignment = assignmentTracker.assign(alert.getId(), responder.assignee(),
                AlertLifecycleService.SYSTEM, responder.reason(), level);

        if (level > 0) {
            log.warn("Escalating alert {} ({} / {}) to level {}: {} via {}", alert.getId(),
                    alert.getMetricName(), alert.getSeverity().code(), level, responder.assignee(), responder.source());
            meterRegistry.counter("alerting.escalations", "level", String.valueOf(level)).increment();
            historyService.record(alert.getId(), AlertHistoryService.ESCALATED,
                    "Escalated to level " + level, AlertLifecycleService.SYSTEM,
                    Map.of("level", level, "assignee", responder.assignee(), "source", responder.source()));
        }

        List<String> channels = DispatchRequest.channels(routing.assignedChannels(),
                config.channelsFor(alert.getSeverity()), level);
        DispatchRequest request = new DispatchRequest(alert.getId(), responder.assignee(), channels,
                assignment.getExpectedResponseTime(), level, alert.getSeverity().code(), alert.getTeamId());
        AfterCommit.run(() -> dispatchService.dispatch(request));
        return Optional.of(assignment);
    }

    private Responder selectResponder(Alert alert, int level, RoutingPolicy routing, EscalationConfig config) {
        try {
            return responderSelector.select(alert, level, routing, config);
        } catch (RoutingGapException e) {
            meterRegistry.counter("alerting.routing_gaps").increment();
            String pattern = properties.getRouting().getCatchAllAssigneePattern();
            if (pattern == null || pattern.isBlank()) {
                log.error("Routing gap for alert {}: {}", alert.getId(), e.getMessage());
                throw e;
            }
            String catchAll = pattern.replace("{teamId}", String.valueOf(alert.getTeamId()));
            log.warn("Routing gap for alert {} at level {}, assigning team catch-all {}",
                    alert.getId(), level, catchAll);
            historyService.record(alert.getId(), AlertHistoryService.ROUTING_GAP, e.getMessage(),
                    AlertLifecycleService.SYSTEM, Map.of("level", level, "assignee", catchAll));
            AssignmentReason reason = level == 0 ? AssignmentReason.AUTO_SEVERITY : AssignmentReason.ESCALATION;
            return new Responder(catchAll, reason, "catch_all");
        }
    }

    private static Integer autoResolveMinutes(Alert alert, RoutingPolicy routing, EscalationConfig config) {
        AutoResolutionPolicy resolution = config.autoResolutionFor(alert.getSeverity());
        if (!resolution.enabled()) return null;
        return routing.autoResolveMinutes() != null ? routing.autoResolveMinutes() : resolution.timeoutMinutes();
    }

    private static boolean elapsed(Alert alert, int minutes, Instant now) {
        return !now.isBefore(alert.getCreatedAt().plus(Duration.ofMinutes(minutes)));
    }
}
