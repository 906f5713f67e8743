package com.example.alertengine.intake;

import com.example.alertengine.assignment.AssignmentTracker;
import com.example.alertengine.domain.Alert;
import com.example.alertengine.domain.AlertStatus;
import com.example.alertengine.exception.AlertStateException;
import com.example.alertengine.exception.UnknownEntityException;
import com.example.alertengine.repository.AlertRepository;
import com.example.alertengine.service.AlertHistoryService;
import com.example.alertengine.support.ConflictRetrier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Acknowledge and resolve transitions. Acknowledging clears the pending escalation, and
 * the escalation sweep only advances unacknowledged active alerts, so an acknowledged
 * alert never escalates again. Resolution is terminal.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertLifecycleService {

    public static final String SYSTEM = "system";

    private final AlertRepository alertRepository;
    private final AssignmentTracker assignmentTracker;
    private final AlertHistoryService historyService;
    private final ConflictRetrier retrier;
    private final Clock clock;

    public Alert acknowledge(String alertId, String userId) {
        return retrier.inTransaction("acknowledge", () -> {
            Alert alert = requireAlert(alertId);
            if (alert.getStatus() == AlertStatus.RESOLVED) {
                throw new AlertStateException("Alert " + alertId + " is already resolved");
            }
            if (alert.getAcknowledgedAt() != null) return alert;
            markAcknowledged(alert, userId, clock.instant());
            historyService.record(alertId, AlertHistoryService.ACKNOWLEDGED,
                    "Acknowledged by " + userId, userId, null);
            return alert;
        });
    }

    public Alert resolve(String alertId, String userId) {
        return retrier.inTransaction("resolve", () -> {
            Alert alert = requireAlert(alertId);
            if (alert.getStatus() == AlertStatus.RESOLVED) return alert;
            markResolved(alert, userId, false, clock.instant());
            historyService.record(alertId, AlertHistoryService.RESOLVED,
                    "Resolved by " + userId, userId, null);
            return alert;
        });
    }

    /** Acknowledge on the responder's behalf; call inside the sweep's transaction. */
    public void autoAcknowledge(Alert alert, int afterMinutes, Instant now) {
        markAcknowledged(alert, SYSTEM, now);
        log.info("Alert {} auto-acknowledged after {} min", alert.getId(), afterMinutes);
        historyService.record(alert.getId(), AlertHistoryService.AUTO_ACKNOWLEDGED,
                "Auto-acknowledged after " + afterMinutes + " minutes", SYSTEM,
                Map.of("timeout_minutes", afterMinutes));
    }

    /** Resolve an alert left unacknowledged too long; call inside the sweep's transaction. */
    public void autoResolve(Alert alert, int afterMinutes, Instant now) {
        markResolved(alert, SYSTEM, true, now);
        log.info("Alert {} auto-resolved after {} min unacknowledged", alert.getId(), afterMinutes);
        historyService.record(alert.getId(), AlertHistoryService.AUTO_RESOLVED,
                "Auto-resolved after " + afterMinutes + " minutes unacknowledged", SYSTEM,
                Map.of("timeout_minutes", afterMinutes));
    }

    private void markAcknowledged(Alert alert, String userId, Instant now) {
        alert.setStatus(AlertStatus.ACKNOWLEDGED);
        alert.setAcknowledgedAt(now);
        alert.setAcknowledgedBy(userId);
        alert.setNextEscalationAt(null);
        alertRepository.saveAndFlush(alert);
        assignmentTracker.acknowledge(alert.getId(), now);
        log.info("Alert {} acknowledged by {}", alert.getId(), userId);
    }

    private void markResolved(Alert alert, String userId, boolean automatic, Instant now) {
        alert.setStatus(AlertStatus.RESOLVED);
        alert.setResolvedAt(now);
        alert.setResolvedBy(userId);
        alert.setAutoResolved(automatic);
        alert.setNextEscalationAt(null);
        alertRepository.saveAndFlush(alert);
        log.info("Alert {} resolved by {}", alert.getId(), userId);
    }

    private Alert requireAlert(String alertId) {
        return alertRepository.findById(alertId)
                .orElseThrow(() -> new UnknownEntityException("Alert", alertId));
    }
}
