package com.example.alertengine.assignment;

import com.example.alertengine.domain.Alert;
import com.example.alertengine.domain.AlertAssignment;
import com.example.alertengine.domain.AssignmentReason;
import com.example.alertengine.exception.UnknownEntityException;
import com.example.alertengine.repository.AlertAssignmentRepository;
import com.example.alertengine.repository.AlertRepository;
import com.example.alertengine.service.AlertHistoryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Records every handoff of an alert. Assignment rows are append-only; acknowledgment
 * is the only later write and only fills in the ack time and observed response time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssignmentTracker {

    private final AlertAssignmentRepository assignmentRepository;
    private final AlertRepository alertRepository;
    private final ResponseTimeTable responseTimes;
    private final AlertHistoryService historyService;
    private final Clock clock;

    /**
     * Assign at the alert's current escalation level (level 0 for a never-assigned alert).
     */
    @Transactional
    public AlertAssignment assign(String alertId, String assignee, String assignedBy, AssignmentReason reason) {
        Alert alert = requireAlert(alertId);
        return record(alert, assignee, assignedBy, reason, Math.max(0, alert.getEscalationLevel()));
    }

    @Transactional
    public AlertAssignment assign(String alertId, String assignee, String assignedBy,
                                  AssignmentReason reason, int level) {
        return record(requireAlert(alertId), assignee, assignedBy, reason, level);
    }

    /**
     * Stamp the latest open assignment as acknowledged.
     *
     * @return the stamped assignment, empty when the alert was never assigned
     */
    @Transactional
    public Optional<AlertAssignment> acknowledge(String alertId, Instant acknowledgedAt) {
        requireAlert(alertId);
        return assignmentRepository
                .findFirstByAlertIdAndAcknowledgedAtIsNullOrderByCreatedAtDescAssignmentLevelDesc(alertId)
                .map(assignment -> {
                    assignment.setAcknowledgedAt(acknowledgedAt);
                    long minutes = Duration.between(assignment.getCreatedAt(), acknowledgedAt).toMinutes();
                    assignment.setResponseTimeMinutes((int) Math.max(0, minutes));
                    log.info("Alert {} acknowledged by assignee {} after {} min (expected {})",
                            alertId, assignment.getAssignedTo(), assignment.getResponseTimeMinutes(),
                            assignment.getExpectedResponseTime());
                    return assignmentRepository.save(assignment);
                });
    }

    /**
     * The first acknowledging assignment if any exists, otherwise the most recent open one.
     */
    public Optional<AlertAssignment> currentResponder(String alertId) {
        List<AlertAssignment> assignments = history(alertId);
        Optional<AlertAssignment> acknowledged = assignments.stream()
                .filter(AlertAssignment::isAcknowledged)
                .findFirst();
        if (acknowledged.isPresent()) return acknowledged;
        for (int i = assignments.size() - 1; i >= 0; i--) {
            if (!assignments.get(i).isAcknowledged()) return Optional.of(assignments.get(i));
        }
        return Optional.empty();
    }

    public List<AlertAssignment> history(String alertId) {
        return assignmentRepository.findByAlertIdOrderByCreatedAtAscAssignmentLevelAsc(alertId);
    }

    private AlertAssignment record(Alert alert, String assignee, String assignedBy,
                                   AssignmentReason reason, int level) {
        int expected = responseTimes.expectedMinutes(alert.getSeverity());
        AlertAssignment assignment = assignmentRepository.save(AlertAssignment.builder()
                .alertId(alert.getId())
                .assignedTo(assignee)
                .assignedBy(assignedBy)
                .assignmentReason(reason)
                .assignmentLevel(level)
                .expectedResponseTime(expected)
                .createdAt(clock.instant())
                .build());
        log.info("Alert {} assigned to {} (level {}, {}, respond within {} min)",
                alert.getId(), assignee, level, reason.code(), expected);
        historyService.record(alert.getId(), AlertHistoryService.ASSIGNED,
                "Assigned to " + assignee, assignedBy,
                Map.of("assignment_id", assignment.getId(),
                        "assignee", assignee,
                        "level", level,
                        "reason", reason.code(),
                        "expected_response_time", expected));
        return assignment;
    }

    private Alert requireAlert(String alertId) {
        return alertRepository.findById(alertId)
                .orElseThrow(() -> new UnknownEntityException("Alert", alertId));
    }
}
