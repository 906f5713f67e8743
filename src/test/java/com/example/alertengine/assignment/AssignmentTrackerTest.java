package com.example.alertengine.assignment;

import com.example.alertengine.IntegrationTestSupport;
import com.example.alertengine.domain.AlertAssignment;
import com.example.alertengine.domain.AlertRule;
import com.example.alertengine.domain.AlertStatus;
import com.example.alertengine.domain.AssignmentReason;
import com.example.alertengine.domain.Severity;
import com.example.alertengine.exception.UnknownEntityException;
import com.example.alertengine.service.AlertHistoryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AssignmentTrackerTest extends IntegrationTestSupport {

    @Autowired
    private AssignmentTracker tracker;

    private AlertRule cpuRule;

    @BeforeEach
    void setUp() {
        cpuRule = rule("cpu_high", 10);
    }

    @Test
    void expectedResponseTimeFollowsSeverity() {
        storedAlert("a-crit", cpuRule, Severity.CRITICAL, AlertStatus.ACTIVE, now());
        storedAlert("a-low", cpuRule, Severity.LOW, AlertStatus.ACTIVE, now());

        assertEquals(15, tracker.assign("a-crit", "alice", "api", AssignmentReason.MANUAL).getExpectedResponseTime());
        assertEquals(240, tracker.assign("a-low", "alice", "api", AssignmentReason.MANUAL).getExpectedResponseTime());
    }

    @Test
    void unassignedAlertIsAssignedAtLevelZero() {
        storedAlert("a-1", cpuRule, Severity.HIGH, AlertStatus.ACTIVE, now());

        AlertAssignment assignment = tracker.assign("a-1", "alice", "api", AssignmentReason.MANUAL);

        assertEquals(0, assignment.getAssignmentLevel());
        assertEquals("api", assignment.getAssignedBy());
        assertFalse(assignment.isAcknowledged());
        assertEquals(1, alertHistoryRepository.findByEventTypeOrderByCreatedAtDesc(AlertHistoryService.ASSIGNED).size());
    }

    @Test
    void acknowledgmentStampsTheLatestOpenAssignment() {
        storedAlert("a-1", cpuRule, Severity.HIGH, AlertStatus.ACTIVE, now());
        tracker.assign("a-1", "alice", "system", AssignmentReason.ROTATION, 0);
        clock.advance(Duration.ofMinutes(30));
        tracker.assign("a-1", "bob", "system", AssignmentReason.ESCALATION, 1);
        clock.advance(Duration.ofMinutes(12));

        AlertAssignment acknowledged = tracker.acknowledge("a-1", now()).orElseThrow();

        assertEquals("bob", acknowledged.getAssignedTo());
        assertEquals(12, acknowledged.getResponseTimeMinutes());
        assertEquals("bob", tracker.currentResponder("a-1").orElseThrow().getAssignedTo());

        List<AlertAssignment> history = tracker.history("a-1");
        assertEquals(2, history.size());
        assertFalse(history.get(0).isAcknowledged());
    }

    @Test
    void currentResponderIsTheLatestWhileUnacknowledged() {
        storedAlert("a-1", cpuRule, Severity.HIGH, AlertStatus.ACTIVE, now());
        tracker.assign("a-1", "alice", "system", AssignmentReason.ROTATION, 0);
        clock.advance(Duration.ofMinutes(30));
        tracker.assign("a-1", "bob", "system", AssignmentReason.ESCALATION, 1);

        assertEquals("bob", tracker.currentResponder("a-1").orElseThrow().getAssignedTo());
    }

    @Test
    void acknowledgingAnUnassignedAlertFindsNothing() {
        storedAlert("a-1", cpuRule, Severity.HIGH, AlertStatus.ACTIVE, now());

        assertTrue(tracker.acknowledge("a-1", now()).isEmpty());
        assertTrue(tracker.currentResponder("a-1").isEmpty());
    }

    @Test
    void unknownAlertIsRejected() {
        assertThrows(UnknownEntityException.class,
                () -> tracker.assign("missing", "alice", "api", AssignmentReason.MANUAL));
    }
}
