package com.example.alertengine.intake;

import com.example.alertengine.IntegrationTestSupport;
import com.example.alertengine.domain.Alert;
import com.example.alertengine.domain.AlertRule;
import com.example.alertengine.domain.Severity;
import com.example.alertengine.exception.RoutingGapException;
import com.example.alertengine.service.AlertHistoryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@TestPropertySource(properties = "alerting.routing.catch-all-assignee-pattern=")
class RoutingGapIntakeTest extends IntegrationTestSupport {

    @Autowired
    private AlertIntakeService intakeService;

    @Test
    void gapWithoutCatchAllSurfacesAndLeavesTheAlertDue() {
        AlertRule rule = rule("cpu_high", 5);
        routing(Severity.HIGH, 0, 30, 3, List.of());

        RoutingGapException gap = assertThrows(RoutingGapException.class, () -> intakeService.ingest(
                new IncomingAlert("a-1", rule.getId(), TEAM, "cpu_high", Severity.HIGH, Map.of(), null)));

        assertEquals(TEAM, gap.getTeamId());
        Alert alert = alertRepository.findById("a-1").orElseThrow();
        assertEquals(Alert.UNASSIGNED_LEVEL, alert.getEscalationLevel());
        assertEquals(now(), alert.getNextEscalationAt());
        assertTrue(alertAssignmentRepository.findByAlertIdOrderByCreatedAtAscAssignmentLevelAsc("a-1").isEmpty());
        assertTrue(alertHistoryRepository.findByEventTypeOrderByCreatedAtDesc(AlertHistoryService.ROUTING_GAP).isEmpty());
    }
}
