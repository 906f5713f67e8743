package com.example.alertengine.controller;

import com.example.alertengine.IntegrationTestSupport;
import com.example.alertengine.domain.AlertRule;
import com.example.alertengine.domain.AlertStatus;
import com.example.alertengine.domain.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class AlertControllerTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    private AlertRule cpuRule;

    @BeforeEach
    void setUp() {
        cpuRule = rule("cpu_high", 5);
        routing(Severity.HIGH, 0, 30, 3, List.of("bob"));
    }

    @Test
    void ingestReturnsTheDecision() throws Exception {
        mockMvc.perform(post("/api/alerts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(alertJson("a-1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alert_id").value("a-1"))
                .andExpect(jsonPath("$.decision.suppressed").value(false))
                .andExpect(jsonPath("$.decision.reason").value("no_suppression"))
                .andExpect(jsonPath("$.assignee").value("bob"));

        mockMvc.perform(get("/api/alerts/a-1/suppression-log"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)));
    }

    @Test
    void incompleteAlertsAreRejected() throws Exception {
        mockMvc.perform(post("/api/alerts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"a-1\",\"team_id\":\"" + TEAM + "\",\"metric_name\":\"cpu_high\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    @Test
    void unknownRuleIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/alerts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"a-1\",\"rule_id\":\"nope\",\"team_id\":\"" + TEAM
                                + "\",\"metric_name\":\"cpu_high\",\"severity\":\"high\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void acknowledgeThenResolve() throws Exception {
        mockMvc.perform(post("/api/alerts").contentType(MediaType.APPLICATION_JSON).content(alertJson("a-1")))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/alerts/a-1/acknowledge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\":\"bob\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("acknowledged"))
                .andExpect(jsonPath("$.acknowledgedBy").value("bob"));

        mockMvc.perform(post("/api/alerts/a-1/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\":\"bob\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("resolved"));

        mockMvc.perform(post("/api/alerts/a-1/acknowledge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\":\"bob\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("invalid_state"));

        mockMvc.perform(get("/api/alerts/a-1/assignments"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.current.assignedTo").value("bob"));
    }

    @Test
    void unknownAlertIsNotFound() throws Exception {
        mockMvc.perform(post("/api/alerts/missing/acknowledge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\":\"bob\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void manualAssignment() throws Exception {
        storedAlert("a-1", cpuRule, Severity.HIGH, AlertStatus.ACTIVE, now());

        mockMvc.perform(post("/api/alerts/a-1/assignments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"assignee\":\"carol\",\"assigned_by\":\"lead\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assignedTo").value("carol"))
                .andExpect(jsonPath("$.assignmentReason").value("manual"))
                .andExpect(jsonPath("$.expectedResponseTime").value(30));
    }

    @Test
    void invertedMaintenanceWindowIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/maintenance-windows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"bad\",\"startTime\":\"2026-03-04T12:00:00Z\","
                                + "\"endTime\":\"2026-03-04T11:00:00Z\",\"teamId\":\"" + TEAM + "\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void maintenanceStatusForTheTeam() throws Exception {
        mockMvc.perform(post("/api/maintenance-windows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"freeze\",\"startTime\":\"2026-03-04T09:00:00Z\","
                                + "\"endTime\":\"2026-03-04T12:00:00Z\",\"suppressAll\":true,\"teamId\":\"" + TEAM + "\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/maintenance-windows/status").param("team_id", TEAM))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.in_maintenance").value(true))
                .andExpect(jsonPath("$.suppression_level").value("full"));
    }

    @Test
    void maintenanceUpdateKeepsOmittedFields() throws Exception {
        mockMvc.perform(post("/api/maintenance-windows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"freeze\",\"startTime\":\"2026-03-04T09:00:00Z\","
                                + "\"endTime\":\"2026-03-04T12:00:00Z\",\"suppressAll\":true,\"priority\":4,"
                                + "\"teamId\":\"" + TEAM + "\"}"))
                .andExpect(status().isOk());
        String id = maintenanceWindowRepository.findAll().get(0).getId();

        mockMvc.perform(put("/api/maintenance-windows/" + id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"endTime\":\"2026-03-04T13:00:00Z\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("freeze"))
                .andExpect(jsonPath("$.endTime").value("2026-03-04T13:00:00Z"))
                .andExpect(jsonPath("$.suppressAll").value(true))
                .andExpect(jsonPath("$.priority").value(4))
                .andExpect(jsonPath("$.enabled").value(true));
    }

    @Test
    void onCallLookup() throws Exception {
        shift(schedule("primary"), "alice", now().minusSeconds(60), now().plusSeconds(3600), true);

        mockMvc.perform(get("/api/teams/" + TEAM + "/on-call").param("severity", "critical"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user").value("alice"))
                .andExpect(jsonPath("$.is_primary").value(true));

        mockMvc.perform(get("/api/teams/team-nobody/on-call"))
                .andExpect(status().isNotFound());
    }

    private String alertJson(String id) {
        return "{\"id\":\"" + id + "\",\"rule_id\":\"" + cpuRule.getId() + "\",\"team_id\":\"" + TEAM
                + "\",\"metric_name\":\"cpu_high\",\"severity\":\"high\",\"dimensions\":{\"host\":\"web-1\"}}";
    }
}
