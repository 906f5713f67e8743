package com.example.alertengine.controller;

import com.example.alertengine.assignment.AssignmentTracker;
import com.example.alertengine.domain.Alert;
import com.example.alertengine.domain.AlertAssignment;
import com.example.alertengine.domain.AlertGroup;
import com.example.alertengine.domain.AlertHistory;
import com.example.alertengine.domain.AssignmentReason;
import com.example.alertengine.domain.SuppressionLogEntry;
import com.example.alertengine.grouping.AlertGrouper;
import com.example.alertengine.intake.AlertIntakeService;
import com.example.alertengine.intake.AlertLifecycleService;
import com.example.alertengine.intake.IncomingAlert;
import com.example.alertengine.intake.IntakeResult;
import com.example.alertengine.service.AlertHistoryService;
import com.example.alertengine.suppression.SuppressionLogService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Alert intake, lifecycle and audit REST API.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AlertController {

    private final AlertIntakeService intakeService;
    private final AlertLifecycleService lifecycleService;
    private final AssignmentTracker assignmentTracker;
    private final SuppressionLogService suppressionLogService;
    private final AlertHistoryService historyService;
    private final AlertGrouper grouper;

    @PostMapping("/alerts")
    public ResponseEntity<IntakeResult> ingest(@Valid @RequestBody IncomingAlert alert) {
        return ResponseEntity.ok(intakeService.ingest(alert));
    }

    @PostMapping("/alerts/{id}/acknowledge")
    public ResponseEntity<Alert> acknowledge(@PathVariable String id, @RequestBody Map<String, String> body) {
        return ResponseEntity.ok(lifecycleService.acknowledge(id, requireUser(body)));
    }

    @PostMapping("/alerts/{id}/resolve")
    public ResponseEntity<Alert> resolve(@PathVariable String id, @RequestBody Map<String, String> body) {
        return ResponseEntity.ok(lifecycleService.resolve(id, requireUser(body)));
    }

    @PostMapping("/alerts/{id}/assignments")
    public ResponseEntity<AlertAssignment> assign(@PathVariable String id, @RequestBody Map<String, String> body) {
        String assignee = body.get("assignee");
        if (assignee == null || assignee.isBlank()) {
            throw new IllegalArgumentException("assignee is required");
        }
        return ResponseEntity.ok(assignmentTracker.assign(id, assignee,
                body.getOrDefault("assigned_by", "api"), AssignmentReason.MANUAL));
    }

    @GetMapping("/alerts/{id}/assignments")
    public ResponseEntity<Map<String, Object>> assignments(@PathVariable String id) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("assignments", assignmentTracker.history(id));
        body.put("current", assignmentTracker.currentResponder(id).orElse(null));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/alerts/{id}/suppression-log")
    public ResponseEntity<List<SuppressionLogEntry>> suppressionLog(@PathVariable String id) {
        return ResponseEntity.ok(suppressionLogService.entriesFor(id));
    }

    @GetMapping("/alerts/{id}/history")
    public ResponseEntity<List<AlertHistory>> history(@PathVariable String id) {
        return ResponseEntity.ok(historyService.historyOf(id));
    }

    @GetMapping("/alert-groups/{groupId}")
    public ResponseEntity<Map<String, Object>> group(@PathVariable String groupId) {
        AlertGroup group = grouper.get(groupId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("group", group);
        body.put("time_span_seconds", group.getTimeSpan().toSeconds());
        body.put("members", grouper.members(groupId));
        return ResponseEntity.ok(body);
    }

    private static String requireUser(Map<String, String> body) {
        String user = body == null ? null : body.get("user_id");
        if (user == null || user.isBlank()) {
            throw new IllegalArgumentException("user_id is required");
        }
        return user;
    }
}
