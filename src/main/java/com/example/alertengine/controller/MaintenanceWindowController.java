package com.example.alertengine.controller;

import com.example.alertengine.domain.MaintenanceWindow;
import com.example.alertengine.suppression.MaintenanceStatus;
import com.example.alertengine.suppression.MaintenanceWindowChanges;
import com.example.alertengine.suppression.MaintenanceWindowService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Maintenance Window REST API.
 */
@RestController
@RequestMapping("/api/maintenance-windows")
@RequiredArgsConstructor
public class MaintenanceWindowController {

    private final MaintenanceWindowService windowService;

    @GetMapping
    public ResponseEntity<List<MaintenanceWindow>> list(@RequestParam(name = "team_id", required = false) String teamId) {
        return ResponseEntity.ok(windowService.list(teamId));
    }

    @PostMapping
    public ResponseEntity<MaintenanceWindow> create(@RequestBody MaintenanceWindow window,
                                                    @RequestParam(name = "created_by", defaultValue = "api") String createdBy) {
        return ResponseEntity.ok(windowService.create(window, createdBy));
    }

    @GetMapping("/{id}")
    public ResponseEntity<MaintenanceWindow> get(@PathVariable String id) {
        return ResponseEntity.ok(windowService.get(id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<MaintenanceWindow> update(@PathVariable String id, @RequestBody MaintenanceWindowChanges changes) {
        return ResponseEntity.ok(windowService.update(id, changes));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable String id) {
        windowService.delete(id);
        return ResponseEntity.ok(Map.of("status", "deleted", "id", id));
    }

    @GetMapping("/active")
    public ResponseEntity<List<MaintenanceWindow>> active(@RequestParam(name = "team_id", required = false) String teamId) {
        return ResponseEntity.ok(windowService.findActive(teamId));
    }

    @GetMapping("/status")
    public ResponseEntity<MaintenanceStatus> status(@RequestParam(name = "team_id", required = false) String teamId) {
        return ResponseEntity.ok(windowService.status(teamId));
    }
}
