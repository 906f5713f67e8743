package com.example.alertengine.controller;

import com.example.alertengine.domain.Severity;
import com.example.alertengine.oncall.OnCallResolution;
import com.example.alertengine.oncall.OnCallScheduleResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * On-call lookup REST API.
 */
@RestController
@RequestMapping("/api/teams/{teamId}/on-call")
@RequiredArgsConstructor
public class OnCallController {

    private final OnCallScheduleResolver resolver;

    @GetMapping
    public ResponseEntity<OnCallResolution> current(@PathVariable String teamId,
                                                    @RequestParam(defaultValue = "high") String severity) {
        return resolver.currentOnCall(teamId, Severity.fromCode(severity))
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
