package com.example.alertengine.assignment;

import com.example.alertengine.config.AlertingProperties;
import com.example.alertengine.domain.Severity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Expected response time per severity, in minutes.
 */
@Component
@RequiredArgsConstructor
public class ResponseTimeTable {

    private final AlertingProperties properties;

    public int expectedMinutes(Severity severity) {
        Integer configured = properties.getResponseTimes().get(severity);
        if (configured != null) return configured;
        return switch (severity) {
            case CRITICAL -> 15;
            case HIGH -> 30;
            case MEDIUM -> 60;
            case LOW -> 240;
            case INFO -> 480;
        };
    }
}
