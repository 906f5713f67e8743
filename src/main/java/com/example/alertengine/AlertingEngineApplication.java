package com.example.alertengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Alert decision engine.
 *
 * Sits between "an alert occurred" and "someone was told, or it was deliberately silenced":
 * - Suppression → maintenance windows, duplicates, rate limits, custom rules
 * - Grouping → collapses bursts of related alerts into one incident key
 * - Routing → severity routing, on-call resolution and multi-level escalation
 * - Housekeeping → periodic cleanup of logs, stale groups and spent windows
 */
@SpringBootApplication
@EnableAsync
public class AlertingEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlertingEngineApplication.class, args);
    }
}
