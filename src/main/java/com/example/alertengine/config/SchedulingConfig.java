package com.example.alertengine.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the escalation sweep and housekeeping jobs. Tests switch this off
 * and drive the sweeps directly.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "alerting.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
