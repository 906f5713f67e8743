package com.example.alertengine.config;

import com.example.alertengine.domain.Severity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the alert decision engine.
 * Maps to the 'alerting' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "alerting")
public class AlertingProperties {

    private SuppressionConfig suppression = new SuppressionConfig();
    private GroupingConfig grouping = new GroupingConfig();
    private RoutingConfig routing = new RoutingConfig();
    private Map<Severity, Integer> responseTimes = defaultResponseTimes();
    private EscalationSweepConfig escalation = new EscalationSweepConfig();
    private HousekeepingConfig housekeeping = new HousekeepingConfig();
    private ConcurrencyConfig concurrency = new ConcurrencyConfig();
    private DispatchConfig dispatch = new DispatchConfig();
    private SchedulerConfig scheduling = new SchedulerConfig();

    @Data
    public static class SuppressionConfig {
        private int duplicateWindowMinutes = 30;
        private int rateLimitWindowMinutes = 60;
    }

    @Data
    public static class GroupingConfig {
        private int defaultWindowMinutes = 15;
        private int retentionHours = 24;
        /** Dimensions that take part in the group key; empty means all of them. */
        private List<String> keyDimensions = new ArrayList<>();
    }

    @Data
    public static class RoutingConfig {
        /** Assignee used when neither on-call nor static routing yields anyone. Empty disables it. */
        private String catchAllAssigneePattern = "team:{teamId}";
        private Map<Severity, RoutingDefaults> defaults = defaultRouting();

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        public static class RoutingDefaults {
            private int initialDelayMinutes;
            private int escalationIntervalMinutes;
            private int maxEscalationLevel;
            private boolean businessHoursOnly;
            private boolean weekendEscalation;
            private Integer autoAcknowledgeMinutes;
            private Integer autoResolveMinutes;
        }
    }

    @Data
    public static class EscalationSweepConfig {
        private long sweepIntervalMs = 60000;
    }

    @Data
    public static class HousekeepingConfig {
        private long intervalMs = 300000;
        private int suppressionLogRetentionDays = 30;
        private int rateLimitGraceMinutes = 60;
    }

    @Data
    public static class ConcurrencyConfig {
        private int maxRetries = 3;
    }

    @Data
    public static class DispatchConfig {
        private boolean enabled = true;
        private String webhookUrl = "";
        private int timeoutSeconds = 10;
    }

    @Data
    public static class SchedulerConfig {
        private boolean enabled = true;
    }

    private static Map<Severity, Integer> defaultResponseTimes() {
        Map<Severity, Integer> times = new EnumMap<>(Severity.class);
        times.put(Severity.CRITICAL, 15);
        times.put(Severity.HIGH, 30);
        times.put(Severity.MEDIUM, 60);
        times.put(Severity.LOW, 240);
        times.put(Severity.INFO, 480);
        return times;
    }

    private static Map<Severity, RoutingConfig.RoutingDefaults> defaultRouting() {
        Map<Severity, RoutingConfig.RoutingDefaults> defaults = new EnumMap<>(Severity.class);
        defaults.put(Severity.CRITICAL, new RoutingConfig.RoutingDefaults(0, 5, 5, false, true, 30, null));
        defaults.put(Severity.HIGH, new RoutingConfig.RoutingDefaults(0, 15, 4, false, true, 60, null));
        defaults.put(Severity.MEDIUM, new RoutingConfig.RoutingDefaults(0, 30, 3, true, false, 120, 480));
        defaults.put(Severity.LOW, new RoutingConfig.RoutingDefaults(0, 60, 2, true, false, 240, 1440));
        defaults.put(Severity.INFO, new RoutingConfig.RoutingDefaults(0, 120, 1, true, false, null, 2880));
        return defaults;
    }
}
