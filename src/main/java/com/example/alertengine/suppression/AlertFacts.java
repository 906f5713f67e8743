package com.example.alertengine.suppression;

import com.example.alertengine.domain.Alert;
import com.example.alertengine.domain.Severity;

import java.util.Map;

/**
 * The attributes of an alert that suppression decisions may look at.
 */
public record AlertFacts(String alertId,
                         String ruleId,
                         String teamId,
                         String metricName,
                         Severity severity,
                         Map<String, String> dimensions) {

    public static final String DIMENSION_PREFIX = "dimension:";

    public AlertFacts {
        dimensions = dimensions == null ? Map.of() : Map.copyOf(dimensions);
    }

    public static AlertFacts of(Alert alert) {
        return new AlertFacts(alert.getId(), alert.getRuleId(), alert.getTeamId(),
                alert.getMetricName(), alert.getSeverity(), alert.getDimensions());
    }

    /**
     * Value of a named attribute, or null when the alert does not carry it.
     */
    public String field(String name) {
        if (name.startsWith(DIMENSION_PREFIX)) {
            return dimensions.get(name.substring(DIMENSION_PREFIX.length()));
        }
        return switch (name) {
            case "metric_name" -> metricName;
            case "severity" -> severity == null ? null : severity.code();
            case "team_id" -> teamId;
            case "rule_id" -> ruleId;
            default -> null;
        };
    }

    public static boolean isKnownField(String name) {
        if (name == null) return false;
        if (name.startsWith(DIMENSION_PREFIX)) return name.length() > DIMENSION_PREFIX.length();
        return switch (name) {
            case "metric_name", "severity", "team_id", "rule_id" -> true;
            default -> false;
        };
    }
}
