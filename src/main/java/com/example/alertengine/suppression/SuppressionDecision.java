package com.example.alertengine.suppression;

import java.time.Instant;
import java.util.Map;

/**
 * Verdict of the suppression engine for one alert.
 *
 * @param suppressUntil when the suppression lapses; null for allowed alerts
 * @param metadata      reason-specific details (window id, rule id, counts)
 */
public record SuppressionDecision(boolean suppressed,
                                  SuppressionReason reason,
                                  Instant suppressUntil,
                                  Map<String, Object> metadata) {

    public SuppressionDecision {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static SuppressionDecision allow() {
        return new SuppressionDecision(false, SuppressionReason.NO_SUPPRESSION, null, Map.of());
    }

    public static SuppressionDecision suppress(SuppressionReason reason, Instant until, Map<String, Object> metadata) {
        return new SuppressionDecision(true, reason, until, metadata);
    }

    /** True when a maintenance window with suppress-all produced this decision. */
    public boolean isSuppressAll() {
        return reason == SuppressionReason.MAINTENANCE_WINDOW
                && Boolean.TRUE.equals(metadata.get("suppress_all"));
    }
}
