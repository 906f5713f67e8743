package com.example.alertengine.routing;

/**
 * Tally of one escalation sweep.
 */
public record SweepResult(int assigned, int escalated, int deferred,
                          int autoAcknowledged, int autoResolved, int failed) {
}
