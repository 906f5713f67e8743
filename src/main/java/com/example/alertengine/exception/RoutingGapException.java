package com.example.alertengine.exception;

import com.example.alertengine.domain.Severity;

/**
 * Thrown when no responder can be resolved for an alert: no on-call entry,
 * no static routing users and no escalation contact for the requested level.
 */
public class RoutingGapException extends AlertingException {

    private final String teamId;
    private final Severity severity;
    private final int level;

    public RoutingGapException(String teamId, Severity severity, int level) {
        super(String.format("No responder for team %s, severity %s, level %d",
                teamId, severity.code(), level));
        this.teamId = teamId;
        this.severity = severity;
        this.level = level;
    }

    public String getTeamId() {
        return teamId;
    }

    public Severity getSeverity() {
        return severity;
    }

    public int getLevel() {
        return level;
    }
}
