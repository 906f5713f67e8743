package com.example.alertengine.intake;

import com.example.alertengine.suppression.SuppressionDecision;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of ingesting one alert.
 *
 * @param assignmentId set when a responder was assigned during intake
 * @param replayed     true when the alert id had already been ingested
 */
public record IntakeResult(@JsonProperty("alert_id") String alertId,
                           @JsonProperty("decision") SuppressionDecision decision,
                           @JsonProperty("group_id") String groupId,
                           @JsonProperty("assignment_id") String assignmentId,
                           @JsonProperty("assignee") String assignee,
                           @JsonProperty("replayed") boolean replayed) {

    public boolean suppressed() {
        return decision.suppressed();
    }
}
