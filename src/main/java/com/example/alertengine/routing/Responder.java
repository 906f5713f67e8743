package com.example.alertengine.routing;

import com.example.alertengine.domain.AssignmentReason;

/**
 * A selected assignee and where it came from ({@code on_call}, {@code routing},
 * {@code escalation_chain}, {@code escalation_contacts}, {@code on_call_backup},
 * {@code primary_contacts} or {@code catch_all}).
 */
public record Responder(String assignee, AssignmentReason reason, String source) {
}
