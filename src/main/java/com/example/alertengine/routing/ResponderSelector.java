package com.example.alertengine.routing;

import com.example.alertengine.domain.Alert;
import com.example.alertengine.domain.AssignmentReason;
import com.example.alertengine.domain.EscalationConfig;
import com.example.alertengine.exception.RoutingGapException;
import com.example.alertengine.oncall.OnCallResolution;
import com.example.alertengine.oncall.OnCallScheduleResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Picks who an alert goes to at a given escalation level.
 * <p>
 * Level 0: the current on-call user, else the routing's first assigned user.
 * Level n: the n-th step of the escalation chain, else the escalation contacts in
 * rotation, the on-call backup, the primary contacts, and finally the routing users.
 */
@Component
@RequiredArgsConstructor
public class ResponderSelector {

    private final OnCallScheduleResolver onCallResolver;

    /**
     * @throws RoutingGapException when no source yields anyone
     */
    public Responder select(Alert alert, int level, RoutingPolicy routing, EscalationConfig config) {
        Optional<Responder> responder = level == 0
                ? initial(alert, routing)
                : escalated(alert, level, routing, config);
        return responder.orElseThrow(() -> new RoutingGapException(alert.getTeamId(), alert.getSeverity(), level));
    }

    private Optional<Responder> initial(Alert alert, RoutingPolicy routing) {
        Optional<OnCallResolution> onCall = onCallResolver.currentOnCall(alert.getTeamId(), alert.getSeverity());
        if (onCall.isPresent()) {
            return Optional.of(new Responder(onCall.get().user(), AssignmentReason.ROTATION, "on_call"));
        }
        return first(routing.assignedUsers())
                .map(user -> new Responder(user, AssignmentReason.AUTO_SEVERITY, "routing"));
    }

    private Optional<Responder> escalated(Alert alert, int level, RoutingPolicy routing, EscalationConfig config) {
        int step = level - 1;
        List<String> chain = config.getEscalationChain();
        if (step < chain.size()) {
            return Optional.of(escalation(chain.get(step), "escalation_chain"));
        }
        List<String> contacts = config.getEscalationContacts();
        if (!contacts.isEmpty()) {
            return Optional.of(escalation(contacts.get(step % contacts.size()), "escalation_contacts"));
        }
        Optional<String> backup = onCallResolver.currentOnCall(alert.getTeamId(), alert.getSeverity())
                .map(OnCallResolution::backupUser);
        if (backup.isPresent()) {
            return Optional.of(escalation(backup.get(), "on_call_backup"));
        }
        List<String> primary = config.getPrimaryContacts();
        if (!primary.isEmpty()) {
            return Optional.of(escalation(primary.get(step % primary.size()), "primary_contacts"));
        }
        List<String> users = routing.assignedUsers();
        if (!users.isEmpty()) {
            return Optional.of(escalation(users.get(Math.min(level, users.size() - 1)), "routing"));
        }
        return Optional.empty();
    }

    private static Responder escalation(String assignee, String source) {
        return new Responder(assignee, AssignmentReason.ESCALATION, source);
    }

    private static Optional<String> first(List<String> users) {
        return users.isEmpty() ? Optional.empty() : Optional.of(users.get(0));
    }
}
