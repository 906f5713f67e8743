package com.example.alertengine.routing;

import com.example.alertengine.domain.Alert;
import com.example.alertengine.domain.AlertStatus;
import com.example.alertengine.domain.BusinessHours;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Timing rules of escalation: when the next level is due and whether business hours
 * allow it to fire.
 */
@Component
public class EscalationPolicy {

    /**
     * True when the alert should move past {@code currentLevel} at {@code now}: it is still
     * active and unacknowledged, below the routing's maximum level, due, and inside the
     * hours escalation may run in.
     */
    public boolean shouldEscalate(Alert alert, int currentLevel, RoutingPolicy routing,
                                  BusinessHours hours, Instant now) {
        if (alert.getStatus() != AlertStatus.ACTIVE || alert.getAcknowledgedAt() != null) return false;
        if (currentLevel >= routing.maxEscalationLevel()) return false;
        if (!isDue(alert, now)) return false;
        return mayEscalateAt(routing, hours, now);
    }

    public boolean isDue(Alert alert, Instant now) {
        return alert.getNextEscalationAt() != null && !now.isBefore(alert.getNextEscalationAt());
    }

    /**
     * Business-hours-only routing pauses outside the team's hours, except across weekends
     * when weekend escalation is on.
     */
    public boolean mayEscalateAt(RoutingPolicy routing, BusinessHours hours, Instant now) {
        if (!routing.businessHoursOnly()) return true;
        BusinessHours effective = hours != null ? hours : BusinessHours.standard();
        if (effective.isOpen(now)) return true;
        return routing.weekendEscalation() && effective.isWeekend(now);
    }

    /** When a paused escalation may be retried. */
    public Instant resumeAt(RoutingPolicy routing, BusinessHours hours, Instant now) {
        BusinessHours effective = hours != null ? hours : BusinessHours.standard();
        Instant opening = effective.nextOpening(now);
        return opening != null ? opening : nextLevelAt(routing, now);
    }

    public Instant nextLevelAt(RoutingPolicy routing, Instant from) {
        return from.plus(Duration.ofMinutes(Math.max(1, routing.escalationIntervalMinutes())));
    }

    public Instant initialAssignmentAt(RoutingPolicy routing, Instant createdAt) {
        return createdAt.plus(Duration.ofMinutes(Math.max(0, routing.initialDelayMinutes())));
    }
}
