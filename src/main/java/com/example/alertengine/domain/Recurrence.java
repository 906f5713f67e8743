package com.example.alertengine.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Recurrence descriptor of a maintenance window. Occurrences are computed in the
 * window's own timezone so a weekly 02:00 window stays at 02:00 across DST changes.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Recurrence {

    @Enumerated(EnumType.STRING)
    @Column(name = "recurrence_type")
    private Type type;

    @Column(name = "recurrence_interval")
    @Builder.Default
    private int every = 1;

    /** Total occurrences including the first; null means unbounded until {@link #endDate}. */
    @Column(name = "recurrence_max_occurrences")
    private Integer maxOccurrences;

    @Column(name = "recurrence_end_date")
    private Instant endDate;

    public enum Type {
        DAILY, WEEKLY, MONTHLY
    }

    /**
     * Start of the occurrence {@code steps} intervals after {@code anchor}. Counting from
     * the anchor keeps a monthly window on the 31st from sliding to the 28th after February.
     */
    public Instant occurrenceStart(Instant anchor, int steps, ZoneId zone) {
        ZonedDateTime base = anchor.atZone(zone);
        long amount = (long) Math.max(1, every) * steps;
        ZonedDateTime start = switch (type == null ? Type.WEEKLY : type) {
            case DAILY -> base.plusDays(amount);
            case WEEKLY -> base.plusWeeks(amount);
            case MONTHLY -> base.plusMonths(amount);
        };
        return start.toInstant();
    }

    public boolean allows(int occurrence, Instant start) {
        if (maxOccurrences != null && occurrence > maxOccurrences) return false;
        return endDate == null || !start.isAfter(endDate);
    }
}
