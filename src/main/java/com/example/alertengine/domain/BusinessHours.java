package com.example.alertengine.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * A team's working hours: a weekday window plus an optional weekend window,
 * both interpreted in the team's timezone.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusinessHours {

    @Column(name = "business_time_zone")
    @Builder.Default
    private String timezone = "UTC";

    @Column(name = "weekday_start")
    @Builder.Default
    private LocalTime weekdayStart = LocalTime.of(9, 0);

    @Column(name = "weekday_end")
    @Builder.Default
    private LocalTime weekdayEnd = LocalTime.of(17, 0);

    @Column(name = "weekend_enabled")
    private boolean weekendEnabled;

    @Column(name = "weekend_start")
    private LocalTime weekendStart;

    @Column(name = "weekend_end")
    private LocalTime weekendEnd;

    public static BusinessHours standard() {
        return BusinessHours.builder().build();
    }

    public ZoneId zone() {
        return timezone == null || timezone.isBlank() ? ZoneId.of("UTC") : ZoneId.of(timezone);
    }

    public boolean isWeekend(Instant instant) {
        DayOfWeek day = instant.atZone(zone()).getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    public boolean isOpen(Instant instant) {
        ZonedDateTime local = instant.atZone(zone());
        LocalTime[] window = windowFor(local.toLocalDate());
        if (window == null) return false;
        LocalTime time = local.toLocalTime();
        return !time.isBefore(window[0]) && time.isBefore(window[1]);
    }

    /**
     * The next instant at or after {@code instant} at which business hours are open,
     * or null when no window opens within the coming week.
     */
    public Instant nextOpening(Instant instant) {
        if (isOpen(instant)) return instant;
        ZonedDateTime local = instant.atZone(zone());
        for (int i = 0; i <= 7; i++) {
            LocalDate date = local.toLocalDate().plusDays(i);
            LocalTime[] window = windowFor(date);
            if (window == null) continue;
            ZonedDateTime opening = date.atTime(window[0]).atZone(zone());
            if (opening.isAfter(local)) return opening.toInstant();
        }
        return null;
    }

    private LocalTime[] windowFor(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        boolean weekend = day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
        if (!weekend) {
            return new LocalTime[]{weekdayStart, weekdayEnd};
        }
        if (!weekendEnabled) return null;
        return new LocalTime[]{
                weekendStart != null ? weekendStart : weekdayStart,
                weekendEnd != null ? weekendEnd : weekdayEnd
        };
    }
}
