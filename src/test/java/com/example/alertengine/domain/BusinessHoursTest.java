package com.example.alertengine.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

class BusinessHoursTest {

    // 2026-03-04 is a Wednesday, 2026-03-07 a Saturday
    private static final Instant WEDNESDAY_MORNING = Instant.parse("2026-03-04T10:00:00Z");
    private static final Instant WEDNESDAY_EVENING = Instant.parse("2026-03-04T20:00:00Z");
    private static final Instant SATURDAY_NOON = Instant.parse("2026-03-07T12:00:00Z");

    @Test
    void standardHoursAreWeekdaysNineToFive() {
        BusinessHours hours = BusinessHours.standard();

        assertTrue(hours.isOpen(WEDNESDAY_MORNING));
        assertTrue(hours.isOpen(Instant.parse("2026-03-04T09:00:00Z")));
        assertFalse(hours.isOpen(Instant.parse("2026-03-04T17:00:00Z")));
        assertFalse(hours.isOpen(WEDNESDAY_EVENING));
        assertFalse(hours.isOpen(SATURDAY_NOON));
        assertTrue(hours.isWeekend(SATURDAY_NOON));
    }

    @Test
    void hoursFollowTheTeamTimezone() {
        BusinessHours hours = BusinessHours.builder().timezone("America/New_York").build();

        // 10:00 UTC is 05:00 in New York
        assertFalse(hours.isOpen(WEDNESDAY_MORNING));
        assertTrue(hours.isOpen(Instant.parse("2026-03-04T15:00:00Z")));
    }

    @Test
    void optionalWeekendWindow() {
        BusinessHours hours = BusinessHours.builder()
                .weekendEnabled(true)
                .weekendStart(LocalTime.of(10, 0))
                .weekendEnd(LocalTime.of(14, 0))
                .build();

        assertTrue(hours.isOpen(SATURDAY_NOON));
        assertFalse(hours.isOpen(Instant.parse("2026-03-07T15:00:00Z")));
    }

    @Test
    void nextOpeningSkipsTheWeekend() {
        BusinessHours hours = BusinessHours.standard();

        assertEquals(Instant.parse("2026-03-05T09:00:00Z"), hours.nextOpening(WEDNESDAY_EVENING));
        assertEquals(Instant.parse("2026-03-09T09:00:00Z"), hours.nextOpening(SATURDAY_NOON));
        assertEquals(WEDNESDAY_MORNING, hours.nextOpening(WEDNESDAY_MORNING));
    }
}
