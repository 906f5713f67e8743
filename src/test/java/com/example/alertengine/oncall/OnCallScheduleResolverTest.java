package com.example.alertengine.oncall;

import com.example.alertengine.IntegrationTestSupport;
import com.example.alertengine.domain.OnCallSchedule;
import com.example.alertengine.domain.OnCallScheduleEntry;
import com.example.alertengine.domain.Severity;
import com.example.alertengine.exception.TimingInvariantException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OnCallScheduleResolverTest extends IntegrationTestSupport {

    @Autowired
    private OnCallScheduleResolver resolver;

    @Autowired
    private OnCallScheduleService scheduleService;

    @Test
    void nobodyOnCallWithoutSchedules() {
        assertTrue(resolver.currentOnCall(TEAM, Severity.HIGH).isEmpty());
    }

    @Test
    void coveringShiftIsResolved() {
        OnCallSchedule primary = schedule("primary");
        shift(primary, "alice", hoursFromNow(-2), hoursFromNow(6), true);
        shift(primary, "bob", hoursFromNow(6), hoursFromNow(14), true);

        OnCallResolution resolution = resolver.currentOnCall(TEAM, Severity.HIGH).orElseThrow();

        assertEquals("alice", resolution.user());
        assertTrue(resolution.primary());
        assertEquals(primary.getId(), resolution.scheduleId());
        assertFalse(resolution.override());
    }

    @Test
    void shiftEndIsExclusive() {
        OnCallSchedule primary = schedule("primary");
        shift(primary, "alice", hoursFromNow(-8), now(), true);
        shift(primary, "bob", now(), hoursFromNow(8), true);

        assertEquals("bob", resolver.currentOnCall(TEAM, Severity.HIGH).orElseThrow().user());
    }

    @Test
    void primaryBeatsBackup() {
        OnCallSchedule rotation = schedule("rotation");
        shift(rotation, "backup-carol", hoursFromNow(-1), hoursFromNow(1), false);
        shift(rotation, "alice", hoursFromNow(-1), hoursFromNow(1), true);

        assertEquals("alice", resolver.currentOnCall(TEAM, Severity.HIGH).orElseThrow().user());
    }

    @Test
    void earliestScheduleWinsAmongPrimaries() {
        OnCallSchedule older = schedule("older");
        clock.advance(Duration.ofMinutes(1));
        OnCallSchedule newer = schedule("newer");
        shift(newer, "bob", hoursFromNow(-1), hoursFromNow(1), true);
        shift(older, "alice", hoursFromNow(-1), hoursFromNow(1), true);

        assertEquals("alice", resolver.currentOnCall(TEAM, Severity.HIGH).orElseThrow().user());
    }

    @Test
    void overrideHidesTheReplacedShift() {
        OnCallSchedule rotation = schedule("rotation");
        shift(rotation, "alice", hoursFromNow(-4), hoursFromNow(4), true);
        scheduleService.addOverride(rotation.getId(), "dave", "alice", hoursFromNow(-1), hoursFromNow(1), "dentist");

        OnCallResolution resolution = resolver.currentOnCall(TEAM, Severity.HIGH).orElseThrow();
        assertEquals("dave", resolution.user());
        assertTrue(resolution.override());
        assertTrue(resolution.primary());

        clock.advance(Duration.ofHours(2));
        assertEquals("alice", resolver.currentOnCall(TEAM, Severity.HIGH).orElseThrow().user());
    }

    @Test
    void schedulesLimitedToSeveritiesAndEffectiveRange() {
        OnCallSchedule criticalOnly = onCallScheduleRepository.save(OnCallSchedule.builder()
                .teamId(TEAM)
                .name("critical only")
                .applicableSeverities(new HashSet<>(EnumSet.of(Severity.CRITICAL)))
                .createdAt(now())
                .build());
        shift(criticalOnly, "alice", hoursFromNow(-1), hoursFromNow(1), true);
        OnCallSchedule expired = onCallScheduleRepository.save(OnCallSchedule.builder()
                .teamId(TEAM)
                .name("expired")
                .effectiveUntil(now())
                .createdAt(now())
                .build());
        shift(expired, "bob", hoursFromNow(-1), hoursFromNow(1), true);

        assertEquals("alice", resolver.currentOnCall(TEAM, Severity.CRITICAL).orElseThrow().user());
        Optional<OnCallResolution> high = resolver.currentOnCall(TEAM, Severity.HIGH);
        assertTrue(high.isEmpty());
    }

    @Test
    void disabledSchedulesAreSkipped() {
        OnCallSchedule rotation = schedule("rotation");
        rotation.setEnabled(false);
        onCallScheduleRepository.save(rotation);
        shift(rotation, "alice", hoursFromNow(-1), hoursFromNow(1), true);

        assertTrue(resolver.currentOnCall(TEAM, Severity.HIGH).isEmpty());
    }

    @Test
    void invertedShiftsAreRejected() {
        OnCallSchedule rotation = schedule("rotation");
        OnCallScheduleEntry inverted = OnCallScheduleEntry.builder()
                .userId("alice")
                .startTime(hoursFromNow(2))
                .endTime(hoursFromNow(1))
                .build();

        assertThrows(TimingInvariantException.class, () -> scheduleService.addEntry(rotation.getId(), inverted));
        assertThrows(TimingInvariantException.class, () -> scheduleService.addOverride(
                rotation.getId(), "dave", "alice", now(), now(), "none"));
    }

    @Test
    void writesAreStampedWithTheClock() {
        OnCallSchedule schedule = scheduleService.createSchedule(OnCallSchedule.builder()
                .teamId(TEAM)
                .name("follow the sun")
                .createdAt(Instant.parse("2020-01-01T00:00:00Z"))
                .build());
        clock.advance(Duration.ofMinutes(3));
        OnCallScheduleEntry entry = scheduleService.addEntry(schedule.getId(), OnCallScheduleEntry.builder()
                .userId("alice")
                .startTime(hoursFromNow(-1))
                .endTime(hoursFromNow(7))
                .primary(true)
                .createdAt(Instant.parse("2020-01-01T00:00:00Z"))
                .build());

        assertEquals(now().minus(Duration.ofMinutes(3)),
                onCallScheduleRepository.findById(schedule.getId()).orElseThrow().getCreatedAt());
        assertEquals(now(), onCallScheduleEntryRepository.findById(entry.getId()).orElseThrow().getCreatedAt());
        assertEquals("alice", resolver.currentOnCall(TEAM, Severity.HIGH).orElseThrow().user());
    }

    private Instant hoursFromNow(long hours) {
        return now().plus(Duration.ofHours(hours));
    }
}
