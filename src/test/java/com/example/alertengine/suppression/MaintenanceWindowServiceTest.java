package com.example.alertengine.suppression;

import com.example.alertengine.IntegrationTestSupport;
import com.example.alertengine.domain.AlertHistory;
import com.example.alertengine.domain.AlertRule;
import com.example.alertengine.domain.AlertStatus;
import com.example.alertengine.domain.MaintenanceWindow;
import com.example.alertengine.domain.Recurrence;
import com.example.alertengine.domain.Severity;
import com.example.alertengine.exception.ConfigurationException;
import com.example.alertengine.exception.TimingInvariantException;
import com.example.alertengine.exception.UnknownEntityException;
import com.example.alertengine.service.AlertHistoryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MaintenanceWindowServiceTest extends IntegrationTestSupport {

    @Autowired
    private MaintenanceWindowService service;

    @Test
    void createRejectsInvertedRange() {
        MaintenanceWindow window = window("backwards", now(), now().minusSeconds(60));

        assertThrows(TimingInvariantException.class, () -> service.create(window, "ops"));
        assertEquals(0, maintenanceWindowRepository.count());
    }

    @Test
    void createRejectsEmptyRangeAndBadTimezone() {
        assertThrows(TimingInvariantException.class, () -> service.create(window("empty", now(), now()), "ops"));

        MaintenanceWindow badZone = window("bad zone", now(), now().plusSeconds(60));
        badZone.setTimezone("Mars/Olympus");
        assertThrows(ConfigurationException.class, () -> service.create(badZone, "ops"));
    }

    @Test
    void recurringWindowsNeedARecurrenceType() {
        MaintenanceWindow window = window("weekly", now(), now().plusSeconds(3600));
        window.setRecurring(true);

        assertThrows(ConfigurationException.class, () -> service.create(window, "ops"));
    }

    @Test
    void creationIsAnnouncedOnOpenTeamAlerts() {
        AlertRule rule = rule("cpu_high", 10);
        storedAlert("a-open", rule, Severity.HIGH, AlertStatus.ACTIVE, minutesAgo(5));
        storedAlert("a-closed", rule, Severity.HIGH, AlertStatus.RESOLVED, minutesAgo(5));

        MaintenanceWindow created = service.create(window("db upgrade", now().plusSeconds(600), now().plusSeconds(4200)), "ops");

        assertEquals("ops", created.getCreatedBy());
        List<AlertHistory> announced = alertHistoryRepository.findByEventTypeOrderByCreatedAtDesc(
                AlertHistoryService.MAINTENANCE_SCHEDULED);
        assertEquals(1, announced.size());
        assertEquals("a-open", announced.get(0).getAlertId());
    }

    @Test
    void statusReportsActiveAndUpcomingWindows() {
        MaintenanceWindow partial = window("partial", now().minusSeconds(60), now().plusSeconds(600));
        partial.setAffectedSystems(new HashSet<>(Set.of("disk_full", "cpu_high")));
        service.create(partial, "ops");
        service.create(window("tomorrow", now().plus(Duration.ofHours(20)), now().plus(Duration.ofHours(21))), "ops");
        service.create(window("next week", now().plus(Duration.ofDays(7)), now().plus(Duration.ofDays(8))), "ops");

        MaintenanceStatus status = service.status(TEAM);

        assertTrue(status.inMaintenance());
        assertEquals(MaintenanceStatus.Level.PARTIAL, status.suppressionLevel());
        assertEquals(Set.of("cpu_high", "disk_full"), status.affectedSystems());
        assertEquals(1, status.upcomingWindows().size());
        assertEquals("tomorrow", status.upcomingWindows().get(0).getName());
    }

    @Test
    void suppressAllMakesTheStatusFull() {
        MaintenanceWindow freeze = window("freeze", now().minusSeconds(60), now().plusSeconds(600));
        freeze.setSuppressAll(true);
        service.create(freeze, "ops");

        assertEquals(MaintenanceStatus.Level.FULL, service.status(TEAM).suppressionLevel());
        assertEquals(MaintenanceStatus.Level.NONE, service.status("team-search").suppressionLevel());
    }

    @Test
    void endedOneOffWindowsAreDisabled() {
        MaintenanceWindow created = service.create(window("done", now().minusSeconds(7200), now().minusSeconds(3600)), "ops");

        assertEquals(1, service.closeEndedWindows());

        assertFalse(service.get(created.getId()).isEnabled());
        assertEquals(0, service.closeEndedWindows());
    }

    @Test
    void endedRecurringWindowsRollForward() {
        Instant start = now().minus(Duration.ofDays(1)).minusSeconds(3600);
        MaintenanceWindow weekly = window("daily restart", start, start.plusSeconds(1800));
        weekly.setRecurring(true);
        weekly.setRecurrence(Recurrence.builder().type(Recurrence.Type.DAILY).maxOccurrences(5).build());
        MaintenanceWindow created = service.create(weekly, "ops");

        service.closeEndedWindows();

        MaintenanceWindow rolled = service.get(created.getId());
        assertTrue(rolled.isEnabled());
        assertEquals(start.plus(Duration.ofDays(2)), rolled.getStartTime());
        assertEquals(Duration.ofMinutes(30), Duration.between(rolled.getStartTime(), rolled.getEndTime()));
        assertEquals(3, rolled.getOccurrence());
    }

    @Test
    void exhaustedRecurrenceDisablesTheWindow() {
        Instant start = now().minus(Duration.ofDays(1)).minusSeconds(3600);
        MaintenanceWindow window = window("twice", start, start.plusSeconds(1800));
        window.setRecurring(true);
        window.setRecurrence(Recurrence.builder().type(Recurrence.Type.DAILY).maxOccurrences(2).build());
        MaintenanceWindow created = service.create(window, "ops");

        service.closeEndedWindows();

        assertFalse(service.get(created.getId()).isEnabled());
    }

    @Test
    void monthlyRecurrenceKeepsTheDayOfMonth() {
        Instant january31 = Instant.parse("2026-01-31T02:00:00Z");
        MaintenanceWindow window = window("month-end batch", january31, january31.plusSeconds(3600));
        window.setRecurring(true);
        window.setRecurrence(Recurrence.builder().type(Recurrence.Type.MONTHLY).build());
        String id = service.create(window, "ops").getId();

        service.closeEndedWindows();
        MaintenanceWindow march = service.get(id);
        assertEquals(Instant.parse("2026-03-31T02:00:00Z"), march.getStartTime());
        assertEquals(3, march.getOccurrence());

        clock.set(Instant.parse("2026-04-01T00:00:00Z"));
        service.closeEndedWindows();
        assertEquals(Instant.parse("2026-04-30T02:00:00Z"), service.get(id).getStartTime());

        clock.set(Instant.parse("2026-05-01T00:00:00Z"));
        service.closeEndedWindows();
        MaintenanceWindow may = service.get(id);
        assertEquals(Instant.parse("2026-05-31T02:00:00Z"), may.getStartTime());
        assertEquals(Instant.parse("2026-05-31T03:00:00Z"), may.getEndTime());
        assertEquals(5, may.getOccurrence());
    }

    @Test
    void createStampsTheClockTime() {
        MaintenanceWindow window = window("stamped", now().plusSeconds(60), now().plusSeconds(600));
        window.setCreatedAt(Instant.parse("2020-01-01T00:00:00Z"));

        MaintenanceWindow created = service.create(window, "ops");

        assertEquals(now(), service.get(created.getId()).getCreatedAt());
        assertEquals(now(), service.get(created.getId()).getUpdatedAt());
    }

    @Test
    void updateLeavesOmittedFieldsUntouched() {
        MaintenanceWindow window = window("freeze", now().plusSeconds(60), now().plusSeconds(3600));
        window.setDescription("release freeze");
        window.setSuppressAll(true);
        window.setPriority(5);
        window.setNotifyBeforeMinutes(45);
        String id = service.create(window, "ops").getId();
        clock.advance(Duration.ofMinutes(5));

        service.update(id, new MaintenanceWindowChanges("code freeze", null, null, null, null, null, null,
                null, null, null, null, null, null));

        MaintenanceWindow updated = service.get(id);
        assertEquals("code freeze", updated.getName());
        assertEquals("release freeze", updated.getDescription());
        assertTrue(updated.isSuppressAll());
        assertEquals(5, updated.getPriority());
        assertEquals(45, updated.getNotifyBeforeMinutes());
        assertTrue(updated.isEnabled());
        assertEquals(now(), updated.getUpdatedAt());
    }

    @Test
    void updateAppliesExplicitValues() {
        String id = service.create(window("freeze", now().plusSeconds(60), now().plusSeconds(3600)), "ops").getId();

        service.update(id, new MaintenanceWindowChanges(null, null, null, null, null,
                new HashSet<>(Set.of("cpu_high")), null, true, 3, null, false, null, null));

        MaintenanceWindow updated = service.get(id);
        assertEquals("freeze", updated.getName());
        assertEquals(Set.of("cpu_high"), updated.getAffectedSystems());
        assertTrue(updated.isSuppressAll());
        assertEquals(3, updated.getPriority());
        assertFalse(updated.isEnabled());
    }

    @Test
    void updateStillRejectsInvertedRange() {
        String id = service.create(window("freeze", now().plusSeconds(60), now().plusSeconds(3600)), "ops").getId();

        assertThrows(TimingInvariantException.class, () -> service.update(id, new MaintenanceWindowChanges(
                null, null, null, now(), null, null, null, null, null, null, null, null, null)));
    }

    @Test
    void unknownWindowIsReported() {
        assertThrows(UnknownEntityException.class, () -> service.get("missing"));
        assertThrows(UnknownEntityException.class, () -> service.delete("missing"));
    }

    private MaintenanceWindow window(String name, Instant start, Instant end) {
        return MaintenanceWindow.builder()
                .name(name)
                .startTime(start)
                .endTime(end)
                .teamId(TEAM)
                .build();
    }
}
