package com.example.alertengine.suppression;

import com.example.alertengine.domain.Alert;
import com.example.alertengine.domain.AlertStatus;
import com.example.alertengine.domain.MaintenanceWindow;
import com.example.alertengine.exception.ConfigurationException;
import com.example.alertengine.exception.TimingInvariantException;
import com.example.alertengine.exception.UnknownEntityException;
import com.example.alertengine.repository.AlertRepository;
import com.example.alertengine.repository.MaintenanceWindowRepository;
import com.example.alertengine.service.AlertHistoryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maintenance window management: validated writes, active/upcoming lookups and the
 * end-of-window bookkeeping (disable one-off windows, roll recurring ones forward).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MaintenanceWindowService {

    private static final Duration UPCOMING_HORIZON = Duration.ofHours(24);

    private final MaintenanceWindowRepository windowRepository;
    private final AlertRepository alertRepository;
    private final AlertHistoryService historyService;
    private final Clock clock;

    @Transactional
    public MaintenanceWindow create(MaintenanceWindow window, String createdBy) {
        validate(window);
        window.setId(null);
        window.setCreatedBy(createdBy);
        window.setCreatedAt(clock.instant());
        window.setOccurrence(1);
        window.setRecurrenceAnchor(window.getStartTime());
        MaintenanceWindow saved = windowRepository.save(window);
        log.info("Maintenance window '{}' scheduled {} - {} for team {}",
                saved.getName(), saved.getStartTime(), saved.getEndTime(),
                saved.getTeamId() == null ? "(global)" : saved.getTeamId());
        announce(saved);
        return saved;
    }

    @Transactional
    public MaintenanceWindow update(String id, MaintenanceWindowChanges changes) {
        MaintenanceWindow window = get(id);
        if (changes.name() != null) window.setName(changes.name());
        if (changes.description() != null) window.setDescription(changes.description());
        if (changes.startTime() != null) window.setStartTime(changes.startTime());
        if (changes.endTime() != null) window.setEndTime(changes.endTime());
        if (changes.timezone() != null) window.setTimezone(changes.timezone());
        if (changes.affectedSystems() != null) {
            window.getAffectedSystems().clear();
            window.getAffectedSystems().addAll(changes.affectedSystems());
        }
        if (changes.affectedSeverities() != null) {
            window.getAffectedSeverities().clear();
            window.getAffectedSeverities().addAll(changes.affectedSeverities());
        }
        if (changes.suppressAll() != null) window.setSuppressAll(changes.suppressAll());
        if (changes.priority() != null) window.setPriority(changes.priority());
        if (changes.notifyBeforeMinutes() != null) window.setNotifyBeforeMinutes(changes.notifyBeforeMinutes());
        if (changes.enabled() != null) window.setEnabled(changes.enabled());
        if (changes.recurring() != null) window.setRecurring(changes.recurring());
        if (changes.recurrence() != null) {
            window.setRecurrence(changes.recurrence());
            window.setRecurrenceAnchor(window.getStartTime());
            window.setOccurrence(1);
        } else if (changes.startTime() != null) {
            window.setRecurrenceAnchor(window.getStartTime());
            window.setOccurrence(1);
        }
        validate(window);
        window.setUpdatedAt(clock.instant());
        return windowRepository.save(window);
    }

    @Transactional
    public void delete(String id) {
        MaintenanceWindow window = get(id);
        windowRepository.delete(window);
        log.info("Maintenance window '{}' ({}) deleted", window.getName(), id);
    }

    public MaintenanceWindow get(String id) {
        return windowRepository.findById(id)
                .orElseThrow(() -> new UnknownEntityException("Maintenance window", id));
    }

    public List<MaintenanceWindow> list(String teamId) {
        return windowRepository.findVisibleTo(teamId);
    }

    /** Enabled windows covering now for the team (global windows included), highest priority first. */
    public List<MaintenanceWindow> findActive(String teamId) {
        return windowRepository.findActive(clock.instant(), teamId);
    }

    public MaintenanceStatus status(String teamId) {
        Instant now = clock.instant();
        List<MaintenanceWindow> active = windowRepository.findActive(now, teamId);
        List<MaintenanceWindow> upcoming = windowRepository.findUpcoming(now, now.plus(UPCOMING_HORIZON), teamId);

        Set<String> systems = new TreeSet<>();
        active.forEach(w -> systems.addAll(w.getAffectedSystems()));

        MaintenanceStatus.Level level;
        if (active.isEmpty()) {
            level = MaintenanceStatus.Level.NONE;
        } else if (active.stream().anyMatch(MaintenanceWindow::isSuppressAll)) {
            level = MaintenanceStatus.Level.FULL;
        } else {
            level = MaintenanceStatus.Level.PARTIAL;
        }
        return new MaintenanceStatus(teamId, active, upcoming, systems, level);
    }

    /**
     * Closes windows whose end has passed: one-off windows are disabled, recurring windows
     * move to their next occurrence that has not ended yet, or are disabled once the
     * recurrence is exhausted.
     *
     * @return number of windows touched
     */
    @Transactional
    public int closeEndedWindows() {
        Instant now = clock.instant();
        int touched = 0;
        for (MaintenanceWindow window : windowRepository.findByEnabledTrueAndEndTimeBefore(now)) {
            if (window.isRecurring() && window.getRecurrence() != null && rollForward(window, now)) {
                log.info("Maintenance window '{}' rolled forward to occurrence {} ({} - {})",
                        window.getName(), window.getOccurrence(), window.getStartTime(), window.getEndTime());
            } else {
                window.setEnabled(false);
                log.info("Maintenance window '{}' ended, disabled", window.getName());
            }
            window.setUpdatedAt(now);
            windowRepository.save(window);
            touched++;
        }
        return touched;
    }

    private boolean rollForward(MaintenanceWindow window, Instant now) {
        Duration length = Duration.between(window.getStartTime(), window.getEndTime());
        ZoneId zone = window.zone();
        Instant anchor = window.getRecurrenceAnchor() != null ? window.getRecurrenceAnchor() : window.getStartTime();
        int anchorOccurrence = window.getRecurrenceAnchor() != null ? 1 : window.getOccurrence();
        int occurrence = window.getOccurrence();
        Instant start;
        do {
            occurrence++;
            start = window.getRecurrence().occurrenceStart(anchor, occurrence - anchorOccurrence, zone);
            if (!window.getRecurrence().allows(occurrence, start)) return false;
        } while (start.plus(length).isBefore(now));
        window.setStartTime(start);
        window.setEndTime(start.plus(length));
        window.setOccurrence(occurrence);
        return true;
    }

    private void validate(MaintenanceWindow window) {
        if (window.getName() == null || window.getName().isBlank()) {
            throw new ConfigurationException("Maintenance window name is required");
        }
        if (window.getStartTime() == null || window.getEndTime() == null
                || !window.getEndTime().isAfter(window.getStartTime())) {
            throw new TimingInvariantException("Maintenance window '" + window.getName() + "'",
                    window.getStartTime(), window.getEndTime());
        }
        try {
            window.zone();
        } catch (DateTimeException e) {
            throw new ConfigurationException("Unknown timezone: " + window.getTimezone(), e);
        }
        if (window.isRecurring() && (window.getRecurrence() == null || window.getRecurrence().getType() == null)) {
            throw new ConfigurationException("Recurring maintenance window needs a recurrence type");
        }
    }

    private void announce(MaintenanceWindow window) {
        List<Alert> open = alertRepository.findOpenForTeam(
                EnumSet.of(AlertStatus.ACTIVE, AlertStatus.ACKNOWLEDGED), window.getTeamId());
        for (Alert alert : open) {
            historyService.record(alert.getId(), AlertHistoryService.MAINTENANCE_SCHEDULED,
                    "Maintenance window '" + window.getName() + "' scheduled",
                    window.getCreatedBy(),
                    Map.of("maintenance_window_id", window.getId(),
                            "start_time", window.getStartTime().toString(),
                            "end_time", window.getEndTime().toString()));
        }
    }
}
