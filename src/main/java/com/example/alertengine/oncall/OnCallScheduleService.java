package com.example.alertengine.oncall;

import com.example.alertengine.domain.OnCallSchedule;
import com.example.alertengine.domain.OnCallScheduleEntry;
import com.example.alertengine.exception.ConfigurationException;
import com.example.alertengine.exception.TimingInvariantException;
import com.example.alertengine.exception.UnknownEntityException;
import com.example.alertengine.repository.OnCallScheduleEntryRepository;
import com.example.alertengine.repository.OnCallScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

/**
 * Writes on-call schedules, shifts and one-off overrides, rejecting empty or inverted ranges.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OnCallScheduleService {

    private final OnCallScheduleRepository scheduleRepository;
    private final OnCallScheduleEntryRepository entryRepository;
    private final Clock clock;

    @Transactional
    public OnCallSchedule createSchedule(OnCallSchedule schedule) {
        if (schedule.getTeamId() == null || schedule.getName() == null) {
            throw new ConfigurationException("On-call schedule needs a team and a name");
        }
        if (schedule.getEffectiveFrom() != null && schedule.getEffectiveUntil() != null
                && !schedule.getEffectiveUntil().isAfter(schedule.getEffectiveFrom())) {
            throw new TimingInvariantException("On-call schedule '" + schedule.getName() + "'",
                    schedule.getEffectiveFrom(), schedule.getEffectiveUntil());
        }
        if (schedule.getTimezone() == null) schedule.setTimezone("UTC");
        try {
            ZoneId.of(schedule.getTimezone());
        } catch (DateTimeException e) {
            throw new ConfigurationException("Unknown timezone: " + schedule.getTimezone(), e);
        }
        schedule.setCreatedAt(clock.instant());
        OnCallSchedule saved = scheduleRepository.save(schedule);
        log.info("On-call schedule '{}' created for team {}", saved.getName(), saved.getTeamId());
        return saved;
    }

    @Transactional
    public OnCallScheduleEntry addEntry(String scheduleId, OnCallScheduleEntry entry) {
        OnCallSchedule schedule = getSchedule(scheduleId);
        if (entry.getUserId() == null) {
            throw new ConfigurationException("On-call entry needs a user");
        }
        requireRange(entry.getStartTime(), entry.getEndTime(), entry.getUserId());
        entry.setSchedule(schedule);
        entry.setCreatedAt(clock.instant());
        return entryRepository.save(entry);
    }

    /**
     * Swap {@code originalUserId} for {@code userId} between start and end. The original
     * shift is kept; the override hides it while both cover the same instant.
     */
    @Transactional
    public OnCallScheduleEntry addOverride(String scheduleId, String userId, String originalUserId,
                                           Instant start, Instant end, String reason) {
        OnCallSchedule schedule = getSchedule(scheduleId);
        if (userId == null || originalUserId == null) {
            throw new ConfigurationException("Override needs both the covering and the original user");
        }
        requireRange(start, end, userId);
        boolean primary = entryRepository.findByScheduleIdOrderByStartTimeAsc(scheduleId).stream()
                .filter(e -> originalUserId.equals(e.getUserId()) && !e.isOverride())
                .filter(e -> e.getStartTime().isBefore(end) && e.getEndTime().isAfter(start))
                .findFirst()
                .map(OnCallScheduleEntry::isPrimary)
                .orElse(true);
        OnCallScheduleEntry override = OnCallScheduleEntry.builder()
                .schedule(schedule)
                .userId(userId)
                .startTime(start)
                .endTime(end)
                .primary(primary)
                .override(true)
                .overrideReason(reason)
                .originalUserId(originalUserId)
                .createdAt(clock.instant())
                .build();
        log.info("On-call override on '{}': {} covers for {} ({} - {})",
                schedule.getName(), userId, originalUserId, start, end);
        return entryRepository.save(override);
    }

    public OnCallSchedule getSchedule(String scheduleId) {
        return scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new UnknownEntityException("On-call schedule", scheduleId));
    }

    public List<OnCallSchedule> schedulesFor(String teamId) {
        return scheduleRepository.findByTeamIdOrderByCreatedAtAsc(teamId);
    }

    public List<OnCallScheduleEntry> entriesOf(String scheduleId) {
        return entryRepository.findByScheduleIdOrderByStartTimeAsc(scheduleId);
    }

    private static void requireRange(Instant start, Instant end, String userId) {
        if (start == null || end == null || !end.isAfter(start)) {
            throw new TimingInvariantException("On-call shift for " + userId, start, end);
        }
    }
}
