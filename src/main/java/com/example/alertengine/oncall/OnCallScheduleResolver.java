package com.example.alertengine.oncall;

import com.example.alertengine.domain.OnCallScheduleEntry;
import com.example.alertengine.domain.Severity;
import com.example.alertengine.repository.OnCallScheduleEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves the responder currently on call for a team and severity.
 * <p>
 * Only entries whose shift contains now, on enabled schedules that apply to the severity
 * and are within their effective range, are considered. An override entry hides the entry
 * of the user it replaces on the same schedule; the replaced entry itself stays in place.
 * Primary entries win over backups, then the earliest-created schedule.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OnCallScheduleResolver {

    private static final Comparator<OnCallScheduleEntry> PRECEDENCE =
            Comparator.comparing((OnCallScheduleEntry e) -> !e.isPrimary())
                    .thenComparing(e -> e.getSchedule().getCreatedAt())
                    .thenComparing(e -> !e.isOverride())
                    .thenComparing(OnCallScheduleEntry::getCreatedAt)
                    .thenComparing(OnCallScheduleEntry::getId);

    private final OnCallScheduleEntryRepository entryRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<OnCallResolution> currentOnCall(String teamId, Severity severity) {
        Instant now = clock.instant();
        List<OnCallScheduleEntry> covering = entryRepository.findCovering(teamId, now).stream()
                .filter(entry -> entry.covers(now))
                .filter(entry -> entry.getSchedule().appliesTo(severity, now))
                .toList();

        Set<String> replaced = covering.stream()
                .filter(entry -> entry.isOverride() && entry.getOriginalUserId() != null)
                .map(entry -> slot(entry.getSchedule().getId(), entry.getOriginalUserId()))
                .collect(Collectors.toSet());

        Optional<OnCallResolution> resolution = covering.stream()
                .filter(entry -> entry.isOverride() || !replaced.contains(slot(entry.getSchedule().getId(), entry.getUserId())))
                .min(PRECEDENCE)
                .map(entry -> new OnCallResolution(
                        entry.getUserId(),
                        entry.isPrimary(),
                        entry.getSchedule().getId(),
                        entry.getSchedule().getName(),
                        entry.getBackupUserId(),
                        entry.isOverride(),
                        entry.getId()));

        if (resolution.isEmpty()) {
            log.debug("Nobody on call for team {} at severity {}", teamId, severity.code());
        }
        return resolution;
    }

    private static String slot(String scheduleId, String userId) {
        return scheduleId + "|" + userId;
    }
}
