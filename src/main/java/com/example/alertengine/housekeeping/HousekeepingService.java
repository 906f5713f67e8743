package com.example.alertengine.housekeeping;

import com.example.alertengine.config.AlertingProperties;
import com.example.alertengine.domain.AlertGroup;
import com.example.alertengine.repository.AlertGroupMemberRepository;
import com.example.alertengine.repository.AlertGroupRepository;
import com.example.alertengine.repository.RateLimitWindowRepository;
import com.example.alertengine.repository.SuppressionLogRepository;
import com.example.alertengine.suppression.MaintenanceWindowService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.IntSupplier;
import java.util.stream.Collectors;

/**
 * Periodic retention cleanup. Every task only touches records already past their
 * horizon, so runs may overlap with live evaluation and with each other. Stale groups
 * are locked and re-checked against the horizon at delete time, so a group that took
 * an alert after it was picked survives.
 */
@Slf4j
@Service
public class HousekeepingService {

    private final SuppressionLogRepository suppressionLogRepository;
    private final AlertGroupRepository groupRepository;
    private final AlertGroupMemberRepository memberRepository;
    private final RateLimitWindowRepository rateLimitRepository;
    private final MaintenanceWindowService maintenanceWindowService;
    private final AlertingProperties properties;
    private final MeterRegistry meterRegistry;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public HousekeepingService(SuppressionLogRepository suppressionLogRepository,
                               AlertGroupRepository groupRepository,
                               AlertGroupMemberRepository memberRepository,
                               RateLimitWindowRepository rateLimitRepository,
                               MaintenanceWindowService maintenanceWindowService,
                               AlertingProperties properties,
                               MeterRegistry meterRegistry,
                               PlatformTransactionManager transactionManager,
                               Clock clock) {
        this.suppressionLogRepository = suppressionLogRepository;
        this.groupRepository = groupRepository;
        this.memberRepository = memberRepository;
        this.rateLimitRepository = rateLimitRepository;
        this.maintenanceWindowService = maintenanceWindowService;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${alerting.housekeeping.interval-ms:300000}",
               initialDelayString = "${alerting.housekeeping.interval-ms:300000}")
    public void scheduledRun() {
        HousekeepingReport report = runOnce();
        log.info("Housekeeping: {}", report);
    }

    public HousekeepingReport runOnce() {
        Instant now = clock.instant();
        AlertingProperties.HousekeepingConfig config = properties.getHousekeeping();

        int logs = task("suppression_logs", () -> suppressionLogRepository.deleteOlderThan(
                now.minus(Duration.ofDays(config.getSuppressionLogRetentionDays()))));

        int[] groups = new int[2];
        Instant groupCutoff = now.minus(Duration.ofHours(properties.getGrouping().getRetentionHours()));
        task("alert_groups", () -> {
            List<String> candidates = groupRepository.findStaleIds(groupCutoff);
            if (candidates.isEmpty()) return 0;
            List<String> stale = groupRepository.lockStale(candidates, groupCutoff).stream()
                    .map(AlertGroup::getId)
                    .collect(Collectors.toList());
            if (stale.isEmpty()) return 0;
            groups[1] = memberRepository.deleteForStaleGroups(stale, groupCutoff);
            groups[0] = groupRepository.deleteStale(stale, groupCutoff);
            return groups[0];
        });

        int windows = task("rate_limit_windows", () -> rateLimitRepository.resetSpent(
                now.minus(Duration.ofMinutes(config.getRateLimitGraceMinutes()))));

        int maintenance = task("maintenance_windows", maintenanceWindowService::closeEndedWindows);

        return new HousekeepingReport(logs, groups[0], groups[1], windows, maintenance);
    }

    private int task(String kind, IntSupplier work) {
        try {
            Integer count = transactionTemplate.execute(status -> work.getAsInt());
            int affected = count == null ? 0 : count;
            if (affected > 0) {
                meterRegistry.counter("alerting.housekeeping.deleted", "kind", kind).increment(affected);
                log.debug("Housekeeping {}: {} records", kind, affected);
            }
            return affected;
        } catch (RuntimeException e) {
            log.error("Housekeeping task {} failed: {}", kind, e.getMessage());
            meterRegistry.counter("alerting.housekeeping.failures", "kind", kind).increment();
            return 0;
        }
    }
}
