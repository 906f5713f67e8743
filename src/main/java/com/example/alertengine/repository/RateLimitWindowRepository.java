package com.example.alertengine.repository;

import com.example.alertengine.domain.RateLimitWindow;
import com.example.alertengine.domain.RateLimitWindow.LimitType;
import com.example.alertengine.domain.Severity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface RateLimitWindowRepository extends JpaRepository<RateLimitWindow, String> {

    @Query("SELECT w FROM RateLimitWindow w WHERE " +
           "(w.limitType = :rule AND w.ruleId = :ruleId) OR " +
           "(w.limitType = :team AND w.teamId = :teamId) OR " +
           "(w.limitType = :metric AND w.metricName = :metricName) OR " +
           "(w.limitType = :severityScope AND w.severity = :severity) OR " +
           "w.limitType = :global")
    List<RateLimitWindow> findApplicable(String ruleId, String teamId, String metricName, Severity severity,
                                         LimitType rule, LimitType team, LimitType metric,
                                         LimitType severityScope, LimitType global);

    default List<RateLimitWindow> findApplicable(String ruleId, String teamId, String metricName, Severity severity) {
        return findApplicable(ruleId, teamId, metricName, severity,
                LimitType.RULE, LimitType.TEAM, LimitType.METRIC, LimitType.SEVERITY, LimitType.GLOBAL);
    }

    /** Opens a fresh window when the current one is spent. Idempotent within a window. */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE RateLimitWindow w SET w.currentCount = 0, w.windowStart = :now, w.nextResetAt = :nextReset " +
           "WHERE w.id = :id AND (w.nextResetAt IS NULL OR w.nextResetAt <= :now)")
    int resetIfSpent(String id, Instant now, Instant nextReset);

    /** Returns 0 when the window is already at its cap. */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE RateLimitWindow w SET w.currentCount = w.currentCount + 1, w.lastAlertAt = :now " +
           "WHERE w.id = :id AND w.currentCount < w.maxAlerts")
    int incrementIfBelowLimit(String id, Instant now);

    /** Zeroes windows whose reset point passed before {@code cutoff}; they reopen on the next alert. */
    @Modifying
    @Query("UPDATE RateLimitWindow w SET w.currentCount = 0, w.windowStart = NULL, w.nextResetAt = NULL " +
           "WHERE w.nextResetAt IS NOT NULL AND w.nextResetAt < :cutoff")
    int resetSpent(Instant cutoff);
}
