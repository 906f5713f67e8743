package com.example.alertengine.suppression;

import com.example.alertengine.domain.RateLimitWindow;
import com.example.alertengine.repository.RateLimitWindowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Counts allowed alerts against the configured rate-limit windows (rule, team, metric,
 * severity and global scopes). Counters live in the database and are only ever changed
 * through conditional UPDATE statements, so concurrent writers on any number of
 * instances neither lose increments nor push a window past its cap.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimitTracker {

    private final RateLimitWindowRepository windowRepository;

    /**
     * Suppression verdict from the first saturated window, visiting scopes from the most
     * specific (rule) to the broadest (global).
     */
    public Optional<SuppressionDecision> check(AlertFacts alert, Instant now) {
        return applicable(alert).stream()
                .filter(window -> window.effectiveCount(now) >= window.getMaxAlerts())
                .findFirst()
                .map(window -> SuppressionDecision.suppress(
                        SuppressionReason.RATE_LIMIT_EXCEEDED,
                        window.getNextResetAt() != null
                                ? window.getNextResetAt()
                                : now.plus(Duration.ofMinutes(window.getWindowMinutes())),
                        Map.of("limit_scope", window.getLimitType().name().toLowerCase(Locale.ROOT),
                                "scope_id", String.valueOf(window.scope()),
                                "current_count", window.effectiveCount(now),
                                "max_alerts", window.getMaxAlerts(),
                                "rate_limit_id", window.getId())));
    }

    /**
     * Count an allowed alert in every window that applies to it. Must run inside the
     * transaction that allowed the alert.
     *
     * @throws OptimisticLockingFailureException when a concurrent writer filled a window
     *                                           after this alert's check; the caller retries
     */
    public void record(AlertFacts alert, Instant now) {
        for (RateLimitWindow window : applicable(alert)) {
            Instant nextReset = now.plus(Duration.ofMinutes(window.getWindowMinutes()));
            if (windowRepository.resetIfSpent(window.getId(), now, nextReset) > 0) {
                log.debug("Rate limit window {} ({}) opened until {}", window.getId(), window.scope(), nextReset);
            }
            if (windowRepository.incrementIfBelowLimit(window.getId(), now) == 0) {
                throw new OptimisticLockingFailureException(
                        "Rate limit window " + window.getId() + " filled concurrently");
            }
        }
    }

    private List<RateLimitWindow> applicable(AlertFacts alert) {
        return windowRepository.findApplicable(alert.ruleId(), alert.teamId(), alert.metricName(), alert.severity())
                .stream()
                .sorted(Comparator.comparing(RateLimitWindow::getLimitType).thenComparing(RateLimitWindow::getId))
                .toList();
    }
}
