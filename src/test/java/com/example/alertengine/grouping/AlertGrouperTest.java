package com.example.alertengine.grouping;

import com.example.alertengine.IntegrationTestSupport;
import com.example.alertengine.domain.Alert;
import com.example.alertengine.domain.AlertGroup;
import com.example.alertengine.domain.AlertGroupMember;
import com.example.alertengine.domain.AlertRule;
import com.example.alertengine.domain.AlertStatus;
import com.example.alertengine.domain.Severity;
import com.example.alertengine.domain.SuppressionRule;
import com.example.alertengine.exception.UnknownEntityException;
import com.example.alertengine.suppression.SuppressionDecision;
import com.example.alertengine.suppression.SuppressionReason;
import com.example.alertengine.support.ConflictRetrier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AlertGrouperTest extends IntegrationTestSupport {

    @Autowired
    private AlertGrouper grouper;

    @Autowired
    private ConflictRetrier conflictRetrier;

    private AlertRule cpuRule;

    @BeforeEach
    void setUp() {
        cpuRule = rule("cpu_high", 100);
    }

    @Test
    void firstAlertSeedsAGroup() {
        Alert alert = storedAlert("a-1", cpuRule, Severity.MEDIUM, AlertStatus.ACTIVE, now());

        String groupId = grouper.attachToGroup(alert, SuppressionDecision.allow());

        AlertGroup group = grouper.get(groupId);
        assertEquals("cpu_high", group.getGroupKey());
        assertEquals(1, group.getAlertCount());
        assertEquals("a-1", group.getFirstAlertId());
        assertEquals("a-1", group.getLastAlertId());
        assertEquals(Duration.ZERO, group.getTimeSpan());
    }

    @Test
    void alertsWithinTheWindowShareTheGroup() {
        String first = grouper.attachToGroup(
                storedAlert("a-1", cpuRule, Severity.MEDIUM, AlertStatus.ACTIVE, now()), SuppressionDecision.allow());
        clock.advance(Duration.ofMinutes(10));
        String second = grouper.attachToGroup(
                storedAlert("a-2", cpuRule, Severity.CRITICAL, AlertStatus.ACTIVE, now()), suppressed());

        assertEquals(first, second);
        AlertGroup group = grouper.get(first);
        assertEquals(2, group.getAlertCount());
        assertEquals("a-2", group.getLastAlertId());
        assertEquals(Severity.CRITICAL, group.getSeverity());
        assertEquals(Set.of(Severity.MEDIUM, Severity.CRITICAL), group.getSeverities());
        assertEquals(Duration.ofMinutes(10), group.getTimeSpan());

        List<AlertGroupMember> members = grouper.members(first);
        assertEquals(2, members.size());
        assertFalse(members.get(0).isSuppressed());
        assertTrue(members.get(1).isSuppressed());
    }

    @Test
    void quietPeriodStartsANewGroup() {
        String first = grouper.attachToGroup(
                storedAlert("a-1", cpuRule, Severity.HIGH, AlertStatus.ACTIVE, now()), SuppressionDecision.allow());
        clock.advance(Duration.ofMinutes(16));
        String second = grouper.attachToGroup(
                storedAlert("a-2", cpuRule, Severity.HIGH, AlertStatus.ACTIVE, now()), SuppressionDecision.allow());

        assertNotEquals(first, second);
    }

    @Test
    void groupingRuleWidensTheWindow() {
        suppressionRuleRepository.save(SuppressionRule.builder()
                .name("slow cpu bursts")
                .ruleType(SuppressionRule.RuleType.GROUPING)
                .conditions("{\"metric_name\":\"cpu_high\"}")
                .windowSizeMinutes(60)
                .teamId(TEAM)
                .createdAt(now())
                .build());

        String first = grouper.attachToGroup(
                storedAlert("a-1", cpuRule, Severity.HIGH, AlertStatus.ACTIVE, now()), SuppressionDecision.allow());
        clock.advance(Duration.ofMinutes(45));
        String second = grouper.attachToGroup(
                storedAlert("a-2", cpuRule, Severity.HIGH, AlertStatus.ACTIVE, now()), SuppressionDecision.allow());

        assertEquals(first, second);
    }

    @Test
    void dimensionsSplitGroups() {
        Alert web = storedAlert("a-web", cpuRule, Severity.HIGH, AlertStatus.ACTIVE, now());
        web.setDimensions(new HashMap<>(Map.of("host", "web-1")));
        Alert db = storedAlert("a-db", cpuRule, Severity.HIGH, AlertStatus.ACTIVE, now());
        db.setDimensions(new HashMap<>(Map.of("host", "db-1")));

        String webGroup = grouper.attachToGroup(web, SuppressionDecision.allow());
        String dbGroup = grouper.attachToGroup(db, SuppressionDecision.allow());

        assertNotEquals(webGroup, dbGroup);
        assertEquals("cpu_high|host=web-1", grouper.get(webGroup).getGroupKey());
    }

    @Test
    void attachingTwiceIsANoOp() {
        Alert alert = storedAlert("a-1", cpuRule, Severity.HIGH, AlertStatus.ACTIVE, now());

        String first = grouper.attachToGroup(alert, SuppressionDecision.allow());
        String again = grouper.attachToGroup(alert, SuppressionDecision.allow());

        assertEquals(first, again);
        assertEquals(1, grouper.get(first).getAlertCount());
        assertEquals(1, grouper.members(first).size());
    }

    @Test
    void suppressAllMaintenanceMarksTheGroup() {
        SuppressionDecision freeze = SuppressionDecision.suppress(SuppressionReason.MAINTENANCE_WINDOW,
                now().plusSeconds(600), Map.of("maintenance_window_id", "w-1", "suppress_all", true));

        String groupId = grouper.attachToGroup(
                storedAlert("a-1", cpuRule, Severity.HIGH, AlertStatus.ACTIVE, now()), freeze);

        AlertGroup group = grouper.get(groupId);
        assertTrue(group.isSuppressionApplied());
        assertEquals(now(), group.getSuppressedAt());
    }

    @Test
    void unknownGroupIsReported() {
        assertThrows(UnknownEntityException.class, () -> grouper.get("missing"));
    }

    @Test
    void concurrentFirstAlertsSeedOneGroup() throws Exception {
        Alert first = storedAlert("a-1", cpuRule, Severity.HIGH, AlertStatus.ACTIVE, now());
        Alert second = storedAlert("a-2", cpuRule, Severity.HIGH, AlertStatus.ACTIVE, now().plusSeconds(30));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch attached = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        try {
            Future<String> holder = pool.submit(() -> inTransaction(() -> {
                String groupId = grouper.attachToGroup(first, SuppressionDecision.allow());
                attached.countDown();
                await(release);
                return groupId;
            }));
            assertTrue(attached.await(10, TimeUnit.SECONDS));

            Future<String> contender = pool.submit(() -> conflictRetrier.inTransaction("grouping",
                    () -> grouper.attachToGroup(second, SuppressionDecision.allow())));
            Thread.sleep(300);
            release.countDown();

            assertEquals(holder.get(30, TimeUnit.SECONDS), contender.get(30, TimeUnit.SECONDS));
        } finally {
            release.countDown();
            pool.shutdown();
        }

        List<AlertGroup> groups = alertGroupRepository.findAll().stream()
                .filter(g -> g.getGroupKey().equals("cpu_high"))
                .collect(Collectors.toList());
        assertEquals(1, groups.size());
        assertEquals(2, groups.get(0).getAlertCount());
        assertEquals(2, grouper.members(groups.get(0).getId()).size());
    }

    private static void await(CountDownLatch latch) {
        try {
            assertTrue(latch.await(10, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private SuppressionDecision suppressed() {
        Instant until = now().plus(Duration.ofMinutes(30));
        return SuppressionDecision.suppress(SuppressionReason.DUPLICATE_ALERT, until, Map.of("duplicate_count", 1L));
    }
}
