package com.example.alertengine.repository;

import com.example.alertengine.domain.Alert;
import com.example.alertengine.domain.AlertStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface AlertRepository extends JpaRepository<Alert, String> {

    List<Alert> findByStatusIn(Collection<AlertStatus> statuses);

    @Query("SELECT a FROM Alert a WHERE a.status IN :statuses AND (:teamId IS NULL OR a.teamId = :teamId)")
    List<Alert> findOpenForTeam(Collection<AlertStatus> statuses, String teamId);

    @Query("SELECT COUNT(a) FROM Alert a WHERE a.ruleId = :ruleId AND a.id <> :excludeId " +
           "AND a.status IN :statuses AND a.createdAt >= :since")
    long countForRuleWithStatusSince(String ruleId, String excludeId,
                                     Collection<AlertStatus> statuses, Instant since);

    @Query("SELECT COUNT(a) FROM Alert a WHERE a.ruleId = :ruleId AND a.id <> :excludeId AND a.createdAt >= :since")
    long countForRuleSince(String ruleId, String excludeId, Instant since);

    @Query("SELECT COUNT(a) FROM Alert a WHERE a.metricName = :metricName AND a.id <> :excludeId " +
           "AND (:teamId IS NULL OR a.teamId = :teamId) AND a.status IN :statuses AND a.createdAt >= :since")
    long countForMetricSince(String metricName, String teamId, String excludeId,
                             Collection<AlertStatus> statuses, Instant since);

    @Query("SELECT a.id FROM Alert a WHERE a.status = :status AND a.acknowledgedAt IS NULL ORDER BY a.createdAt")
    List<String> findUnacknowledgedIds(AlertStatus status);

    /**
     * Moves an alert from {@code expectedLevel} to {@code newLevel}. Returns 0 when another
     * sweep got there first or the alert was acknowledged or resolved meanwhile.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Alert a SET a.escalationLevel = :newLevel, a.nextEscalationAt = :nextAt, " +
           "a.lastEscalatedAt = :now, a.version = a.version + 1 " +
           "WHERE a.id = :id AND a.escalationLevel = :expectedLevel " +
           "AND a.status = :status AND a.acknowledgedAt IS NULL")
    int advanceEscalation(String id, int expectedLevel, int newLevel, Instant nextAt, Instant now, AlertStatus status);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Alert a SET a.nextEscalationAt = :nextAt, a.version = a.version + 1 WHERE a.id = :id")
    int scheduleEscalation(String id, Instant nextAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Alert a SET a.nextEscalationAt = NULL, a.version = a.version + 1 WHERE a.id = :id")
    int clearNextEscalation(String id);
}
