package com.example.alertengine.repository;

import com.example.alertengine.domain.AlertGroup;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface AlertGroupRepository extends JpaRepository<AlertGroup, String> {

    /** Groups for the key whose last alert falls inside the grouping window, newest first. */
    @Query("SELECT g FROM AlertGroup g WHERE g.groupKey = :groupKey " +
           "AND ((:teamId IS NULL AND g.teamId IS NULL) OR g.teamId = :teamId) " +
           "AND g.lastAlertAt >= :since ORDER BY g.lastAlertAt DESC, g.id ASC")
    List<AlertGroup> findOpen(String groupKey, String teamId, Instant since);

    @Query("SELECT g.id FROM AlertGroup g WHERE g.lastAlertAt < :cutoff")
    List<String> findStaleIds(Instant cutoff);

    /** Locks the listed groups that are still past the cutoff; appends to them wait. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT g FROM AlertGroup g WHERE g.id IN :ids AND g.lastAlertAt < :cutoff")
    List<AlertGroup> lockStale(Collection<String> ids, Instant cutoff);

    @Modifying
    @Query("DELETE FROM AlertGroup g WHERE g.id IN :ids AND g.lastAlertAt < :cutoff")
    int deleteStale(Collection<String> ids, Instant cutoff);
}
