package com.example.alertengine.repository;

import com.example.alertengine.domain.MaintenanceWindow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface MaintenanceWindowRepository extends JpaRepository<MaintenanceWindow, String> {

    /** Enabled windows covering {@code now}, scoped to the team or global, most important first. */
    @Query("SELECT w FROM MaintenanceWindow w WHERE w.enabled = true " +
           "AND w.startTime <= :now AND w.endTime >= :now " +
           "AND (w.teamId IS NULL OR w.teamId = :teamId) " +
           "ORDER BY w.priority DESC, w.createdAt DESC, w.id ASC")
    List<MaintenanceWindow> findActive(Instant now, String teamId);

    @Query("SELECT w FROM MaintenanceWindow w WHERE w.enabled = true " +
           "AND w.startTime > :now AND w.startTime <= :horizon " +
           "AND (w.teamId IS NULL OR w.teamId = :teamId) ORDER BY w.startTime")
    List<MaintenanceWindow> findUpcoming(Instant now, Instant horizon, String teamId);

    @Query("SELECT w FROM MaintenanceWindow w WHERE (:teamId IS NULL OR w.teamId = :teamId OR w.teamId IS NULL) " +
           "ORDER BY w.startTime DESC")
    List<MaintenanceWindow> findVisibleTo(String teamId);

    List<MaintenanceWindow> findByEnabledTrueAndEndTimeBefore(Instant now);
}
