package com.example.alertengine.repository;

import com.example.alertengine.domain.OnCallScheduleEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface OnCallScheduleEntryRepository extends JpaRepository<OnCallScheduleEntry, String> {

    /** Entries of the team's enabled schedules whose shift contains {@code now}. */
    @Query("SELECT e FROM OnCallScheduleEntry e JOIN FETCH e.schedule s " +
           "WHERE s.teamId = :teamId AND s.enabled = true " +
           "AND e.startTime <= :now AND e.endTime > :now")
    List<OnCallScheduleEntry> findCovering(String teamId, Instant now);

    List<OnCallScheduleEntry> findByScheduleIdOrderByStartTimeAsc(String scheduleId);
}
