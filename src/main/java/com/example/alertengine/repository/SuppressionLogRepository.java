package com.example.alertengine.repository;

import com.example.alertengine.domain.SuppressionLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface SuppressionLogRepository extends JpaRepository<SuppressionLogEntry, String> {

    List<SuppressionLogEntry> findByAlertIdOrderByCreatedAtDesc(String alertId);

    @Modifying
    @Query("DELETE FROM SuppressionLogEntry e WHERE e.createdAt < :cutoff")
    int deleteOlderThan(Instant cutoff);
}
