package com.example.alertengine.repository;

import com.example.alertengine.domain.AlertHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AlertHistoryRepository extends JpaRepository<AlertHistory, String> {

    List<AlertHistory> findByAlertIdOrderByCreatedAtAsc(String alertId);

    List<AlertHistory> findByEventTypeOrderByCreatedAtDesc(String eventType);
}
