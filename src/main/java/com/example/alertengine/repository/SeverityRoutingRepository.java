package com.example.alertengine.repository;

import com.example.alertengine.domain.Severity;
import com.example.alertengine.domain.SeverityRouting;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SeverityRoutingRepository extends JpaRepository<SeverityRouting, String> {

    List<SeverityRouting> findByTeamIdAndSeverityAndEnabledTrueOrderByPriorityAscIdAsc(String teamId, Severity severity);

    List<SeverityRouting> findByTeamIdOrderBySeverityAsc(String teamId);
}
