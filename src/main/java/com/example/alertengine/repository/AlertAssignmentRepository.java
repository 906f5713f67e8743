package com.example.alertengine.repository;

import com.example.alertengine.domain.AlertAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AlertAssignmentRepository extends JpaRepository<AlertAssignment, String> {

    List<AlertAssignment> findByAlertIdOrderByCreatedAtAscAssignmentLevelAsc(String alertId);

    Optional<AlertAssignment> findFirstByAlertIdAndAcknowledgedAtIsNullOrderByCreatedAtDescAssignmentLevelDesc(String alertId);

    boolean existsByAlertIdAndAssignmentLevel(String alertId, int assignmentLevel);
}
