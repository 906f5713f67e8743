package com.example.alertengine.repository;

import com.example.alertengine.domain.SuppressionRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SuppressionRuleRepository extends JpaRepository<SuppressionRule, String> {

    /** Enabled rules for the team plus global ones, highest priority first. */
    @Query("SELECT r FROM SuppressionRule r WHERE r.enabled = true " +
           "AND (r.teamId IS NULL OR r.teamId = :teamId) " +
           "ORDER BY r.priority DESC, r.createdAt ASC, r.id ASC")
    List<SuppressionRule> findCandidates(String teamId);
}
