package com.example.alertengine.repository;

import com.example.alertengine.domain.AlertRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AlertRuleRepository extends JpaRepository<AlertRule, String> {

    List<AlertRule> findByEnabled(boolean enabled);

    List<AlertRule> findByMetricName(String metricName);
}
