package com.example.alertengine.repository;

import com.example.alertengine.domain.EscalationConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface EscalationConfigRepository extends JpaRepository<EscalationConfig, String> {

    Optional<EscalationConfig> findByTeamId(String teamId);
}
