package com.example.alertengine.routing;

import com.example.alertengine.domain.EscalationConfig;
import com.example.alertengine.repository.EscalationConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Team escalation settings. Teams without a stored (or with a disabled) configuration
 * get the built-in defaults: 09:00-17:00 UTC weekdays, no chain, default channel sets.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EscalationConfigService {

    private final EscalationConfigRepository configRepository;
    private final Clock clock;

    public EscalationConfig configFor(String teamId) {
        return configRepository.findByTeamId(teamId)
                .filter(EscalationConfig::isEnabled)
                .orElseGet(() -> EscalationConfig.defaultsFor(teamId));
    }

    /** Create or replace the team's configuration. */
    @Transactional
    public EscalationConfig save(EscalationConfig config) {
        configRepository.findByTeamId(config.getTeamId()).ifPresent(existing -> {
            config.setId(existing.getId());
            config.setCreatedAt(existing.getCreatedAt());
        });
        if (config.getCreatedAt() == null) config.setCreatedAt(clock.instant());
        EscalationConfig saved = configRepository.save(config);
        log.info("Escalation config saved for team {} ({} chain steps)",
                saved.getTeamId(), saved.getEscalationChain().size());
        return saved;
    }
}
