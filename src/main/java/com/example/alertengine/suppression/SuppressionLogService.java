package com.example.alertengine.suppression;

import com.example.alertengine.domain.SuppressionLogEntry;
import com.example.alertengine.repository.SuppressionLogRepository;
import com.example.alertengine.support.BestEffortWriter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Audit trail of suppression decisions, suppressed or not. Entries are written after
 * the deciding transaction commits; a failed write does not affect the decision.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SuppressionLogService {

    private final SuppressionLogRepository logRepository;
    private final BestEffortWriter writer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void record(String alertId, SuppressionDecision decision) {
        SuppressionLogEntry entry = SuppressionLogEntry.builder()
                .alertId(alertId)
                .suppressed(decision.suppressed())
                .reason(decision.reason().code())
                .suppressionRuleId(stringOrNull(decision.metadata().get("rule_id")))
                .maintenanceWindowId(stringOrNull(decision.metadata().get("maintenance_window_id")))
                .suppressUntil(decision.suppressUntil())
                .metadata(toJson(decision))
                .createdAt(clock.instant())
                .build();
        writer.writeAfterCommit("suppression log", () -> logRepository.save(entry));
    }

    public List<SuppressionLogEntry> entriesFor(String alertId) {
        return logRepository.findByAlertIdOrderByCreatedAtDesc(alertId);
    }

    private String toJson(SuppressionDecision decision) {
        if (decision.metadata().isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(decision.metadata());
        } catch (JsonProcessingException e) {
            log.warn("Dropping unserializable suppression metadata: {}", e.getMessage());
            return null;
        }
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : value.toString();
    }
}
