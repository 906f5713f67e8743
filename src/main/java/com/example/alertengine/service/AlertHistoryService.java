package com.example.alertengine.service;

import com.example.alertengine.domain.AlertHistory;
import com.example.alertengine.repository.AlertHistoryRepository;
import com.example.alertengine.support.BestEffortWriter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Per-alert event trail. All significant transitions of an alert (suppression,
 * assignment, escalation, acknowledgment, resolution) are recorded here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertHistoryService {

    public static final String SUPPRESSED = "suppressed";
    public static final String ASSIGNED = "assigned";
    public static final String ESCALATED = "escalated";
    public static final String ESCALATION_DEFERRED = "escalation_deferred";
    public static final String ACKNOWLEDGED = "acknowledged";
    public static final String AUTO_ACKNOWLEDGED = "auto_acknowledged";
    public static final String AUTO_RESOLVED = "auto_resolved";
    public static final String RESOLVED = "resolved";
    public static final String ROUTING_GAP = "routing_gap";
    public static final String MAINTENANCE_SCHEDULED = "maintenance_scheduled";

    private final AlertHistoryRepository historyRepository;
    private final BestEffortWriter writer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Record an event once the current transaction commits.
     */
    public void record(String alertId, String eventType, String description,
                       String performedBy, Map<String, Object> metadata) {
        AlertHistory entry = AlertHistory.builder()
                .alertId(alertId)
                .eventType(eventType)
                .description(description)
                .performedBy(performedBy)
                .metadata(toJson(metadata))
                .createdAt(clock.instant())
                .build();
        writer.writeAfterCommit("alert history " + eventType, () -> {
            historyRepository.save(entry);
            log.debug("History: [{}] {} {}", alertId, eventType, description);
        });
    }

    public void record(String alertId, String eventType, String description) {
        record(alertId, eventType, description, "system", null);
    }

    public List<AlertHistory> historyOf(String alertId) {
        return historyRepository.findByAlertIdOrderByCreatedAtAsc(alertId);
    }

    private String toJson(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("Dropping unserializable history metadata: {}", e.getMessage());
            return null;
        }
    }
}
