package com.example.alertengine.intake;

import com.example.alertengine.domain.Severity;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.Map;

/**
 * Alert record as produced by the detection pipeline.
 */
public record IncomingAlert(@NotBlank @JsonProperty("id") String id,
                            @NotBlank @JsonProperty("rule_id") String ruleId,
                            @NotBlank @JsonProperty("team_id") String teamId,
                            @NotBlank @JsonProperty("metric_name") String metricName,
                            @NotNull @JsonProperty("severity") Severity severity,
                            @JsonProperty("dimensions") Map<String, String> dimensions,
                            @JsonProperty("created_at") Instant createdAt) {

    public IncomingAlert {
        dimensions = dimensions == null ? Map.of() : Map.copyOf(dimensions);
    }
}
