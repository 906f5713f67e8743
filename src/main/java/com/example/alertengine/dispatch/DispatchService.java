package com.example.alertengine.dispatch;

import com.example.alertengine.config.AlertingProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Hands dispatch requests to the notification collaborator: a JSON POST to the configured
 * webhook. Delivery itself (push, SMS, email...) happens on the other side.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DispatchService {

    private static final MediaType JSON = MediaType.get("application/json");

    private final AlertingProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    @Async("dispatchExecutor")
    public void dispatch(DispatchRequest request) {
        send(request);
    }

    /**
     * Post the request synchronously.
     *
     * @return true when the collaborator accepted it, or when no webhook is configured
     */
    public boolean send(DispatchRequest request) {
        AlertingProperties.DispatchConfig config = properties.getDispatch();
        if (!config.isEnabled()) {
            log.debug("Dispatch disabled, dropping request for alert {}", request.alertId());
            return true;
        }
        String webhookUrl = config.getWebhookUrl();
        if (webhookUrl == null || webhookUrl.isEmpty()) {
            log.info("Dispatch (log only): alert {} -> {} via {} (level {}, respond within {} min)",
                    request.alertId(), request.assignee(), request.channelSet(),
                    request.level(), request.expectedResponseTime());
            return true;
        }

        try {
            String json = objectMapper.writeValueAsString(request);
            Request httpRequest = new Request.Builder()
                    .url(webhookUrl)
                    .post(RequestBody.create(json, JSON))
                    .build();

            try (Response response = httpClient.newCall(httpRequest).execute()) {
                if (response.isSuccessful()) {
                    log.info("Dispatched alert {} to {} via {}", request.alertId(), request.assignee(),
                            request.channelSet());
                    meterRegistry.counter("alerting.dispatch", "outcome", "sent").increment();
                    return true;
                }
                log.error("Dispatch for alert {} rejected: HTTP {}", request.alertId(), response.code());
            }
        } catch (IOException e) {
            log.error("Failed to dispatch alert {}: {}", request.alertId(), e.getMessage());
        }
        meterRegistry.counter("alerting.dispatch", "outcome", "failed").increment();
        return false;
    }
}
