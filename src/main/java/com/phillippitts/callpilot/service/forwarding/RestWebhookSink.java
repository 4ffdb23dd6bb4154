package com.phillippitts.callpilot.service.forwarding;

import com.phillippitts.callpilot.config.properties.SinkProperties;
import com.phillippitts.callpilot.domain.SinkOutcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Objects;

/**
 * Posts booking payloads as JSON to the configured webhook URL.
 */
@Component
public class RestWebhookSink implements WebhookSink {

    private static final Logger LOG = LogManager.getLogger(RestWebhookSink.class);

    private final SinkProperties.Webhook properties;
    private final RestTemplate restTemplate;

    public RestWebhookSink(SinkProperties sinkProperties,
                           @Qualifier("sinkRestTemplate") RestTemplate restTemplate) {
        this.properties = Objects.requireNonNull(sinkProperties).getWebhook();
        this.restTemplate = Objects.requireNonNull(restTemplate);
    }

    @Override
    public boolean isConfigured() {
        return properties.isConfigured();
    }

    @Override
    public SinkOutcome deliver(JSONObject payload) {
        if (!isConfigured()) {
            return SinkOutcome.notConfigured();
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            restTemplate.postForEntity(properties.getUrl(), new HttpEntity<>(payload.toString(), headers), String.class);
            LOG.debug("Webhook delivered booking {}", payload.optString("booking_id"));
            return SinkOutcome.success();
        } catch (HttpStatusCodeException e) {
            LOG.warn("Webhook rejected booking {}: status={}", payload.optString("booking_id"), e.getStatusCode().value());
            return SinkOutcome.failed("webhook returned " + e.getStatusCode().value());
        } catch (RestClientException e) {
            LOG.warn("Webhook delivery failed: {}", e.getMessage());
            return SinkOutcome.failed("webhook unreachable: " + e.getMessage());
        }
    }
}
