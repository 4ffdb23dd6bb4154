package com.phillippitts.callpilot.service.forwarding;

import com.phillippitts.callpilot.config.properties.SinkProperties;
import com.phillippitts.callpilot.domain.SinkOutcome;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class RestWebhookSinkTest {

    private RestTemplate rest;
    private SinkProperties properties;

    @BeforeEach
    void setUp() {
        rest = mock(RestTemplate.class);
        properties = new SinkProperties();
        properties.getWebhook().setUrl("https://hooks.example.com/bookings");
    }

    @Test
    void deliversPayload() {
        when(rest.postForEntity(anyString(), any(), eq(String.class))).thenReturn(ResponseEntity.ok(""));

        SinkOutcome outcome = new RestWebhookSink(properties, rest).deliver(new JSONObject().put("booking_id", "b1"));

        assertThat(outcome).isEqualTo(SinkOutcome.success());
    }

    @Test
    void rejectionCarriesStatusCode() {
        when(rest.postForEntity(anyString(), any(), eq(String.class)))
                .thenThrow(new HttpClientErrorException(HttpStatus.NOT_FOUND));

        SinkOutcome outcome = new RestWebhookSink(properties, rest).deliver(new JSONObject().put("booking_id", "b1"));

        assertThat(outcome.reason()).isEqualTo("webhook returned 404");
    }

    @Test
    void unreachableEndpointIsFailure() {
        when(rest.postForEntity(anyString(), any(), eq(String.class)))
                .thenThrow(new ResourceAccessException("Read timed out"));

        SinkOutcome outcome = new RestWebhookSink(properties, rest).deliver(new JSONObject());

        assertThat(outcome.reason()).isEqualTo("webhook unreachable: Read timed out");
    }

    @Test
    void noUrlMeansNotConfigured() {
        properties.getWebhook().setUrl(null);

        SinkOutcome outcome = new RestWebhookSink(properties, rest).deliver(new JSONObject());

        assertThat(outcome.status()).isEqualTo(SinkOutcome.Status.NOT_CONFIGURED);
        verifyNoInteractions(rest);
    }
}
