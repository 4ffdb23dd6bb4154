package com.phillippitts.callpilot.service.placement;

import com.phillippitts.callpilot.config.properties.PlacementProperties;
import com.phillippitts.callpilot.domain.CallTarget;
import com.phillippitts.callpilot.domain.SessionRef;
import com.phillippitts.callpilot.exception.PlacementException;
import com.phillippitts.callpilot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Objects;

/**
 * Places outbound calls through the ElevenLabs conversational-AI Twilio endpoint.
 *
 * <p>Request body:
 * <pre>
 * {"agent_id": "...", "agent_phone_number_id": "...", "to_number": "+1...",
 *  "conversation_initiation_client_data": {"conversation_config_override":
 *      {"agent": {"prompt": {"prompt": "&lt;brief&gt;"}}}}}
 * </pre>
 * The response's {@code conversation_id} becomes the session reference; {@code callSid} is kept
 * alongside it.
 *
 * <p>Every failure (HTTP error, transport error, malformed response) surfaces as a
 * {@link PlacementException} carrying the platform's own error detail when it sent one.
 */
@Service
public class ElevenLabsCallPlacementService implements CallPlacementService {

    private static final Logger LOG = LogManager.getLogger(ElevenLabsCallPlacementService.class);

    static final String API_KEY_HEADER = "xi-api-key";
    private static final int MAX_ERROR_DETAIL = 300;

    private final PlacementProperties properties;
    private final RestTemplate restTemplate;

    public ElevenLabsCallPlacementService(PlacementProperties properties,
                                          @Qualifier("placementRestTemplate") RestTemplate restTemplate) {
        this.properties = Objects.requireNonNull(properties);
        this.restTemplate = Objects.requireNonNull(restTemplate);
    }

    @Override
    public SessionRef startCall(CallTarget target, String brief) {
        Objects.requireNonNull(target, "target must not be null");
        if (!properties.isConfigured()) {
            throw new PlacementException("Call placement not configured: missing " + properties.missingSettings());
        }
        if (target.phoneNumber().isBlank()) {
            throw new PlacementException("No phone number for " + target.label());
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(API_KEY_HEADER, properties.getApiKey());
        HttpEntity<String> request = new HttpEntity<>(buildBody(target, brief).toString(), headers);

        String body;
        try {
            ResponseEntity<String> response =
                    restTemplate.postForEntity(properties.getOutboundUrl(), request, String.class);
            body = response.getBody();
        } catch (HttpStatusCodeException e) {
            String detail = errorDetail(e.getResponseBodyAsString(), e.getStatusText());
            LOG.warn("Call placement rejected for {}: status={}, detail={}",
                    LogSanitizer.maskPhone(target.phoneNumber()), e.getStatusCode().value(), detail);
            throw new PlacementException(detail, e.getStatusCode().value());
        } catch (RestClientException e) {
            LOG.warn("Call placement request failed for {}: {}",
                    LogSanitizer.maskPhone(target.phoneNumber()), e.getMessage());
            throw new PlacementException("Call placement request failed: " + e.getMessage(), e);
        }

        SessionRef ref = parseSessionRef(body);
        LOG.info("Call placed to {} ({}): conversationId={}",
                target.label(), LogSanitizer.maskPhone(target.phoneNumber()), ref.conversationId());
        return ref;
    }

    @Override
    public List<String> missingSettings() {
        return properties.missingSettings();
    }

    JSONObject buildBody(CallTarget target, String brief) {
        JSONObject prompt = new JSONObject().put("prompt", brief == null ? "" : brief);
        JSONObject override = new JSONObject()
                .put("agent", new JSONObject().put("prompt", prompt));
        return new JSONObject()
                .put("agent_id", properties.getAgentId())
                .put("agent_phone_number_id", properties.getAgentPhoneNumberId())
                .put("to_number", target.phoneNumber())
                .put("conversation_initiation_client_data",
                        new JSONObject().put("conversation_config_override", override));
    }

    static SessionRef parseSessionRef(String body) {
        if (body == null || body.isBlank()) {
            throw new PlacementException("Call placement returned an empty response");
        }
        try {
            JSONObject json = new JSONObject(body);
            String conversationId = json.optString("conversation_id", null);
            if (conversationId == null || conversationId.isBlank()) {
                String detail = json.optString("message", "no conversation_id in response");
                throw new PlacementException("Call placement not acknowledged: " + detail);
            }
            return new SessionRef(conversationId, json.optString("callSid", null));
        } catch (JSONException e) {
            throw new PlacementException("Call placement returned malformed JSON", e);
        }
    }

    /**
     * Extracts {@code detail} or {@code message} from an error body, falling back to the raw
     * text or the HTTP reason phrase.
     */
    static String errorDetail(String body, String statusText) {
        if (body == null || body.isBlank()) {
            return statusText == null || statusText.isBlank() ? "Call failed" : statusText;
        }
        try {
            JSONObject json = new JSONObject(body);
            Object detail = json.opt("detail");
            if (detail == null) {
                detail = json.opt("message");
            }
            if (detail != null) {
                return LogSanitizer.truncate(String.valueOf(detail), MAX_ERROR_DETAIL);
            }
        } catch (JSONException ignored) {
            // not JSON; fall through to the raw body
        }
        return LogSanitizer.truncate(body, MAX_ERROR_DETAIL);
    }
}
