package com.phillippitts.callpilot.service.availability;

import com.phillippitts.callpilot.config.properties.AvailabilityProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Posts {@code {"preferred_time": ...}} to the configured availability URL and reads the slot
 * list from the first non-empty of {@code free_slots}, {@code slots} or {@code available_slots}.
 *
 * <p>Best effort: an unset URL, an error status, an unreachable endpoint, an unparseable body or
 * an empty slot list all fall back to the requested window.
 */
@Component
public class RestAvailabilityService implements AvailabilityService {

    private static final Logger LOG = LogManager.getLogger(RestAvailabilityService.class);

    private static final String[] SLOT_KEYS = {"free_slots", "slots", "available_slots"};

    private final AvailabilityProperties properties;
    private final RestTemplate restTemplate;

    public RestAvailabilityService(AvailabilityProperties properties,
                                   @Qualifier("sinkRestTemplate") RestTemplate restTemplate) {
        this.properties = Objects.requireNonNull(properties);
        this.restTemplate = Objects.requireNonNull(restTemplate);
    }

    @Override
    public List<String> freeSlots(String preferredTime) {
        List<String> fallback = List.of(preferredTime);
        if (!properties.isConfigured()) {
            return fallback;
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String body = new JSONObject().put("preferred_time", preferredTime).toString();
        try {
            ResponseEntity<String> response =
                    restTemplate.postForEntity(properties.getUrl(), new HttpEntity<>(body, headers), String.class);
            List<String> slots = parseSlots(response.getBody());
            if (slots.isEmpty()) {
                LOG.info("Availability lookup returned no slots; using '{}'", preferredTime);
                return fallback;
            }
            LOG.debug("Availability lookup returned {} slot(s)", slots.size());
            return slots;
        } catch (HttpStatusCodeException e) {
            LOG.warn("Availability lookup rejected: status={}; using '{}'", e.getStatusCode().value(), preferredTime);
        } catch (RestClientException e) {
            LOG.warn("Availability lookup failed: {}; using '{}'", e.getMessage(), preferredTime);
        } catch (JSONException e) {
            LOG.warn("Availability response unparseable: {}; using '{}'", e.getMessage(), preferredTime);
        }
        return fallback;
    }

    /**
     * Reads the slot list. A first non-empty value that is not an array yields no slots.
     */
    static List<String> parseSlots(String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        JSONObject json = new JSONObject(body);
        for (String key : SLOT_KEYS) {
            Object value = json.opt(key);
            if (value == null || JSONObject.NULL.equals(value) || isEmpty(value)) {
                continue;
            }
            if (!(value instanceof JSONArray array)) {
                return List.of();
            }
            List<String> slots = new ArrayList<>(array.length());
            for (int i = 0; i < array.length(); i++) {
                String slot = array.optString(i, "").trim();
                if (!slot.isEmpty()) {
                    slots.add(slot);
                }
            }
            return slots;
        }
        return List.of();
    }

    private static boolean isEmpty(Object value) {
        return (value instanceof JSONArray array && array.isEmpty())
                || (value instanceof String s && s.isEmpty());
    }
}
