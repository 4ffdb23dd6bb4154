package com.phillippitts.callpilot.service.forwarding;

import com.phillippitts.callpilot.config.properties.SinkProperties;
import com.phillippitts.callpilot.domain.SinkOutcome;
import com.phillippitts.callpilot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Writes booking events to a calendar API with a bearer token.
 *
 * <p>The event body follows the common calendar-event shape:
 * <pre>
 * {"summary": "...", "description": "...",
 *  "start": {"dateTime": "2025-02-10T14:00:00", "timeZone": "UTC"},
 *  "end":   {"dateTime": "2025-02-10T15:00:00", "timeZone": "UTC"}}
 * </pre>
 * The attendee phone, when present, goes into the description and the attendee list.
 */
@Component
public class RestCalendarSink implements CalendarSink {

    private static final Logger LOG = LogManager.getLogger(RestCalendarSink.class);

    private static final int MAX_REASON = 200;

    private final SinkProperties.Calendar properties;
    private final RestTemplate restTemplate;

    public RestCalendarSink(SinkProperties sinkProperties,
                            @Qualifier("sinkRestTemplate") RestTemplate restTemplate) {
        this.properties = Objects.requireNonNull(sinkProperties).getCalendar();
        this.restTemplate = Objects.requireNonNull(restTemplate);
    }

    @Override
    public boolean isConfigured() {
        return properties.isConfigured();
    }

    @Override
    public SinkOutcome createEvent(LocalDate date, LocalTime time, String title, String attendee) {
        if (!isConfigured()) {
            return SinkOutcome.notConfigured();
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(properties.getApiToken());
        String body = eventBody(date, time, title, attendee).toString();
        try {
            restTemplate.postForEntity(properties.getUrl(), new HttpEntity<>(body, headers), String.class);
            LOG.info("Calendar event created for {} {}", date, time);
            return SinkOutcome.success();
        } catch (HttpStatusCodeException e) {
            String reason = "calendar returned " + e.getStatusCode().value() + ": "
                    + LogSanitizer.truncate(e.getResponseBodyAsString(), MAX_REASON);
            LOG.warn("Calendar write failed: {}", reason);
            return SinkOutcome.failed(reason);
        } catch (RestClientException e) {
            LOG.warn("Calendar write failed: {}", e.getMessage());
            return SinkOutcome.failed("calendar unreachable: " + e.getMessage());
        }
    }

    JSONObject eventBody(LocalDate date, LocalTime time, String title, String attendee) {
        LocalDateTime start = LocalDateTime.of(date, time);
        LocalDateTime end = start.plusMinutes(properties.getEventDurationMinutes());
        JSONObject event = new JSONObject()
                .put("summary", title)
                .put("start", dateTime(start))
                .put("end", dateTime(end));
        if (attendee != null) {
            event.put("description", "Booked for " + attendee);
            event.put("attendees", new JSONArray().put(new JSONObject().put("phone", attendee)));
        }
        return event;
    }

    private JSONObject dateTime(LocalDateTime at) {
        return new JSONObject()
                .put("dateTime", at.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME))
                .put("timeZone", properties.getTimeZone());
    }
}
