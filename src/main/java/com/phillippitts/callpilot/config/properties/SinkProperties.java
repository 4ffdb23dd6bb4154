package com.phillippitts.callpilot.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the downstream booking sinks.
 *
 * <p>A sink with no URL is simply not configured; its outcome is recorded as NOT_CONFIGURED.
 */
@ConfigurationProperties(prefix = "callpilot.sinks")
@Validated
public class SinkProperties {

    private Calendar calendar = new Calendar();
    private Webhook webhook = new Webhook();

    /** Upper bound for a single sink attempt, in milliseconds. */
    @Positive(message = "Sink timeout must be positive")
    private long timeoutMs = 10_000;

    public Calendar getCalendar() {
        return calendar;
    }

    public void setCalendar(Calendar calendar) {
        this.calendar = calendar;
    }

    public Webhook getWebhook() {
        return webhook;
    }

    public void setWebhook(Webhook webhook) {
        this.webhook = webhook;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    /**
     * Calendar write endpoint. Writing requires both the URL and an API token.
     */
    public static class Calendar {
        private String url;
        private String apiToken;
        private String timeZone = "UTC";
        private int eventDurationMinutes = 60;

        public boolean isConfigured() {
            return url != null && !url.isBlank() && apiToken != null && !apiToken.isBlank();
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getApiToken() {
            return apiToken;
        }

        public void setApiToken(String apiToken) {
            this.apiToken = apiToken;
        }

        public String getTimeZone() {
            return timeZone;
        }

        public void setTimeZone(String timeZone) {
            this.timeZone = timeZone;
        }

        public int getEventDurationMinutes() {
            return eventDurationMinutes;
        }

        public void setEventDurationMinutes(int eventDurationMinutes) {
            this.eventDurationMinutes = eventDurationMinutes;
        }
    }

    /**
     * Generic forwarding webhook.
     */
    public static class Webhook {
        private String url;

        public boolean isConfigured() {
            return url != null && !url.isBlank();
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }
    }
}
