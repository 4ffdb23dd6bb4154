package com.phillippitts.callpilot.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Free-slot lookup consulted before a swarm is dialed.
 *
 * <p>Without a URL the lookup is skipped and the requested time window is used as the only slot.
 */
@ConfigurationProperties(prefix = "callpilot.availability")
public class AvailabilityProperties {

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
