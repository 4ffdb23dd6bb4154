package com.phillippitts.callpilot.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Credentials and endpoint of the voice-agent platform that places outbound calls.
 *
 * <p>Missing credentials do not stop the application from starting; they are reported by the
 * status query and make dispatch commands fail fast.
 */
@Validated
@ConfigurationProperties(prefix = "callpilot.placement")
public class PlacementProperties {

    static final String DEFAULT_OUTBOUND_URL = "https://api.elevenlabs.io/v1/convai/twilio/outbound-call";

    private final String apiKey;
    private final String agentId;
    private final String agentPhoneNumberId;

    @NotBlank
    private final String outboundUrl;

    @ConstructorBinding
    public PlacementProperties(String apiKey, String agentId, String agentPhoneNumberId, String outboundUrl) {
        this.apiKey = blankToNull(apiKey);
        this.agentId = blankToNull(agentId);
        this.agentPhoneNumberId = blankToNull(agentPhoneNumberId);
        this.outboundUrl = outboundUrl == null || outboundUrl.isBlank() ? DEFAULT_OUTBOUND_URL : outboundUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getAgentId() {
        return agentId;
    }

    public String getAgentPhoneNumberId() {
        return agentPhoneNumberId;
    }

    public String getOutboundUrl() {
        return outboundUrl;
    }

    /**
     * Lists the property names that still need a value before calls can be placed.
     */
    public List<String> missingSettings() {
        List<String> missing = new ArrayList<>();
        if (apiKey == null) {
            missing.add("callpilot.placement.api-key");
        }
        if (agentId == null) {
            missing.add("callpilot.placement.agent-id");
        }
        if (agentPhoneNumberId == null) {
            missing.add("callpilot.placement.agent-phone-number-id");
        }
        return missing;
    }

    public boolean isConfigured() {
        return missingSettings().isEmpty();
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
