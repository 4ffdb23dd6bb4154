package com.phillippitts.callpilot.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for outreach dispatch and session bookkeeping.
 */
@ConfigurationProperties(prefix = "callpilot.outreach")
@Validated
public class OutreachProperties {

    /** Number of top-ranked providers called in swarm mode. */
    @Positive(message = "Swarm size must be positive")
    private int swarmSize = 3;

    /** Lifetime after which an unconfirmed session is marked COMPLETED, in seconds. */
    @Positive(message = "Session lifetime must be positive")
    private long sessionLifetimeSeconds = 900;

    /** Maximum wait for all placement acknowledgements of one dispatch, in milliseconds. */
    @Positive(message = "Placement timeout must be positive")
    private long placementTimeoutMs = 15_000;

    /** Interval between session lifetime sweeps, in milliseconds. */
    @Positive(message = "Sweep interval must be positive")
    private long sweepIntervalMs = 30_000;

    /** Completed campaigns kept in memory for status queries. */
    @Positive(message = "Retained campaigns must be positive")
    private int retainedCampaigns = 100;

    /** Time window the agent negotiates for when a swarm request names none. */
    private String defaultPreferredTime = "morning";

    public int getSwarmSize() {
        return swarmSize;
    }

    public void setSwarmSize(int swarmSize) {
        this.swarmSize = swarmSize;
    }

    public long getSessionLifetimeSeconds() {
        return sessionLifetimeSeconds;
    }

    public void setSessionLifetimeSeconds(long sessionLifetimeSeconds) {
        this.sessionLifetimeSeconds = sessionLifetimeSeconds;
    }

    public long getPlacementTimeoutMs() {
        return placementTimeoutMs;
    }

    public void setPlacementTimeoutMs(long placementTimeoutMs) {
        this.placementTimeoutMs = placementTimeoutMs;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }

    public int getRetainedCampaigns() {
        return retainedCampaigns;
    }

    public void setRetainedCampaigns(int retainedCampaigns) {
        this.retainedCampaigns = retainedCampaigns;
    }

    public String getDefaultPreferredTime() {
        return defaultPreferredTime;
    }

    public void setDefaultPreferredTime(String defaultPreferredTime) {
        this.defaultPreferredTime = defaultPreferredTime;
    }
}
