package com.phillippitts.callpilot.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for outreach and booking consolidation.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Call placement latency and outcome</li>
 *   <li>Confirmation ingestion results</li>
 *   <li>Per-sink forwarding outcomes</li>
 *   <li>Sessions closed by the lifetime sweep</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class OutreachMetrics {

    private static final String METRIC_PREFIX = "callpilot";

    private final MeterRegistry registry;

    public OutreachMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one placement attempt.
     *
     * @param outcome {@code success}, {@code failure} or {@code timeout}
     * @param durationNanos time spent waiting for the collaborator
     */
    public void recordPlacement(String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".placement.latency")
                .description("Time taken by the call-placing service to acknowledge a call")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts dispatch commands by mode.
     */
    public void incrementDispatch(String mode, int sessions) {
        Counter.builder(METRIC_PREFIX + ".dispatch")
                .description("Number of dispatch commands")
                .tag("mode", mode)
                .register(registry)
                .increment();
        Counter.builder(METRIC_PREFIX + ".sessions.opened")
                .description("Number of call sessions opened")
                .tag("mode", mode)
                .register(registry)
                .increment(sessions);
    }

    /**
     * @param result {@code accepted}, {@code duplicate}, {@code uncorrelated} or {@code malformed}
     */
    public void incrementConfirmation(String result) {
        Counter.builder(METRIC_PREFIX + ".confirmations")
                .description("Number of confirmation events by result")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void incrementSinkOutcome(String sink, String status) {
        Counter.builder(METRIC_PREFIX + ".sink.outcomes")
                .description("Number of sink delivery outcomes")
                .tag("sink", sink)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void incrementExpiredSessions(int count) {
        Counter.builder(METRIC_PREFIX + ".sessions.expired")
                .description("Number of sessions closed because their lifetime elapsed")
                .register(registry)
                .increment(count);
    }
}
