package com.phillippitts.callpilot.service.metrics;

import com.phillippitts.callpilot.domain.ForwardOutcome;
import com.phillippitts.callpilot.domain.SinkOutcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Null-safe facade over {@link OutreachMetrics} used by the services.
 *
 * <p>Services depend on this publisher rather than on the meter registry, so unit tests can pass
 * {@link #NOOP} instead of wiring Micrometer.
 */
@Component
public final class OutreachMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(OutreachMetricsPublisher.class);

    /**
     * No-op instance for tests.
     */
    public static final OutreachMetricsPublisher NOOP = new OutreachMetricsPublisher(null);

    private final OutreachMetrics metrics;

    /**
     * @param metrics metrics tracking service (nullable for test mode)
     */
    public OutreachMetricsPublisher(OutreachMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("OutreachMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordDispatch(String mode, int sessions) {
        if (metrics == null) {
            return;
        }
        metrics.incrementDispatch(mode.toLowerCase(Locale.ROOT), sessions);
    }

    public void recordPlacement(String outcome, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordPlacement(outcome, durationNanos);
    }

    public void recordConfirmation(String result) {
        if (metrics == null) {
            return;
        }
        metrics.incrementConfirmation(result);
    }

    public void recordForward(ForwardOutcome outcome) {
        if (metrics == null) {
            return;
        }
        metrics.incrementSinkOutcome("calendar", statusTag(outcome.calendar()));
        metrics.incrementSinkOutcome("webhook", statusTag(outcome.webhook()));
    }

    public void recordExpiredSessions(int count) {
        if (metrics == null || count <= 0) {
            return;
        }
        metrics.incrementExpiredSessions(count);
    }

    public boolean isEnabled() {
        return metrics != null;
    }

    private static String statusTag(SinkOutcome outcome) {
        return outcome.status().name().toLowerCase(Locale.ROOT);
    }
}
