package com.phillippitts.callpilot.service.dispatch;

import com.phillippitts.callpilot.config.properties.OutreachProperties;
import com.phillippitts.callpilot.domain.CallSession;
import com.phillippitts.callpilot.domain.CallSessionState;
import com.phillippitts.callpilot.service.metrics.OutreachMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Closes sessions that outlived {@code callpilot.outreach.session-lifetime-seconds} without a
 * confirmation.
 *
 * <p>Placed calls (DIALING, IN_PROGRESS) become COMPLETED: the call happened but no booking came
 * of it. A session still QUEUED that long was never acknowledged and becomes FAILED. Nothing is
 * sent to the call-placing service; a confirmation arriving later still confirms the session.
 */
@Component
public class SessionLifetimeWatchdog {

    private static final Logger LOG = LogManager.getLogger(SessionLifetimeWatchdog.class);

    static final String LIFETIME_ELAPSED = "session lifetime elapsed";
    static final String NEVER_PLACED = "placement never acknowledged";

    private final CallSessionRegistry registry;
    private final OutreachMetricsPublisher metrics;
    private final Clock clock;
    private final Duration lifetime;

    public SessionLifetimeWatchdog(CallSessionRegistry registry,
                                   OutreachMetricsPublisher metrics,
                                   Clock clock,
                                   OutreachProperties properties) {
        this.registry = Objects.requireNonNull(registry);
        this.metrics = metrics == null ? OutreachMetricsPublisher.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock);
        this.lifetime = Duration.ofSeconds(properties.getSessionLifetimeSeconds());
    }

    /**
     * Sweeps all open sessions once.
     *
     * @return number of sessions closed by this sweep
     */
    @Scheduled(fixedDelayString = "${callpilot.outreach.sweep-interval-ms:30000}")
    public int sweep() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(lifetime);
        int closed = 0;
        for (CallSession session : registry.openSessions()) {
            if (!session.isOpenSince(cutoff)) {
                continue;
            }
            boolean changed = session.getState() == CallSessionState.QUEUED
                    ? session.markFailed(NEVER_PLACED, now)
                    : session.markCompleted(LIFETIME_ELAPSED, now);
            if (changed) {
                closed++;
                LOG.info("Session {} closed after {}s: {}", session.getId(), lifetime.toSeconds(), session.getState());
            }
        }
        metrics.recordExpiredSessions(closed);
        return closed;
    }
}
