package com.phillippitts.callpilot.service.dispatch;

import com.phillippitts.callpilot.config.properties.OutreachProperties;
import com.phillippitts.callpilot.domain.CallSession;
import com.phillippitts.callpilot.domain.CallSessionState;
import com.phillippitts.callpilot.domain.CallTarget;
import com.phillippitts.callpilot.domain.OutreachCampaign;
import com.phillippitts.callpilot.domain.SessionRef;
import com.phillippitts.callpilot.service.metrics.OutreachMetricsPublisher;
import com.phillippitts.callpilot.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SessionLifetimeWatchdogTest {

    private static final Instant T0 = Instant.parse("2025-02-01T10:00:00Z");

    private MutableClock clock;
    private CallSessionRegistry registry;
    private SessionLifetimeWatchdog watchdog;

    @BeforeEach
    void setUp() {
        OutreachProperties properties = new OutreachProperties();
        properties.setSessionLifetimeSeconds(600);
        clock = new MutableClock(T0);
        registry = new CallSessionRegistry(properties);
        watchdog = new SessionLifetimeWatchdog(registry, OutreachMetricsPublisher.NOOP, clock, properties);
    }

    private CallSession register(String id) {
        CallSession session = new CallSession(id, "c-" + id, CallTarget.solo("+15551234567"), clock.instant());
        registry.register(new OutreachCampaign("c-" + id, OutreachCampaign.Mode.SOLO, "x", clock.instant(),
                List.of(session)));
        return session;
    }

    @Test
    void youngSessionsAreLeftAlone() {
        CallSession session = register("s1");
        session.markDialing(new SessionRef("conv-1", null), T0);
        clock.advance(Duration.ofMinutes(5));

        assertThat(watchdog.sweep()).isZero();
        assertThat(session.getState()).isEqualTo(CallSessionState.DIALING);
    }

    @Test
    void expiredPlacedSessionCompletes() {
        CallSession dialing = register("s1");
        dialing.markDialing(new SessionRef("conv-1", null), T0);
        CallSession talking = register("s2");
        talking.markDialing(new SessionRef("conv-2", null), T0);
        talking.markInProgress(T0);
        clock.advance(Duration.ofMinutes(11));

        assertThat(watchdog.sweep()).isEqualTo(2);
        assertThat(dialing.getState()).isEqualTo(CallSessionState.COMPLETED);
        assertThat(talking.toHandle().reason()).isEqualTo(SessionLifetimeWatchdog.LIFETIME_ELAPSED);
    }

    @Test
    void expiredQueuedSessionFails() {
        CallSession queued = register("s1");
        clock.advance(Duration.ofMinutes(11));

        watchdog.sweep();

        assertThat(queued.getState()).isEqualTo(CallSessionState.FAILED);
        assertThat(queued.toHandle().reason()).isEqualTo(SessionLifetimeWatchdog.NEVER_PLACED);
    }

    @Test
    void terminalSessionsAreNotTouchedAgain() {
        CallSession failed = register("s1");
        failed.markFailed("busy", T0);
        clock.advance(Duration.ofMinutes(11));

        assertThat(watchdog.sweep()).isZero();
        assertThat(failed.toHandle().reason()).isEqualTo("busy");
    }

    @Test
    void onlySessionsPastTheirOwnLifetimeAreClosed() {
        CallSession old = register("s1");
        old.markDialing(new SessionRef("conv-1", null), T0);
        clock.advance(Duration.ofMinutes(8));
        CallSession fresh = register("s2");
        fresh.markDialing(new SessionRef("conv-2", null), clock.instant());
        clock.advance(Duration.ofMinutes(3));

        assertThat(watchdog.sweep()).isEqualTo(1);
        assertThat(old.getState()).isEqualTo(CallSessionState.COMPLETED);
        assertThat(fresh.getState()).isEqualTo(CallSessionState.DIALING);
    }
}
