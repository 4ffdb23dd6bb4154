package com.phillippitts.callpilot.service.forwarding;

import com.phillippitts.callpilot.config.ThreadPoolConfig;
import com.phillippitts.callpilot.config.properties.SinkProperties;
import com.phillippitts.callpilot.config.properties.ThreadPoolProperties;
import com.phillippitts.callpilot.domain.Booking;
import com.phillippitts.callpilot.domain.ForwardOutcome;
import com.phillippitts.callpilot.domain.SinkOutcome;
import com.phillippitts.callpilot.service.metrics.OutreachMetrics;
import com.phillippitts.callpilot.service.metrics.OutreachMetricsPublisher;
import com.phillippitts.callpilot.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultForwardingFanoutTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(2);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static Booking booking() {
        return new Booking("b1", "s1", "Provider One", LocalDate.of(2025, 2, 10), LocalTime.of(14, 0),
                null, "+15551234567", Instant.parse("2025-02-01T10:00:00Z"));
    }

    private static SinkProperties sinkProperties(long timeoutMs) {
        SinkProperties props = new SinkProperties();
        props.setTimeoutMs(timeoutMs);
        return props;
    }

    @Test
    void bothSinksSucceed() throws Exception {
        StubCalendar calendar = StubCalendar.returning(SinkOutcome.success());
        StubWebhook webhook = StubWebhook.returning(SinkOutcome.success());
        Booking booking = booking();

        ForwardOutcome outcome = new DefaultForwardingFanout(calendar, webhook, new SyncExecutor(),
                OutreachMetricsPublisher.NOOP, sinkProperties(1000)).forward(booking).get(1, TimeUnit.SECONDS);

        assertThat(outcome.calendar()).isEqualTo(SinkOutcome.success());
        assertThat(outcome.webhook()).isEqualTo(SinkOutcome.success());
        assertThat(booking.getCalendarOutcome()).isEqualTo(SinkOutcome.success());
        assertThat(booking.getForwardOutcome()).isEqualTo(SinkOutcome.success());
        assertThat(calendar.lastTitle).isEqualTo("Appointment with Provider One");
        assertThat(calendar.lastAttendee).isEqualTo("+15551234567");
        assertThat(webhook.lastPayload.getString("booking_id")).isEqualTo("b1");
        assertThat(webhook.lastPayload.getString("date")).isEqualTo("2025-02-10");
        assertThat(webhook.lastPayload.getString("time")).isEqualTo("14:00");
    }

    @Test
    void unconfiguredSinksAreNeverCalled() throws Exception {
        StubCalendar calendar = StubCalendar.unconfigured();
        StubWebhook webhook = StubWebhook.unconfigured();

        ForwardOutcome outcome = new DefaultForwardingFanout(calendar, webhook, new SyncExecutor(),
                OutreachMetricsPublisher.NOOP, sinkProperties(1000)).forward(booking()).get(1, TimeUnit.SECONDS);

        assertThat(outcome.calendar().status()).isEqualTo(SinkOutcome.Status.NOT_CONFIGURED);
        assertThat(outcome.webhook().status()).isEqualTo(SinkOutcome.Status.NOT_CONFIGURED);
        assertThat(calendar.calls.get()).isZero();
        assertThat(webhook.calls.get()).isZero();
    }

    @Test
    void calendarFailureDoesNotAffectWebhook() throws Exception {
        StubCalendar calendar = StubCalendar.returning(SinkOutcome.failed("calendar returned 503: busy"));
        StubWebhook webhook = StubWebhook.returning(SinkOutcome.success());

        ForwardOutcome outcome = new DefaultForwardingFanout(calendar, webhook, pool,
                OutreachMetricsPublisher.NOOP, sinkProperties(1000)).forward(booking()).get(2, TimeUnit.SECONDS);

        assertThat(outcome.calendar().reason()).isEqualTo("calendar returned 503: busy");
        assertThat(outcome.webhook()).isEqualTo(SinkOutcome.success());
    }

    @Test
    void slowSinkTimesOutWhileOtherSucceeds() throws Exception {
        StubCalendar calendar = StubCalendar.returning(SinkOutcome.success());
        calendar.delayMs = 2000;
        StubWebhook webhook = StubWebhook.returning(SinkOutcome.success());

        long t0 = System.nanoTime();
        ForwardOutcome outcome = new DefaultForwardingFanout(calendar, webhook, pool,
                OutreachMetricsPublisher.NOOP, sinkProperties(150)).forward(booking()).get(2, TimeUnit.SECONDS);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);

        assertThat(outcome.calendar()).isEqualTo(SinkOutcome.failed(DefaultForwardingFanout.TIMED_OUT));
        assertThat(outcome.webhook()).isEqualTo(SinkOutcome.success());
        assertThat(elapsedMs).isLessThan(1500);
    }

    @Test
    void throwingSinkIsRecordedAsFailure() throws Exception {
        StubCalendar calendar = StubCalendar.returning(SinkOutcome.success());
        calendar.failure = new IllegalStateException("calendar exploded");
        StubWebhook webhook = StubWebhook.returning(null);

        ForwardOutcome outcome = new DefaultForwardingFanout(calendar, webhook, new SyncExecutor(),
                OutreachMetricsPublisher.NOOP, sinkProperties(1000)).forward(booking()).get(1, TimeUnit.SECONDS);

        assertThat(outcome.calendar().reason()).isEqualTo("calendar exploded");
        assertThat(outcome.webhook().reason()).isEqualTo("webhook returned no outcome");
    }

    @Test
    void rejectedAttemptIsRecordedAsFailure() throws Exception {
        ForwardOutcome outcome = new DefaultForwardingFanout(
                StubCalendar.returning(SinkOutcome.success()), StubWebhook.returning(SinkOutcome.success()),
                command -> { throw new RejectedExecutionException("saturated"); },
                OutreachMetricsPublisher.NOOP, sinkProperties(1000)).forward(booking()).get(1, TimeUnit.SECONDS);

        assertThat(outcome.calendar().reason()).isEqualTo("calendar attempt rejected");
        assertThat(outcome.webhook().reason()).isEqualTo("webhook attempt rejected");
    }

    @Test
    void saturatedForwardPoolNeverRunsSinkOnCallerThread() throws Exception {
        ThreadPoolProperties props = new ThreadPoolProperties();
        props.getForward().setCorePoolSize(1);
        props.getForward().setMaxPoolSize(1);
        props.getForward().setQueueCapacity(0);
        ThreadPoolTaskExecutor forwardPool = new ThreadPoolConfig(props).forwardExecutor();
        StubWebhook webhook = StubWebhook.returning(SinkOutcome.success());
        webhook.gate = new CountDownLatch(1);
        DefaultForwardingFanout fanout = new DefaultForwardingFanout(StubCalendar.unconfigured(), webhook,
                forwardPool, OutreachMetricsPublisher.NOOP, sinkProperties(5000));
        try {
            CompletableFuture<ForwardOutcome> first = fanout.forward(booking());

            long t0 = System.nanoTime();
            CompletableFuture<ForwardOutcome> second = fanout.forward(booking());
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);

            assertThat(elapsedMs).isLessThan(500);
            assertThat(second.get(1, TimeUnit.SECONDS).webhook())
                    .isEqualTo(SinkOutcome.failed("webhook attempt rejected"));
            assertThat(first).isNotDone();

            webhook.gate.countDown();
            assertThat(first.get(2, TimeUnit.SECONDS).webhook()).isEqualTo(SinkOutcome.success());
            assertThat(webhook.calls.get()).isEqualTo(1);
        } finally {
            webhook.gate.countDown();
            forwardPool.shutdown();
        }
    }

    @Test
    void recordsPerSinkOutcomeMetrics() throws Exception {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        OutreachMetricsPublisher metrics = new OutreachMetricsPublisher(new OutreachMetrics(registry));

        new DefaultForwardingFanout(StubCalendar.returning(SinkOutcome.success()), StubWebhook.unconfigured(),
                new SyncExecutor(), metrics, sinkProperties(1000)).forward(booking()).get(1, TimeUnit.SECONDS);

        assertThat(registry.get("callpilot.sink.outcomes").tag("sink", "calendar").tag("status", "success")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("callpilot.sink.outcomes").tag("sink", "webhook").tag("status", "not_configured")
                .counter().count()).isEqualTo(1.0);
    }

    static final class StubCalendar implements CalendarSink {
        final boolean configured;
        final SinkOutcome result;
        final AtomicInteger calls = new AtomicInteger();
        volatile long delayMs;
        volatile RuntimeException failure;
        volatile String lastTitle;
        volatile String lastAttendee;

        private StubCalendar(boolean configured, SinkOutcome result) {
            this.configured = configured;
            this.result = result;
        }

        static StubCalendar returning(SinkOutcome result) {
            return new StubCalendar(true, result);
        }

        static StubCalendar unconfigured() {
            return new StubCalendar(false, null);
        }

        @Override
        public boolean isConfigured() {
            return configured;
        }

        @Override
        public SinkOutcome createEvent(LocalDate date, LocalTime time, String title, String attendee) {
            calls.incrementAndGet();
            lastTitle = title;
            lastAttendee = attendee;
            if (delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            if (failure != null) {
                throw failure;
            }
            return result;
        }
    }

    static final class StubWebhook implements WebhookSink {
        final boolean configured;
        final SinkOutcome result;
        final AtomicInteger calls = new AtomicInteger();
        volatile JSONObject lastPayload;
        volatile CountDownLatch gate;

        private StubWebhook(boolean configured, SinkOutcome result) {
            this.configured = configured;
            this.result = result;
        }

        static StubWebhook returning(SinkOutcome result) {
            return new StubWebhook(true, result);
        }

        static StubWebhook unconfigured() {
            return new StubWebhook(false, null);
        }

        @Override
        public boolean isConfigured() {
            return configured;
        }

        @Override
        public SinkOutcome deliver(JSONObject payload) {
            calls.incrementAndGet();
            lastPayload = payload;
            if (gate != null) {
                try {
                    gate.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return result;
        }
    }
}
