package com.phillippitts.callpilot.service.forwarding;

import com.phillippitts.callpilot.config.properties.SinkProperties;
import com.phillippitts.callpilot.domain.Booking;
import com.phillippitts.callpilot.domain.ForwardOutcome;
import com.phillippitts.callpilot.domain.SinkOutcome;
import com.phillippitts.callpilot.service.metrics.OutreachMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs the calendar and webhook attempts as independent tasks on the {@code forwardExecutor}
 * and combines their outcomes without blocking a thread.
 *
 * <p>Each attempt is bounded by {@code callpilot.sinks.timeout-ms}; one that has not finished by
 * then is recorded as {@code FAILED("timed out")}. A sink that throws is recorded as FAILED with
 * the exception message. Neither attempt waits for the other, and no attempt is retried.
 */
@Service
public class DefaultForwardingFanout implements ForwardingFanout {

    private static final Logger LOG = LogManager.getLogger(DefaultForwardingFanout.class);

    static final String TIMED_OUT = "timed out";

    private final CalendarSink calendarSink;
    private final WebhookSink webhookSink;
    private final Executor executor;
    private final OutreachMetricsPublisher metrics;
    private final long timeoutMs;

    public DefaultForwardingFanout(CalendarSink calendarSink,
                                   WebhookSink webhookSink,
                                   @Qualifier("forwardExecutor") Executor executor,
                                   OutreachMetricsPublisher metrics,
                                   SinkProperties properties) {
        this.calendarSink = Objects.requireNonNull(calendarSink);
        this.webhookSink = Objects.requireNonNull(webhookSink);
        this.executor = Objects.requireNonNull(executor);
        this.metrics = metrics == null ? OutreachMetricsPublisher.NOOP : metrics;
        this.timeoutMs = properties.getTimeoutMs();
    }

    @Override
    public CompletableFuture<ForwardOutcome> forward(Booking booking) {
        Objects.requireNonNull(booking, "booking must not be null");

        CompletableFuture<SinkOutcome> calendar = attempt("calendar", calendarSink.isConfigured(),
                () -> calendarSink.createEvent(booking.getDate(), booking.getTime(),
                        BookingPayloads.calendarTitle(booking), booking.getRequesterPhone()));
        CompletableFuture<SinkOutcome> webhook = attempt("webhook", webhookSink.isConfigured(),
                () -> webhookSink.deliver(BookingPayloads.toJson(booking)));

        return calendar.thenCombine(webhook, ForwardOutcome::new)
                .thenApply(outcome -> {
                    booking.recordOutcome(outcome);
                    metrics.recordForward(outcome);
                    LOG.info("Forwarded booking {}: calendar={}, webhook={}",
                            booking.getId(), outcome.calendar().status(), outcome.webhook().status());
                    return outcome;
                });
    }

    private CompletableFuture<SinkOutcome> attempt(String sink, boolean configured, Supplier<SinkOutcome> call) {
        if (!configured) {
            return CompletableFuture.completedFuture(SinkOutcome.notConfigured());
        }
        try {
            return CompletableFuture.supplyAsync(() -> guarded(sink, call), executor)
                    .completeOnTimeout(SinkOutcome.failed(TIMED_OUT), timeoutMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.warn("{} attempt rejected by executor: {}", sink, e.getMessage());
            return CompletableFuture.completedFuture(SinkOutcome.failed(sink + " attempt rejected"));
        }
    }

    private static SinkOutcome guarded(String sink, Supplier<SinkOutcome> call) {
        ThreadContext.put("sink", sink);
        try {
            SinkOutcome outcome = call.get();
            return outcome == null ? SinkOutcome.failed(sink + " returned no outcome") : outcome;
        } catch (RuntimeException e) {
            LOG.warn("{} sink threw {}", sink, e.toString());
            return SinkOutcome.failed(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        } finally {
            ThreadContext.remove("sink");
        }
    }
}
