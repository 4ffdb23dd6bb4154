package com.phillippitts.callpilot.service.consolidation;

import com.phillippitts.callpilot.domain.Booking;
import com.phillippitts.callpilot.domain.CallSession;
import com.phillippitts.callpilot.domain.ConfirmationEvent;
import com.phillippitts.callpilot.domain.ConsolidationResult;
import com.phillippitts.callpilot.exception.MalformedBookingException;
import com.phillippitts.callpilot.service.consolidation.ConfirmationValidator.ValidConfirmation;
import com.phillippitts.callpilot.service.consolidation.event.BookingAcceptedEvent;
import com.phillippitts.callpilot.service.dispatch.CallSessionRegistry;
import com.phillippitts.callpilot.service.metrics.OutreachMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-writer consolidator.
 *
 * <p><b>Concurrency:</b> the duplicate check, the session transition and the telemetry append
 * run under one lock, so confirmations are applied in arrival order and two deliveries for the
 * same session can never both create a booking. Validation happens before the lock; the
 * {@link BookingAcceptedEvent} is published after it is released, so forwarding never runs
 * while the lock is held.
 *
 * <p>Distinct sessions of one swarm each produce their own booking. No provider "wins".
 */
@Service
public class DefaultBookingConsolidator implements BookingConsolidator {

    private static final Logger LOG = LogManager.getLogger(DefaultBookingConsolidator.class);

    private final Lock writeLock = new ReentrantLock();

    private final ConfirmationValidator validator;
    private final CallSessionRegistry registry;
    private final TelemetryHistory history;
    private final ApplicationEventPublisher publisher;
    private final OutreachMetricsPublisher metrics;
    private final Clock clock;

    public DefaultBookingConsolidator(ConfirmationValidator validator,
                                      CallSessionRegistry registry,
                                      TelemetryHistory history,
                                      ApplicationEventPublisher publisher,
                                      OutreachMetricsPublisher metrics,
                                      Clock clock) {
        this.validator = Objects.requireNonNull(validator);
        this.registry = Objects.requireNonNull(registry);
        this.history = Objects.requireNonNull(history);
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = metrics == null ? OutreachMetricsPublisher.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public ConsolidationResult onConfirmation(ConfirmationEvent event) {
        ValidConfirmation confirmation;
        try {
            confirmation = validator.validate(event);
        } catch (MalformedBookingException e) {
            metrics.recordConfirmation("malformed");
            LOG.warn("Rejected confirmation: {}", e.getReason());
            throw e;
        }

        ConsolidationResult result;
        writeLock.lock();
        try {
            result = consolidate(confirmation);
        } finally {
            writeLock.unlock();
        }

        if (!result.isDuplicate()) {
            publisher.publishEvent(new BookingAcceptedEvent(result.booking(), result.booking().getReceivedAt()));
        }
        return result;
    }

    private ConsolidationResult consolidate(ValidConfirmation confirmation) {
        Instant now = clock.instant();
        CallSession session = registry.findSession(confirmation.sessionRef()).orElse(null);

        if (session == null) {
            if (confirmation.sessionRef() != null) {
                LOG.info("Confirmation for unknown session ref {}; accepting without deduplication",
                        confirmation.sessionRef());
            }
            Booking booking = newBooking(confirmation, null, now);
            record(booking);
            metrics.recordConfirmation("uncorrelated");
            return ConsolidationResult.accepted(booking);
        }

        Booking existing = session.getBooking();
        if (existing != null) {
            metrics.recordConfirmation("duplicate");
            LOG.info("Duplicate confirmation for session {}; keeping booking {}", session.getId(), existing.getId());
            return ConsolidationResult.duplicate(existing);
        }

        Booking booking = newBooking(confirmation, session.getId(), now);
        session.confirm(booking, now);
        record(booking);
        metrics.recordConfirmation("accepted");
        LOG.info("Session {} confirmed: booking {} with {} on {} at {}",
                session.getId(), booking.getId(), booking.getProviderName(), booking.getDate(), booking.getTime());
        return ConsolidationResult.accepted(booking);
    }

    private void record(Booking booking) {
        Booking evicted = history.append(booking);
        if (evicted != null) {
            LOG.debug("Telemetry full; evicted booking {}", evicted.getId());
        }
    }

    private static Booking newBooking(ValidConfirmation c, String sessionId, Instant now) {
        return new Booking(UUID.randomUUID().toString(), sessionId, c.providerName(), c.date(), c.time(),
                c.title(), c.requesterPhone(), now);
    }
}
