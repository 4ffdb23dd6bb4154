package com.phillippitts.callpilot.service.forwarding;

import com.phillippitts.callpilot.domain.Booking;
import com.phillippitts.callpilot.domain.ForwardOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * Delivers an accepted booking to the calendar and webhook sinks.
 */
public interface ForwardingFanout {

    /**
     * Attempts each configured sink once, concurrently, and records both outcomes on the
     * booking. The returned future never completes exceptionally; every failure is an outcome.
     *
     * @return both sink outcomes, once each attempt finished or timed out
     */
    CompletableFuture<ForwardOutcome> forward(Booking booking);
}
