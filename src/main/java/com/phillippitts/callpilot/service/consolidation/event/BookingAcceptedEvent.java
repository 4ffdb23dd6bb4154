package com.phillippitts.callpilot.service.consolidation.event;

import com.phillippitts.callpilot.domain.Booking;

import java.time.Instant;
import java.util.Objects;

/**
 * Published after a confirmation produced a new booking. Duplicates do not publish.
 *
 * @param booking    the accepted booking
 * @param acceptedAt time of acceptance
 */
public record BookingAcceptedEvent(Booking booking, Instant acceptedAt) {

    public BookingAcceptedEvent {
        Objects.requireNonNull(booking, "booking must not be null");
        if (acceptedAt == null) {
            acceptedAt = Instant.now();
        }
    }
}
