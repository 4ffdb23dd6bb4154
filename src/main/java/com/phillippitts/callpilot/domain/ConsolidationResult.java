package com.phillippitts.callpilot.domain;

import java.util.Objects;

/**
 * Outcome of ingesting one confirmation event.
 *
 * @param status  {@link Status#ACCEPTED} for a new booking, {@link Status#DUPLICATE} for a repeat
 *                delivery of an already confirmed session
 * @param booking the new booking, or the existing one for a duplicate
 */
public record ConsolidationResult(Status status, Booking booking) {

    public enum Status { ACCEPTED, DUPLICATE }

    public ConsolidationResult {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(booking, "booking must not be null");
    }

    public static ConsolidationResult accepted(Booking booking) {
        return new ConsolidationResult(Status.ACCEPTED, booking);
    }

    public static ConsolidationResult duplicate(Booking booking) {
        return new ConsolidationResult(Status.DUPLICATE, booking);
    }

    public boolean isDuplicate() {
        return status == Status.DUPLICATE;
    }
}
