package com.phillippitts.callpilot.presentation.dto;

import com.phillippitts.callpilot.domain.Booking;
import com.phillippitts.callpilot.domain.SinkOutcome;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A booking as shown in telemetry, with both sink outcomes.
 */
public record BookingView(
        String id,
        String sessionId,
        String providerName,
        LocalDate date,
        LocalTime time,
        String title,
        String requesterPhone,
        Instant receivedAt,
        SinkOutcome calendarOutcome,
        SinkOutcome forwardOutcome
) {

    public static BookingView from(Booking b) {
        return new BookingView(b.getId(), b.getSessionId(), b.getProviderName(), b.getDate(), b.getTime(),
                b.getTitle(), b.getRequesterPhone(), b.getReceivedAt(), b.getCalendarOutcome(), b.getForwardOutcome());
    }
}
