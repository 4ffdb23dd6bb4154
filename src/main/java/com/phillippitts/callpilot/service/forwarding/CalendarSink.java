package com.phillippitts.callpilot.service.forwarding;

import com.phillippitts.callpilot.domain.SinkOutcome;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Calendar that receives an event for every accepted booking.
 */
public interface CalendarSink {

    /**
     * Whether write credentials are configured. An unconfigured sink is never invoked.
     */
    boolean isConfigured();

    /**
     * Creates one calendar event. Implementations report failures as
     * {@link SinkOutcome#failed(String)} instead of throwing.
     *
     * @param attendee optional phone of the person the booking is for
     */
    SinkOutcome createEvent(LocalDate date, LocalTime time, String title, String attendee);
}
