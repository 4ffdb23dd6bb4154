package com.phillippitts.callpilot.service.consolidation;

import com.phillippitts.callpilot.domain.ConfirmationEvent;
import com.phillippitts.callpilot.domain.ConsolidationResult;

/**
 * Reduces confirmation events to deduplicated bookings.
 */
public interface BookingConsolidator {

    /**
     * Ingests one confirmation.
     *
     * <ul>
     *   <li>Malformed: throws, nothing changes.</li>
     *   <li>Session already confirmed: returns its existing booking as a duplicate.</li>
     *   <li>Session absent or unknown: accepted as a new booking.</li>
     *   <li>Otherwise: confirms the session, records a new booking in telemetry.</li>
     * </ul>
     *
     * @throws com.phillippitts.callpilot.exception.MalformedBookingException if provider name,
     *         date or time is missing or malformed
     */
    ConsolidationResult onConfirmation(ConfirmationEvent event);
}
