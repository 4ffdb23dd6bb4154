package com.phillippitts.callpilot.service.availability;

import java.util.List;

/**
 * Looks up the requester's free time slots.
 */
public interface AvailabilityService {

    /**
     * Returns the free slots for a requested time window. Never fails and never returns an empty
     * list: when no slots can be obtained the result is {@code [preferredTime]}.
     *
     * @param preferredTime requested window, e.g. "morning"
     */
    List<String> freeSlots(String preferredTime);
}
