package com.phillippitts.callpilot.presentation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.phillippitts.callpilot.domain.ConfirmationEvent;

/**
 * Booking confirmation as posted by the voice agent's confirm tool.
 *
 * <p>No bean-validation constraints: required fields are checked by the consolidator so that a
 * rejection names the offending field.
 */
public record ConfirmationRequest(
        @JsonAlias({"session_ref", "session_id", "conversation_id"}) String sessionRef,
        @JsonAlias("provider_name") String providerName,
        String date,
        String time,
        String title,
        @JsonAlias({"requester_phone", "user_phone"}) String requesterPhone
) {

    public ConfirmationEvent toEvent() {
        return new ConfirmationEvent(sessionRef, providerName, date, time, title, requesterPhone);
    }
}
