package com.phillippitts.callpilot.service.dispatch.event;

import java.time.Instant;
import java.util.Objects;

/**
 * Published when the call-placing service reports a call-state transition.
 *
 * @param sessionRef engine session id or collaborator conversation id
 * @param state      reported state
 * @param reason     optional detail (end or failure reason)
 * @param at         time the notification was received
 */
public record CallStateChangedEvent(String sessionRef, CallState state, String reason, Instant at) {

    public CallStateChangedEvent {
        Objects.requireNonNull(sessionRef, "sessionRef must not be null");
        Objects.requireNonNull(state, "state must not be null");
        if (at == null) {
            at = Instant.now();
        }
    }
}
