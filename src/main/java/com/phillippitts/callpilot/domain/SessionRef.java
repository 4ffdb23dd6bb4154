package com.phillippitts.callpilot.domain;

import java.util.Objects;

/**
 * Opaque reference returned by the call-placing service when it accepts a call.
 *
 * @param conversationId the collaborator's conversation identifier (never null)
 * @param callSid        telephony call identifier, when the collaborator reports one
 */
public record SessionRef(String conversationId, String callSid) {

    public SessionRef {
        Objects.requireNonNull(conversationId, "conversationId must not be null");
    }
}
