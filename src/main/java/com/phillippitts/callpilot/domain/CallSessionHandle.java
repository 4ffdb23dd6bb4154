package com.phillippitts.callpilot.domain;

import java.time.Instant;

/**
 * Immutable snapshot of a call session, returned to callers for progress display.
 *
 * @param sessionId    engine session id
 * @param campaignId   owning campaign
 * @param phoneNumber  number dialed
 * @param providerId   ranked provider id (null in solo mode)
 * @param providerName ranked provider name (null in solo mode)
 * @param rank         provider rank position (null in solo mode)
 * @param state        state at snapshot time
 * @param sessionRef   collaborator conversation id, once placement was acknowledged
 * @param reason       failure or completion reason, if any
 * @param bookingId    booking id once confirmed
 * @param createdAt    creation time
 * @param updatedAt    time of the last state change
 */
public record CallSessionHandle(
        String sessionId,
        String campaignId,
        String phoneNumber,
        String providerId,
        String providerName,
        Integer rank,
        CallSessionState state,
        String sessionRef,
        String reason,
        String bookingId,
        Instant createdAt,
        Instant updatedAt
) { }
