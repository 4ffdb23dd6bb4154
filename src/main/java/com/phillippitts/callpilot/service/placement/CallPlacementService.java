package com.phillippitts.callpilot.service.placement;

import com.phillippitts.callpilot.domain.CallTarget;
import com.phillippitts.callpilot.domain.SessionRef;

import java.util.List;

/**
 * Client of the external call-placing service.
 *
 * <p>{@link #startCall} only asks the service to begin a call and returns its reference; the
 * conversation itself, and any booking it produces, reach the engine later as call-state
 * notifications and confirmation events.
 */
public interface CallPlacementService {

    /**
     * Asks the service to dial the target with the given agent brief.
     *
     * @param target number and optional provider to call
     * @param brief  instructions for the voice agent
     * @return reference of the started call
     * @throws com.phillippitts.callpilot.exception.PlacementException if the service refused or
     *         could not be reached
     */
    SessionRef startCall(CallTarget target, String brief);

    /**
     * Settings that still need a value before calls can be placed; empty when ready.
     */
    List<String> missingSettings();

    default boolean isConfigured() {
        return missingSettings().isEmpty();
    }
}
