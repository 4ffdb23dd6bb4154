package com.phillippitts.callpilot.service.dispatch.event;

/**
 * Call progress reported by the call-placing service.
 */
public enum CallState {
    /** The callee picked up; the agent is talking. */
    CONNECTED,
    /** The call ended normally. */
    ENDED,
    /** The call could not be completed (busy, no answer, carrier error). */
    FAILED
}
