package com.phillippitts.callpilot.domain;

/**
 * Lifecycle states of an outbound call session.
 *
 * <pre>
 * QUEUED → DIALING → IN_PROGRESS → {CONFIRMED, COMPLETED, FAILED}
 * COMPLETED / FAILED → CONFIRMED   (late matching confirmation only)
 * </pre>
 *
 * <p>{@link #isTerminal()} means the call itself is over: no placement, call-state notification
 * or lifetime sweep changes the state any more. Only {@code CONFIRMED} is final. A session that
 * ended as {@code COMPLETED} or {@code FAILED} has no booking until a confirmation quoting it
 * arrives, which moves it to {@code CONFIRMED}.
 */
public enum CallSessionState {
    QUEUED,
    DIALING,
    IN_PROGRESS,
    CONFIRMED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == CONFIRMED || this == COMPLETED || this == FAILED;
    }
}
