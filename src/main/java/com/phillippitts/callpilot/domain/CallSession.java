package com.phillippitts.callpilot.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One outbound call attempt and its lifecycle state.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * QUEUED → DIALING            (placement acknowledged, via markDialing)
 * DIALING → IN_PROGRESS       (collaborator reports connected, via markInProgress)
 * QUEUED/DIALING/IN_PROGRESS → FAILED     (via markFailed)
 * DIALING/IN_PROGRESS → COMPLETED         (call ended or lifetime elapsed, via markCompleted)
 * any state except CONFIRMED → CONFIRMED  (matching confirmation, via confirm)
 * </pre>
 *
 * <p>{@code COMPLETED} and {@code FAILED} are advisory bookkeeping: a confirmation that arrives
 * after them still moves the session to {@code CONFIRMED}. {@code CONFIRMED} is final.
 *
 * <p><b>Thread Safety:</b> All public methods are thread-safe and use a {@link ReentrantLock}
 * to protect state transitions.
 */
public final class CallSession {

    private final Lock lock = new ReentrantLock();

    private final String id;
    private final String campaignId;
    private final CallTarget target;
    private final Instant createdAt;

    private CallSessionState state = CallSessionState.QUEUED;
    private Instant updatedAt;
    private SessionRef sessionRef;
    private String reason;
    private Booking booking;

    public CallSession(String id, String campaignId, CallTarget target, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.campaignId = Objects.requireNonNull(campaignId, "campaignId must not be null");
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.updatedAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getCampaignId() {
        return campaignId;
    }

    public CallTarget getTarget() {
        return target;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public CallSessionState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public SessionRef getSessionRef() {
        lock.lock();
        try {
            return sessionRef;
        } finally {
            lock.unlock();
        }
    }

    /** Booking produced by this session, or {@code null} if it has not confirmed. */
    public Booking getBooking() {
        lock.lock();
        try {
            return booking;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records that the call-placing service accepted the call.
     *
     * @return {@code true} if the session moved QUEUED → DIALING
     */
    public boolean markDialing(SessionRef ref, Instant at) {
        Objects.requireNonNull(ref, "ref must not be null");
        lock.lock();
        try {
            if (state != CallSessionState.QUEUED) {
                return false;
            }
            sessionRef = ref;
            return moveTo(CallSessionState.DIALING, null, at);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records that the collaborator reported the call connected.
     *
     * @return {@code true} if the session moved DIALING → IN_PROGRESS
     */
    public boolean markInProgress(Instant at) {
        lock.lock();
        try {
            if (state != CallSessionState.DIALING) {
                return false;
            }
            return moveTo(CallSessionState.IN_PROGRESS, null, at);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the session failed with a reason.
     *
     * @return {@code true} if the session was non-terminal and is now FAILED
     */
    public boolean markFailed(String failureReason, Instant at) {
        lock.lock();
        try {
            if (state.isTerminal()) {
                return false;
            }
            return moveTo(CallSessionState.FAILED, failureReason, at);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the session completed without a booking. Only calls that were actually placed can
     * complete; a still-queued session has nothing to complete.
     *
     * @return {@code true} if the session moved to COMPLETED
     */
    public boolean markCompleted(String completionReason, Instant at) {
        lock.lock();
        try {
            if (state != CallSessionState.DIALING && state != CallSessionState.IN_PROGRESS) {
                return false;
            }
            return moveTo(CallSessionState.COMPLETED, completionReason, at);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Attaches a booking and moves to CONFIRMED.
     *
     * @return {@code true} if this call confirmed the session, {@code false} if it was already
     *         confirmed (the existing booking is kept)
     */
    public boolean confirm(Booking confirmed, Instant at) {
        Objects.requireNonNull(confirmed, "confirmed must not be null");
        lock.lock();
        try {
            if (state == CallSessionState.CONFIRMED) {
                return false;
            }
            booking = confirmed;
            return moveTo(CallSessionState.CONFIRMED, null, at);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Checks whether the session is still open and older than {@code lifetimeCutoff}.
     */
    public boolean isOpenSince(Instant lifetimeCutoff) {
        lock.lock();
        try {
            return !state.isTerminal() && createdAt.isBefore(lifetimeCutoff);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns an immutable view of the current state.
     */
    public CallSessionHandle toHandle() {
        lock.lock();
        try {
            ScoredProvider scored = target.provider();
            return new CallSessionHandle(
                    id,
                    campaignId,
                    target.phoneNumber(),
                    scored == null ? null : scored.provider().id(),
                    scored == null ? null : scored.provider().name(),
                    scored == null ? null : scored.rank(),
                    state,
                    sessionRef == null ? null : sessionRef.conversationId(),
                    reason,
                    booking == null ? null : booking.getId(),
                    createdAt,
                    updatedAt);
        } finally {
            lock.unlock();
        }
    }

    private boolean moveTo(CallSessionState next, String nextReason, Instant at) {
        state = next;
        reason = nextReason;
        updatedAt = at == null ? Instant.now() : at;
        return true;
    }
}
