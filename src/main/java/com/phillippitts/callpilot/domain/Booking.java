package com.phillippitts.callpilot.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An accepted booking confirmation.
 *
 * <p>All fields are fixed at construction except the calendar and forward outcomes, which the
 * forwarding fan-out writes at most once each. Until then both report
 * {@link SinkOutcome#pending()}. The outcome slots are atomic so readers of a telemetry snapshot
 * never observe a partially written value.
 */
public final class Booking {

    private final String id;
    private final String sessionId;
    private final String providerName;
    private final LocalDate date;
    private final LocalTime time;
    private final String title;
    private final String requesterPhone;
    private final Instant receivedAt;
    private final AtomicReference<SinkOutcome> calendarOutcome = new AtomicReference<>();
    private final AtomicReference<SinkOutcome> forwardOutcome = new AtomicReference<>();

    public Booking(String id, String sessionId, String providerName, LocalDate date, LocalTime time,
                   String title, String requesterPhone, Instant receivedAt) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.sessionId = sessionId;
        this.providerName = Objects.requireNonNull(providerName, "providerName must not be null");
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.time = Objects.requireNonNull(time, "time must not be null");
        this.title = title;
        this.requesterPhone = requesterPhone;
        this.receivedAt = Objects.requireNonNull(receivedAt, "receivedAt must not be null");
    }

    public String getId() {
        return id;
    }

    /** Originating session id, or {@code null} when the confirmation could not be correlated. */
    public String getSessionId() {
        return sessionId;
    }

    public String getProviderName() {
        return providerName;
    }

    public LocalDate getDate() {
        return date;
    }

    public LocalTime getTime() {
        return time;
    }

    public String getTitle() {
        return title;
    }

    public String getRequesterPhone() {
        return requesterPhone;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    public SinkOutcome getCalendarOutcome() {
        SinkOutcome o = calendarOutcome.get();
        return o == null ? SinkOutcome.pending() : o;
    }

    public SinkOutcome getForwardOutcome() {
        SinkOutcome o = forwardOutcome.get();
        return o == null ? SinkOutcome.pending() : o;
    }

    /**
     * Records both sink outcomes. Each slot is written only if still empty.
     *
     * @return {@code true} if at least one slot was written by this call
     */
    public boolean recordOutcome(ForwardOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome must not be null");
        boolean calendarSet = calendarOutcome.compareAndSet(null, outcome.calendar());
        boolean forwardSet = forwardOutcome.compareAndSet(null, outcome.webhook());
        return calendarSet || forwardSet;
    }

    @Override
    public String toString() {
        return "Booking{id=" + id + ", sessionId=" + sessionId + ", provider=" + providerName
                + ", date=" + date + ", time=" + time + '}';
    }
}
