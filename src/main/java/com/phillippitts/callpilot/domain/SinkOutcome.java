package com.phillippitts.callpilot.domain;

import java.util.Objects;

/**
 * Result of one delivery attempt to a downstream sink.
 *
 * <p>{@link Status#PENDING} only describes a booking whose fan-out has not finished yet; sinks
 * themselves never return it.
 *
 * @param status outcome category
 * @param reason failure reason for {@link Status#FAILED}, otherwise {@code null}
 */
public record SinkOutcome(Status status, String reason) {

    public enum Status { PENDING, NOT_CONFIGURED, SUCCESS, FAILED }

    private static final SinkOutcome PENDING = new SinkOutcome(Status.PENDING, null);
    private static final SinkOutcome NOT_CONFIGURED = new SinkOutcome(Status.NOT_CONFIGURED, null);
    private static final SinkOutcome SUCCESS = new SinkOutcome(Status.SUCCESS, null);

    public SinkOutcome {
        Objects.requireNonNull(status, "status must not be null");
    }

    public static SinkOutcome pending() {
        return PENDING;
    }

    public static SinkOutcome notConfigured() {
        return NOT_CONFIGURED;
    }

    public static SinkOutcome success() {
        return SUCCESS;
    }

    public static SinkOutcome failed(String reason) {
        return new SinkOutcome(Status.FAILED, reason == null || reason.isBlank() ? "unknown error" : reason);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
