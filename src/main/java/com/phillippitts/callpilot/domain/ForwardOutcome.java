package com.phillippitts.callpilot.domain;

import java.util.Objects;

/**
 * Independent outcomes of forwarding one booking to the calendar and webhook sinks.
 */
public record ForwardOutcome(SinkOutcome calendar, SinkOutcome webhook) {

    public ForwardOutcome {
        Objects.requireNonNull(calendar, "calendar outcome must not be null");
        Objects.requireNonNull(webhook, "webhook outcome must not be null");
    }
}
