package com.phillippitts.callpilot.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;

class BookingTest {

    private final Booking booking = new Booking("b1", null, "Provider", LocalDate.of(2025, 2, 10),
            LocalTime.of(14, 0), null, null, Instant.EPOCH);

    @Test
    void outcomesArePendingUntilRecorded() {
        assertThat(booking.getCalendarOutcome().status()).isEqualTo(SinkOutcome.Status.PENDING);
        assertThat(booking.getForwardOutcome().status()).isEqualTo(SinkOutcome.Status.PENDING);
    }

    @Test
    void outcomesAreWrittenOnce() {
        assertThat(booking.recordOutcome(new ForwardOutcome(SinkOutcome.success(), SinkOutcome.failed("503"))))
                .isTrue();
        assertThat(booking.recordOutcome(new ForwardOutcome(SinkOutcome.failed("late"), SinkOutcome.success())))
                .isFalse();

        assertThat(booking.getCalendarOutcome()).isEqualTo(SinkOutcome.success());
        assertThat(booking.getForwardOutcome().reason()).isEqualTo("503");
    }

    @Test
    void blankFailureReasonGetsPlaceholder() {
        assertThat(SinkOutcome.failed(" ").reason()).isEqualTo("unknown error");
    }
}
