package com.phillippitts.callpilot.presentation.dto;

import com.phillippitts.callpilot.domain.ConsolidationResult;

/**
 * Result of posting a confirmation.
 */
public record ConsolidationView(ConsolidationResult.Status status, BookingView booking) {

    public static ConsolidationView from(ConsolidationResult result) {
        return new ConsolidationView(result.status(), BookingView.from(result.booking()));
    }
}
