package com.phillippitts.callpilot.presentation.controller;

import com.phillippitts.callpilot.domain.ConsolidationResult;
import com.phillippitts.callpilot.presentation.dto.BookingView;
import com.phillippitts.callpilot.presentation.dto.ConfirmationRequest;
import com.phillippitts.callpilot.presentation.dto.ConsolidationView;
import com.phillippitts.callpilot.presentation.dto.TelemetryView;
import com.phillippitts.callpilot.service.consolidation.BookingConsolidator;
import com.phillippitts.callpilot.service.consolidation.TelemetryHistory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Confirmation ingestion and the telemetry query.
 *
 * <p>A new booking answers 201, a duplicate delivery 200 with the existing booking. Malformed
 * confirmations are turned into 400 by the exception handler.
 */
@RestController
class BookingController {

    private final BookingConsolidator consolidator;
    private final TelemetryHistory history;

    BookingController(BookingConsolidator consolidator, TelemetryHistory history) {
        this.consolidator = consolidator;
        this.history = history;
    }

    @PostMapping("/api/bookings/confirmations")
    ResponseEntity<ConsolidationView> confirm(@RequestBody ConfirmationRequest request) {
        ConsolidationResult result = consolidator.onConfirmation(request.toEvent());
        HttpStatus status = result.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(ConsolidationView.from(result));
    }

    @GetMapping("/api/telemetry")
    TelemetryView telemetry() {
        List<BookingView> bookings = history.snapshot().stream().map(BookingView::from).toList();
        return new TelemetryView(history.capacity(), bookings.size(), bookings);
    }
}
