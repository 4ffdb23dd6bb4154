package com.phillippitts.callpilot.presentation.dto;

import java.util.List;

/**
 * Telemetry history, oldest first.
 */
public record TelemetryView(int capacity, int size, List<BookingView> bookings) { }
