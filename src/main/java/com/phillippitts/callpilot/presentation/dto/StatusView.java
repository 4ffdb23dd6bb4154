package com.phillippitts.callpilot.presentation.dto;

import java.util.List;

/**
 * Configuration readiness of the engine and its sinks.
 */
public record StatusView(
        boolean callPlacementConfigured,
        List<String> missingSettings,
        boolean calendarConfigured,
        boolean webhookConfigured
) { }
