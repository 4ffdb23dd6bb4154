package com.phillippitts.callpilot.presentation.controller;

import com.phillippitts.callpilot.presentation.dto.StatusView;
import com.phillippitts.callpilot.service.forwarding.CalendarSink;
import com.phillippitts.callpilot.service.forwarding.WebhookSink;
import com.phillippitts.callpilot.service.placement.CallPlacementService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Reports whether calls can be placed and which sinks are configured.
 */
@RestController
class StatusController {

    private final CallPlacementService placementService;
    private final CalendarSink calendarSink;
    private final WebhookSink webhookSink;

    StatusController(CallPlacementService placementService, CalendarSink calendarSink, WebhookSink webhookSink) {
        this.placementService = placementService;
        this.calendarSink = calendarSink;
        this.webhookSink = webhookSink;
    }

    @GetMapping("/api/status")
    StatusView status() {
        List<String> missing = placementService.missingSettings();
        return new StatusView(missing.isEmpty(), missing, calendarSink.isConfigured(), webhookSink.isConfigured());
    }
}
