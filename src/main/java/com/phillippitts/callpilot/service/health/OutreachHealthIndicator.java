package com.phillippitts.callpilot.service.health;

import com.phillippitts.callpilot.service.consolidation.TelemetryHistory;
import com.phillippitts.callpilot.service.dispatch.CallSessionRegistry;
import com.phillippitts.callpilot.service.forwarding.CalendarSink;
import com.phillippitts.callpilot.service.forwarding.WebhookSink;
import com.phillippitts.callpilot.service.placement.CallPlacementService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Health indicator for outreach readiness.
 *
 * <ul>
 *   <li>UP: call placement is configured</li>
 *   <li>DEGRADED: call placement lacks settings, so dispatch is refused; confirmations and
 *       telemetry still work</li>
 * </ul>
 *
 * <p>Sink configuration, open sessions and telemetry size are reported as details. Exposed via
 * /actuator/health.
 */
@Component
public class OutreachHealthIndicator implements HealthIndicator {

    private final CallPlacementService placementService;
    private final CalendarSink calendarSink;
    private final WebhookSink webhookSink;
    private final CallSessionRegistry registry;
    private final TelemetryHistory history;

    public OutreachHealthIndicator(CallPlacementService placementService,
                                   CalendarSink calendarSink,
                                   WebhookSink webhookSink,
                                   CallSessionRegistry registry,
                                   TelemetryHistory history) {
        this.placementService = placementService;
        this.calendarSink = calendarSink;
        this.webhookSink = webhookSink;
        this.registry = registry;
        this.history = history;
    }

    @Override
    public Health health() {
        List<String> missing = placementService.missingSettings();
        Health.Builder builder = new Health.Builder();
        if (missing.isEmpty()) {
            builder.up().withDetail("placement", "configured");
        } else {
            builder.status("DEGRADED")
                    .withDetail("placement", "not configured")
                    .withDetail("missingSettings", missing);
        }
        return builder
                .withDetail("calendarSink", sinkStatus(calendarSink.isConfigured()))
                .withDetail("webhookSink", sinkStatus(webhookSink.isConfigured()))
                .withDetail("openSessions", registry.openSessions().size())
                .withDetail("telemetrySize", history.size())
                .build();
    }

    private static String sinkStatus(boolean configured) {
        return configured ? "configured" : "not configured";
    }
}
