package com.phillippitts.callpilot.service.health;

import com.phillippitts.callpilot.config.properties.OutreachProperties;
import com.phillippitts.callpilot.service.consolidation.TelemetryHistory;
import com.phillippitts.callpilot.service.dispatch.CallSessionRegistry;
import com.phillippitts.callpilot.service.forwarding.CalendarSink;
import com.phillippitts.callpilot.service.forwarding.WebhookSink;
import com.phillippitts.callpilot.testutil.FakeCallPlacementService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class OutreachHealthIndicatorTest {

    private final CalendarSink calendar = mock(CalendarSink.class);
    private final WebhookSink webhook = mock(WebhookSink.class);
    private final CallSessionRegistry registry = new CallSessionRegistry(new OutreachProperties());

    @Test
    void shouldReportUpWhenPlacementConfigured() {
        when(calendar.isConfigured()).thenReturn(true);
        when(webhook.isConfigured()).thenReturn(false);

        Health health = new OutreachHealthIndicator(new FakeCallPlacementService(), calendar, webhook,
                registry, new TelemetryHistory()).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("placement", "configured");
        assertThat(health.getDetails()).containsEntry("calendarSink", "configured");
        assertThat(health.getDetails()).containsEntry("webhookSink", "not configured");
        assertThat(health.getDetails()).containsEntry("openSessions", 0);
        assertThat(health.getDetails()).containsEntry("telemetrySize", 0);
    }

    @Test
    void shouldReportDegradedWhenPlacementMissingSettings() {
        FakeCallPlacementService placement = new FakeCallPlacementService()
                .unconfigured("callpilot.placement.agent-id");

        Health health = new OutreachHealthIndicator(placement, calendar, webhook,
                registry, new TelemetryHistory()).health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("placement", "not configured");
        assertThat(health.getDetails()).containsEntry("missingSettings", List.of("callpilot.placement.agent-id"));
    }
}
