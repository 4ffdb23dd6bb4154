package com.phillippitts.callpilot.integration;

import com.jayway.jsonpath.JsonPath;
import com.phillippitts.callpilot.service.placement.CallPlacementService;
import com.phillippitts.callpilot.testutil.FakeCallPlacementService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Full request path from swarm dispatch through confirmation to telemetry, with the call-placing
 * service replaced by an in-memory fake.
 */
@SpringBootTest
@AutoConfigureMockMvc
class OutreachEndToEndTest {

    @TestConfiguration
    static class FakePlacementConfig {
        @Bean
        @Primary
        CallPlacementService fakeCallPlacementService() {
            return new FakeCallPlacementService();
        }
    }

    @Autowired
    private MockMvc mvc;

    @Autowired
    private CallPlacementService placement;

    @Test
    void swarmConfirmAndTelemetry() throws Exception {
        MvcResult dispatched = mvc.perform(post("/api/outreach/swarm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_phone\":\"+15559990000\",\"objective\":\"Book a dental cleaning\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("SWARM"))
                .andExpect(jsonPath("$.sessions", hasSize(3)))
                .andExpect(jsonPath("$.sessions[0].state").value("DIALING"))
                .andExpect(jsonPath("$.sessions[0].rank").value(1))
                .andReturn();

        String body = dispatched.getResponse().getContentAsString();
        String campaignId = JsonPath.read(body, "$.campaignId");
        String sessionId = JsonPath.read(body, "$.sessions[0].sessionId");
        String providerName = JsonPath.read(body, "$.sessions[0].providerName");
        assertThat(((FakeCallPlacementService) placement).dialed()).contains("+15559990000");

        String confirmation = "{\"session_ref\":\"" + sessionId + "\",\"provider_name\":\"" + providerName + "\","
                + "\"date\":\"2025-02-10\",\"time\":\"14:00\"}";
        mvc.perform(post("/api/bookings/confirmations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(confirmation))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("ACCEPTED"));
        mvc.perform(post("/api/bookings/confirmations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(confirmation))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DUPLICATE"));

        mvc.perform(get("/api/outreach/" + campaignId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessions[0].state").value("CONFIRMED"));

        MvcResult telemetry = mvc.perform(get("/api/telemetry"))
                .andExpect(status().isOk())
                .andReturn();
        List<String> sessionIds = JsonPath.read(telemetry.getResponse().getContentAsString(),
                "$.bookings[*].sessionId");
        assertThat(sessionIds).containsOnlyOnce(sessionId);
        List<String> calendarStatuses = JsonPath.read(telemetry.getResponse().getContentAsString(),
                "$.bookings[?(@.sessionId == '" + sessionId + "')].calendarOutcome.status");
        assertThat(calendarStatuses).containsExactly("NOT_CONFIGURED");
    }

    @Test
    void callStateCallbackMovesSessionForward() throws Exception {
        MvcResult dispatched = mvc.perform(post("/api/outreach/solo")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phone_number\":\"+15551234567\",\"task\":\"Book a haircut\"}"))
                .andExpect(status().isOk())
                .andReturn();
        String body = dispatched.getResponse().getContentAsString();
        String campaignId = JsonPath.read(body, "$.campaignId");
        String conversationId = JsonPath.read(body, "$.sessions[0].sessionRef");

        mvc.perform(post("/api/calls/state")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"conversation_id\":\"" + conversationId + "\",\"state\":\"CONNECTED\"}"))
                .andExpect(status().isAccepted());

        mvc.perform(get("/api/outreach/" + campaignId))
                .andExpect(jsonPath("$.sessions[0].state").value("IN_PROGRESS"));
    }

    @Test
    void rankedProvidersHonourFilters() throws Exception {
        mvc.perform(get("/api/providers/ranked"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(6)))
                .andExpect(jsonPath("$[0].rank").value(1));

        mvc.perform(get("/api/providers/ranked").param("minRating", "4.5").param("maxDistance", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].rating", everyItem(greaterThanOrEqualTo(4.5))));
    }

    @Test
    void unknownCampaignIsNotFound() throws Exception {
        mvc.perform(get("/api/outreach/does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("CampaignNotFoundException"));
    }
}
