package com.phillippitts.callpilot;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class CallPilotApplicationTests {

    @Autowired
    private MockMvc mvc;

    @Test
    void contextLoads() {
    }

    @Test
    void statusReportsMissingPlacementSettings() throws Exception {
        mvc.perform(get("/api/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.callPlacementConfigured").value(false))
                .andExpect(jsonPath("$.missingSettings[0]").value("callpilot.placement.api-key"))
                .andExpect(jsonPath("$.calendarConfigured").value(false))
                .andExpect(jsonPath("$.webhookConfigured").value(false));
    }

    @Test
    void dispatchIsRefusedWithoutCredentials() throws Exception {
        mvc.perform(post("/api/outreach/solo")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phone_number\":\"+15551234567\",\"task\":\"Book a haircut\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("PlacementNotConfiguredException"));
    }

    @Test
    void soloWithoutPhoneFailsValidation() throws Exception {
        mvc.perform(post("/api/outreach/solo")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"task\":\"Book a haircut\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("ValidationFailed"));
    }

    @Test
    void healthIsDegradedWithoutCredentials() throws Exception {
        mvc.perform(get("/actuator/health"))
                .andExpect(jsonPath("$.components.outreach.status").value("DEGRADED"));
    }
}
