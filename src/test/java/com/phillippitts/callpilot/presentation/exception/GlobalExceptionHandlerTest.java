package com.phillippitts.callpilot.presentation.exception;

import com.phillippitts.callpilot.exception.CampaignNotFoundException;
import com.phillippitts.callpilot.exception.InvalidProviderException;
import com.phillippitts.callpilot.exception.MalformedBookingException;
import com.phillippitts.callpilot.exception.PlacementNotConfiguredException;
import com.phillippitts.callpilot.exception.ProviderDirectoryException;
import com.phillippitts.callpilot.presentation.exception.GlobalExceptionHandler.ApiError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void malformedBookingReturns400WithReason() {
        ResponseEntity<ApiError> response = handler.handleMalformedBooking(
                new MalformedBookingException("date is required"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("MalformedBookingException");
        assertThat(response.getBody().details()).isEqualTo("date is required");
        assertThat(response.getBody().timestamp()).isNotNull();
    }

    @Test
    void invalidProviderReturns422() {
        ResponseEntity<ApiError> response = handler.handleInvalidProvider(
                new InvalidProviderException("7", "rating", "must be within [0, 5], got 6.0"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody().details()).contains("Invalid provider 7");
    }

    @Test
    void directoryFailureReturns503WithoutLeakingLocation() {
        ResponseEntity<ApiError> response = handler.handleDirectory(
                new ProviderDirectoryException("file:/secret/internal/providers.json", "not found"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).doesNotContain("/secret/internal");
    }

    @Test
    void unconfiguredPlacementNamesMissingSettings() {
        ResponseEntity<ApiError> response = handler.handlePlacementNotConfigured(
                new PlacementNotConfiguredException(List.of("callpilot.placement.api-key",
                        "callpilot.placement.agent-id")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().details())
                .isEqualTo("Missing: callpilot.placement.api-key, callpilot.placement.agent-id");
    }

    @Test
    void unknownCampaignReturns404() {
        ResponseEntity<ApiError> response = handler.handleCampaignNotFound(new CampaignNotFoundException("c-9"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().details()).isEqualTo("c-9");
    }

    @Test
    void unexpectedErrorReturns500WithoutInternals() {
        ResponseEntity<ApiError> response = handler.handleUnexpected(new IllegalStateException("db password is x"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).doesNotContain("db password");
    }

    @Test
    void illegalArgumentReturns400() {
        ResponseEntity<ApiError> response = handler.handleBadRequest(new IllegalArgumentException("bad"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("BadRequest");
    }
}
