package com.phillippitts.callpilot.presentation.exception;

import com.phillippitts.callpilot.exception.CampaignNotFoundException;
import com.phillippitts.callpilot.exception.InvalidProviderException;
import com.phillippitts.callpilot.exception.MalformedBookingException;
import com.phillippitts.callpilot.exception.PlacementNotConfiguredException;
import com.phillippitts.callpilot.exception.ProviderDirectoryException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Rejected confirmation (HTTP 400). The reason names the offending field.
     */
    @ExceptionHandler(MalformedBookingException.class)
    ResponseEntity<ApiError> handleMalformedBooking(MalformedBookingException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(),
                "Confirmation rejected", ex.getReason());
    }

    /**
     * Directory data cannot be ranked (HTTP 422).
     */
    @ExceptionHandler(InvalidProviderException.class)
    ResponseEntity<ApiError> handleInvalidProvider(InvalidProviderException ex) {
        LOG.warn("Invalid provider data: id={}, field={}", ex.getProviderId(), ex.getField());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex.getClass().getSimpleName(),
                "Provider data cannot be ranked", ex.getMessage());
    }

    /**
     * Directory unreadable (HTTP 503).
     */
    @ExceptionHandler(ProviderDirectoryException.class)
    ResponseEntity<ApiError> handleDirectory(ProviderDirectoryException ex) {
        LOG.error("Provider directory unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Provider directory unavailable", "Contact administrator.");
    }

    /**
     * Dispatch refused because call placement lacks settings (HTTP 503).
     */
    @ExceptionHandler(PlacementNotConfiguredException.class)
    ResponseEntity<ApiError> handlePlacementNotConfigured(PlacementNotConfiguredException ex) {
        LOG.warn("Dispatch refused; missing settings: {}", ex.getMissingSettings());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Call placement not configured", "Missing: " + String.join(", ", ex.getMissingSettings()));
    }

    @ExceptionHandler(CampaignNotFoundException.class)
    ResponseEntity<ApiError> handleCampaignNotFound(CampaignNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(),
                "Campaign not found", ex.getCampaignId());
    }

    /**
     * Client error - request body fails bean validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, "ValidationFailed", "Invalid request", details);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.debug("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "BadRequest", "Malformed request", "Check the request body");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
