package com.phillippitts.callpilot.presentation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.phillippitts.callpilot.service.dispatch.event.CallState;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Call-state notification from the call-placing service.
 */
public record CallStateRequest(
        @NotBlank @JsonAlias({"session_ref", "conversation_id"}) String sessionRef,
        @NotNull CallState state,
        String reason
) { }
