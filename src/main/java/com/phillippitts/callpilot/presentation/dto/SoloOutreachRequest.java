package com.phillippitts.callpilot.presentation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;

/**
 * Solo dispatch command: call one number with one objective.
 */
public record SoloOutreachRequest(
        @NotBlank @JsonAlias("phone_number") String phoneNumber,
        @NotBlank @JsonAlias("task") String objective
) { }
