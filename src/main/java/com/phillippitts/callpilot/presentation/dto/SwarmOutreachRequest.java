package com.phillippitts.callpilot.presentation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Swarm dispatch command: call the top-ranked providers on behalf of the requester.
 */
public record SwarmOutreachRequest(
        @NotBlank @JsonAlias("user_phone") String userPhone,
        @NotBlank String objective,
        @Valid Preferences preferences
) {

    /**
     * Optional overrides of the default filter and time window.
     */
    public record Preferences(
            @DecimalMin("0.0") @DecimalMax("5.0") @JsonAlias("min_rating") Double minRating,
            @PositiveOrZero @JsonAlias("max_distance") Double maxDistance,
            @JsonAlias("preferred_time") String preferredTime
    ) { }
}
