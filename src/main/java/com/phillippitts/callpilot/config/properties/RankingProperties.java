package com.phillippitts.callpilot.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Weights and default preference filters for provider ranking.
 *
 * <p>Weights are fixed for the life of the process so that ranking stays deterministic. The
 * defaults make rating dominant: a provider with the best rating outranks one that is only
 * closest and most available.
 */
@Validated
@ConfigurationProperties(prefix = "callpilot.ranking")
public class RankingProperties {

    private static final double WEIGHT_SUM_TOLERANCE = 1e-6;

    @Min(0)
    @Max(1)
    private final double ratingWeight;

    @Min(0)
    @Max(1)
    private final double availabilityWeight;

    @Min(0)
    @Max(1)
    private final double distanceWeight;

    /** Default minimum rating applied by the swarm preference filter. */
    @Min(0)
    @Max(5)
    private final double defaultMinRating;

    /** Default maximum distance in miles applied by the swarm preference filter. */
    @PositiveOrZero
    private final double defaultMaxDistance;

    @ConstructorBinding
    public RankingProperties(Double ratingWeight, Double availabilityWeight, Double distanceWeight,
                             Double defaultMinRating, Double defaultMaxDistance) {
        this.ratingWeight = ratingWeight == null ? 0.60 : ratingWeight;
        this.availabilityWeight = availabilityWeight == null ? 0.25 : availabilityWeight;
        this.distanceWeight = distanceWeight == null ? 0.15 : distanceWeight;
        double sum = this.ratingWeight + this.availabilityWeight + this.distanceWeight;
        if (this.ratingWeight < 0 || this.availabilityWeight < 0 || this.distanceWeight < 0
                || Math.abs(sum - 1.0) > WEIGHT_SUM_TOLERANCE) {
            throw new IllegalArgumentException(
                    "callpilot.ranking weights must be non-negative and sum to 1.0, got: " + sum);
        }
        this.defaultMinRating = defaultMinRating == null ? 4.0 : defaultMinRating;
        this.defaultMaxDistance = defaultMaxDistance == null ? 5.0 : defaultMaxDistance;
    }

    /** Defaults for tests and manual instantiation. */
    public static RankingProperties defaults() {
        return new RankingProperties(null, null, null, null, null);
    }

    public double getRatingWeight() {
        return ratingWeight;
    }

    public double getAvailabilityWeight() {
        return availabilityWeight;
    }

    public double getDistanceWeight() {
        return distanceWeight;
    }

    public double getDefaultMinRating() {
        return defaultMinRating;
    }

    public double getDefaultMaxDistance() {
        return defaultMaxDistance;
    }
}
