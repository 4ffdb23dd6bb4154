package com.phillippitts.callpilot.service.ranking;

import com.phillippitts.callpilot.config.properties.RankingProperties;
import com.phillippitts.callpilot.domain.Provider;
import com.phillippitts.callpilot.domain.ScoredProvider;
import com.phillippitts.callpilot.exception.InvalidProviderException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Ranks providers by a weighted sum of min-max normalized rating, availability and inverted
 * distance.
 *
 * <p><b>Normalization:</b> each factor is scaled to [0, 1] over the input list. Distance is
 * inverted so the closest provider scores 1. When every provider shares the same value for a
 * factor, that factor contributes 1.0 for all of them.
 *
 * <p><b>Ordering:</b> descending score. Scores that round to the same multiple of
 * {@value #TIE_EPSILON} are ties and are ordered by ascending distance, then by provider id.
 *
 * <p>Stateless and thread-safe.
 */
@Service
public class WeightedProviderRanker implements ProviderRanker {

    private static final Logger LOG = LogManager.getLogger(WeightedProviderRanker.class);

    static final double TIE_EPSILON = 1e-9;
    private static final double MAX_RATING = 5.0;

    private final double ratingWeight;
    private final double availabilityWeight;
    private final double distanceWeight;

    public WeightedProviderRanker(RankingProperties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        this.ratingWeight = properties.getRatingWeight();
        this.availabilityWeight = properties.getAvailabilityWeight();
        this.distanceWeight = properties.getDistanceWeight();
    }

    @Override
    public List<ScoredProvider> rank(List<Provider> providers) {
        Objects.requireNonNull(providers, "providers must not be null");
        if (providers.isEmpty()) {
            return List.of();
        }
        providers.forEach(WeightedProviderRanker::validate);

        Range rating = Range.of(providers, Provider::rating);
        Range availability = Range.of(providers, Provider::availability);
        Range distance = Range.of(providers, Provider::distanceMiles);

        List<Unranked> scored = new ArrayList<>(providers.size());
        for (Provider p : providers) {
            double score = ratingWeight * rating.normalize(p.rating())
                    + availabilityWeight * availability.normalize(p.availability())
                    + distanceWeight * (distance.isDegenerate() ? 1.0 : 1.0 - distance.normalize(p.distanceMiles()));
            scored.add(new Unranked(p, score));
        }
        scored.sort(ORDER);

        List<ScoredProvider> ranked = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            Unranked u = scored.get(i);
            ranked.add(new ScoredProvider(u.provider(), u.score(), i + 1));
        }
        if (LOG.isDebugEnabled()) {
            ScoredProvider top = ranked.get(0);
            LOG.debug("Ranked {} providers; top={} (score={})",
                    ranked.size(), top.provider().id(), String.format("%.4f", top.score()));
        }
        return List.copyOf(ranked);
    }

    // Scores are compared by their 1e-9 bucket so that "tied" stays transitive.
    private static final Comparator<Unranked> ORDER = (a, b) -> {
        int byScore = Long.compare(scoreBucket(b.score()), scoreBucket(a.score()));
        if (byScore != 0) {
            return byScore;
        }
        int byDistance = Double.compare(a.provider().distanceMiles(), b.provider().distanceMiles());
        if (byDistance != 0) {
            return byDistance;
        }
        return a.provider().id().compareTo(b.provider().id());
    };

    static long scoreBucket(double score) {
        return Math.round(score / TIE_EPSILON);
    }

    static void validate(Provider p) {
        Double rating = p.rating();
        if (rating == null) {
            throw new InvalidProviderException(p.id(), "rating", "missing");
        }
        if (!Double.isFinite(rating) || rating < 0 || rating > MAX_RATING) {
            throw new InvalidProviderException(p.id(), "rating", "must be within [0, 5], got " + rating);
        }
        Double distance = p.distanceMiles();
        if (distance == null) {
            throw new InvalidProviderException(p.id(), "distance", "missing");
        }
        if (!Double.isFinite(distance) || distance < 0) {
            throw new InvalidProviderException(p.id(), "distance", "must be a finite value >= 0, got " + distance);
        }
        Double availability = p.availability();
        if (availability == null) {
            throw new InvalidProviderException(p.id(), "availability", "missing");
        }
        if (!Double.isFinite(availability) || availability < 0 || availability > 1) {
            throw new InvalidProviderException(p.id(), "availability", "must be within [0, 1], got " + availability);
        }
    }

    private record Unranked(Provider provider, double score) { }

    /** Min and max of one factor over the input list. */
    private record Range(double min, double max) {

        static Range of(List<Provider> providers, Function<Provider, Double> factor) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (Provider p : providers) {
                double v = factor.apply(p);
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            return new Range(min, max);
        }

        boolean isDegenerate() {
            return max - min == 0.0;
        }

        double normalize(double value) {
            return isDegenerate() ? 1.0 : (value - min) / (max - min);
        }
    }
}
