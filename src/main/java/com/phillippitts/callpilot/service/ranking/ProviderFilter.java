package com.phillippitts.callpilot.service.ranking;

import com.phillippitts.callpilot.config.properties.RankingProperties;
import com.phillippitts.callpilot.domain.Provider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Applies rating and distance preferences to a provider list.
 *
 * <p>Providers that lack the value being compared are kept, so the ranker can reject them as
 * invalid instead of having them silently disappear.
 */
@Component
public class ProviderFilter {

    private static final Logger LOG = LogManager.getLogger(ProviderFilter.class);

    private final RankingPreferences defaults;

    public ProviderFilter(RankingProperties properties) {
        this.defaults = new RankingPreferences(properties.getDefaultMinRating(), properties.getDefaultMaxDistance());
    }

    public RankingPreferences defaults() {
        return defaults;
    }

    /**
     * Fills in missing preference values from the configured defaults.
     */
    public RankingPreferences resolve(Double minRating, Double maxDistance) {
        return new RankingPreferences(
                minRating == null ? defaults.minRating() : minRating,
                maxDistance == null ? defaults.maxDistance() : maxDistance);
    }

    public List<Provider> apply(List<Provider> providers, RankingPreferences preferences) {
        Objects.requireNonNull(providers, "providers must not be null");
        Objects.requireNonNull(preferences, "preferences must not be null");
        List<Provider> kept = providers.stream()
                .filter(p -> p.rating() == null || p.rating() >= preferences.minRating())
                .filter(p -> p.distanceMiles() == null || p.distanceMiles() <= preferences.maxDistance())
                .toList();
        LOG.debug("Preference filter kept {}/{} providers (minRating={}, maxDistance={})",
                kept.size(), providers.size(), preferences.minRating(), preferences.maxDistance());
        return kept;
    }
}
