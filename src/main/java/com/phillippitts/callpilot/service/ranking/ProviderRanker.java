package com.phillippitts.callpilot.service.ranking;

import com.phillippitts.callpilot.domain.Provider;
import com.phillippitts.callpilot.domain.ScoredProvider;

import java.util.List;

/**
 * Orders providers by a weighted score.
 *
 * <p>Implementations must be pure and deterministic: identical input yields identical output,
 * including the order of tied providers. The result is a permutation of the input; nothing is
 * dropped or added.
 */
public interface ProviderRanker {

    /**
     * Ranks providers by descending score.
     *
     * @param providers providers to rank (may be empty, never null)
     * @return scored providers with 1-based ranks, best first
     * @throws com.phillippitts.callpilot.exception.InvalidProviderException if any provider has
     *         a missing or out-of-range rating, distance or availability
     */
    List<ScoredProvider> rank(List<Provider> providers);
}
