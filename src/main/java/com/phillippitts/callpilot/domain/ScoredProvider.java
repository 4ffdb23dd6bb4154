package com.phillippitts.callpilot.domain;

import java.util.Objects;

/**
 * A provider together with its computed ranking score and 1-based rank position.
 *
 * @param provider the ranked provider (never null)
 * @param score    weighted score in [0, 1]
 * @param rank     position in the ranked list, starting at 1
 */
public record ScoredProvider(Provider provider, double score, int rank) {

    public ScoredProvider {
        Objects.requireNonNull(provider, "provider must not be null");
        if (rank < 1) {
            throw new IllegalArgumentException("rank must be >= 1, got: " + rank);
        }
    }
}
