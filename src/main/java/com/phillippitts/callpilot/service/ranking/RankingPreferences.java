package com.phillippitts.callpilot.service.ranking;

/**
 * User preferences applied before a swarm is ranked.
 *
 * @param minRating   lowest acceptable rating
 * @param maxDistance farthest acceptable distance in miles
 */
public record RankingPreferences(double minRating, double maxDistance) {

    public RankingPreferences {
        if (Double.isNaN(minRating) || Double.isNaN(maxDistance)) {
            throw new IllegalArgumentException("preferences must be numbers");
        }
    }
}
