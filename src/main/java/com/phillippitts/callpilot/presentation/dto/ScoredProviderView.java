package com.phillippitts.callpilot.presentation.dto;

import com.phillippitts.callpilot.domain.Provider;
import com.phillippitts.callpilot.domain.ScoredProvider;

/**
 * One row of the ranked provider listing.
 */
public record ScoredProviderView(
        int rank,
        double score,
        String id,
        String name,
        String phone,
        Double distanceMiles,
        Double rating,
        Double availability,
        String specialty,
        Provider.Coordinates coordinates
) {

    public static ScoredProviderView from(ScoredProvider sp) {
        Provider p = sp.provider();
        return new ScoredProviderView(sp.rank(), sp.score(), p.id(), p.name(), p.phone(), p.distanceMiles(),
                p.rating(), p.availability(), p.specialty(), p.coordinates());
    }
}
