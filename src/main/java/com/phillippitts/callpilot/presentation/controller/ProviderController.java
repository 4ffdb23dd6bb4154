package com.phillippitts.callpilot.presentation.controller;

import com.phillippitts.callpilot.presentation.dto.ScoredProviderView;
import com.phillippitts.callpilot.service.dispatch.OutreachService;
import com.phillippitts.callpilot.service.ranking.ProviderFilter;
import com.phillippitts.callpilot.service.ranking.RankingPreferences;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Ranked provider listing. Without query parameters the whole directory is ranked; with either
 * parameter the preference filter runs first, the missing one taking its default.
 */
@RestController
@RequestMapping("/api/providers")
class ProviderController {

    private final OutreachService outreachService;
    private final ProviderFilter filter;

    ProviderController(OutreachService outreachService, ProviderFilter filter) {
        this.outreachService = outreachService;
        this.filter = filter;
    }

    @GetMapping("/ranked")
    List<ScoredProviderView> ranked(@RequestParam(required = false) Double minRating,
                                    @RequestParam(required = false) Double maxDistance) {
        RankingPreferences preferences = minRating == null && maxDistance == null
                ? null : filter.resolve(minRating, maxDistance);
        return outreachService.rankProviders(preferences).stream()
                .map(ScoredProviderView::from)
                .toList();
    }
}
