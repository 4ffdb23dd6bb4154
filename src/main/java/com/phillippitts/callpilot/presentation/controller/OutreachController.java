package com.phillippitts.callpilot.presentation.controller;

import com.phillippitts.callpilot.presentation.dto.CampaignView;
import com.phillippitts.callpilot.presentation.dto.SoloOutreachRequest;
import com.phillippitts.callpilot.presentation.dto.SwarmOutreachRequest;
import com.phillippitts.callpilot.service.dispatch.OutreachService;
import com.phillippitts.callpilot.service.ranking.ProviderFilter;
import com.phillippitts.callpilot.service.ranking.RankingPreferences;
import com.phillippitts.callpilot.util.LogSanitizer;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Solo and swarm dispatch commands and campaign progress.
 */
@RestController
@RequestMapping("/api/outreach")
class OutreachController {

    private static final Logger LOG = LogManager.getLogger(OutreachController.class);

    private final OutreachService outreachService;
    private final ProviderFilter filter;

    OutreachController(OutreachService outreachService, ProviderFilter filter) {
        this.outreachService = outreachService;
        this.filter = filter;
    }

    @PostMapping("/solo")
    CampaignView solo(@Valid @RequestBody SoloOutreachRequest request) {
        LOG.info("Solo outreach requested to {}", LogSanitizer.maskPhone(request.phoneNumber()));
        return CampaignView.from(outreachService.startSolo(request.phoneNumber(), request.objective()));
    }

    @PostMapping("/swarm")
    CampaignView swarm(@Valid @RequestBody SwarmOutreachRequest request) {
        LOG.info("Swarm outreach requested for {}", LogSanitizer.maskPhone(request.userPhone()));
        SwarmOutreachRequest.Preferences prefs = request.preferences();
        RankingPreferences ranking = prefs == null ? null : filter.resolve(prefs.minRating(), prefs.maxDistance());
        String preferredTime = prefs == null ? null : prefs.preferredTime();
        return CampaignView.from(
                outreachService.startSwarm(request.userPhone(), request.objective(), ranking, preferredTime));
    }

    @GetMapping("/{campaignId}")
    CampaignView campaign(@PathVariable String campaignId) {
        return CampaignView.from(outreachService.getCampaign(campaignId));
    }
}
