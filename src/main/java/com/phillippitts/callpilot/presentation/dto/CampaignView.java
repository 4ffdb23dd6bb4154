package com.phillippitts.callpilot.presentation.dto;

import com.phillippitts.callpilot.domain.CallSessionHandle;
import com.phillippitts.callpilot.domain.OutreachCampaign;

import java.time.Instant;
import java.util.List;

/**
 * A campaign with a snapshot of each session's progress.
 */
public record CampaignView(
        String campaignId,
        OutreachCampaign.Mode mode,
        String objective,
        Instant createdAt,
        List<CallSessionHandle> sessions
) {

    public static CampaignView from(OutreachCampaign campaign) {
        return new CampaignView(campaign.id(), campaign.mode(), campaign.objective(), campaign.createdAt(),
                campaign.handles());
    }
}
