package com.phillippitts.callpilot.exception;

public class CampaignNotFoundException extends CallPilotException {

    private final String campaignId;

    public CampaignNotFoundException(String campaignId) {
        super("Unknown outreach campaign: " + campaignId);
        this.campaignId = campaignId;
    }

    public String getCampaignId() {
        return campaignId;
    }
}
