package com.work.oracle.app.registry.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class CampaignUpdateRequest {

    @JsonProperty("campaign_id")
    private String campaignId;

    private String status;

    public CampaignUpdateRequest() {
    }

    public CampaignUpdateRequest(String campaignId, String status) {
        this.campaignId = campaignId;
        this.status = status;
    }

    public String getCampaignId() {
        return campaignId;
    }

    public void setCampaignId(String campaignId) {
        this.campaignId = campaignId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }
}
