package com.work.oracle.app.web.dto;

import com.work.oracle.core.model.Campaign;

public class CampaignView {

    private final String campaignId;
    private final String status;
    private final String creator;
    private final String kol;
    private final String offerDeadline;
    private final String promotionDeadline;
    private final String totalAmount;

    private CampaignView(Campaign c) {
        this.campaignId = c.getId().toString();
        this.status = c.getStatus().name();
        this.creator = c.getCreator();
        this.kol = c.getKol();
        this.offerDeadline = c.getOfferDeadline().toString();
        this.promotionDeadline = c.getPromotionDeadline().toString();
        this.totalAmount = c.getTotalAmount().toString();
    }

    public static CampaignView of(Campaign campaign) {
        return campaign == null ? null : new CampaignView(campaign);
    }

    public String getCampaignId() {
        return campaignId;
    }

    public String getStatus() {
        return status;
    }

    public String getCreator() {
        return creator;
    }

    public String getKol() {
        return kol;
    }

    public String getOfferDeadline() {
        return offerDeadline;
    }

    public String getPromotionDeadline() {
        return promotionDeadline;
    }

    public String getTotalAmount() {
        return totalAmount;
    }
}
