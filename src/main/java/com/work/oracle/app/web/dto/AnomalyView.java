package com.work.oracle.app.web.dto;

import com.work.oracle.core.model.SettlementAnomaly;

import java.time.Instant;

public class AnomalyView {

    private final String campaignId;
    private final String action;
    private final String transitionTxHash;
    private final String intendedRecipient;
    private final String intendedAmount;
    private final String reason;
    private final Instant recordedAt;

    private AnomalyView(SettlementAnomaly a) {
        this.campaignId = a.getCampaignId().toString();
        this.action = a.getActionType().name();
        this.transitionTxHash = a.getTransitionTxHash();
        this.intendedRecipient = a.getIntendedRecipient();
        this.intendedAmount = a.getIntendedAmount();
        this.reason = a.getReason();
        this.recordedAt = a.getRecordedAt();
    }

    public static AnomalyView of(SettlementAnomaly anomaly) {
        return new AnomalyView(anomaly);
    }

    public String getCampaignId() {
        return campaignId;
    }

    public String getAction() {
        return action;
    }

    public String getTransitionTxHash() {
        return transitionTxHash;
    }

    public String getIntendedRecipient() {
        return intendedRecipient;
    }

    public String getIntendedAmount() {
        return intendedAmount;
    }

    public String getReason() {
        return reason;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }
}
