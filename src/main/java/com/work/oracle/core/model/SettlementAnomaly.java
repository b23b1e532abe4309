package com.work.oracle.core.model;

import java.time.Instant;

/**
 * 部分执行的结算：状态迁移已上链，资金划转未完成。只能人工对账，无法本地回滚。
 */
public class SettlementAnomaly {

    private final CampaignId campaignId;
    private final ActionType actionType;
    private final String transitionTxHash;
    private final String intendedRecipient;
    private final String intendedAmount;
    private final String reason;
    private final Instant recordedAt;

    public SettlementAnomaly(CampaignId campaignId,
                             ActionType actionType,
                             String transitionTxHash,
                             String intendedRecipient,
                             String intendedAmount,
                             String reason,
                             Instant recordedAt) {
        this.campaignId = campaignId;
        this.actionType = actionType;
        this.transitionTxHash = transitionTxHash;
        this.intendedRecipient = intendedRecipient;
        this.intendedAmount = intendedAmount;
        this.reason = reason;
        this.recordedAt = recordedAt;
    }

    public CampaignId getCampaignId() {
        return campaignId;
    }

    public ActionType getActionType() {
        return actionType;
    }

    public String getTransitionTxHash() {
        return transitionTxHash;
    }

    /**
     * 未能确定时为 null（例如迁移后重读快照失败）。
     */
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

    @Override
    public String toString() {
        return "SettlementAnomaly{campaignId=" + campaignId
                + ", actionType=" + actionType
                + ", transitionTxHash=" + transitionTxHash
                + ", intendedRecipient=" + intendedRecipient
                + ", intendedAmount=" + intendedAmount
                + ", reason=" + reason
                + '}';
    }
}
