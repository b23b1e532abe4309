package com.work.oracle.core.model;

/**
 * 单个 campaign 动作执行完成后的结果。
 */
public class SettlementOutcome {

    private final CampaignId campaignId;
    private final ActionType actionType;
    private final TxReceipt transitionReceipt;
    private final TxReceipt transferReceipt;

    public SettlementOutcome(CampaignId campaignId,
                             ActionType actionType,
                             TxReceipt transitionReceipt,
                             TxReceipt transferReceipt) {
        this.campaignId = campaignId;
        this.actionType = actionType;
        this.transitionReceipt = transitionReceipt;
        this.transferReceipt = transferReceipt;
    }

    public static SettlementOutcome skipped(CampaignId campaignId) {
        return new SettlementOutcome(campaignId, ActionType.NONE, null, null);
    }

    public CampaignId getCampaignId() {
        return campaignId;
    }

    public ActionType getActionType() {
        return actionType;
    }

    public TxReceipt getTransitionReceipt() {
        return transitionReceipt;
    }

    /**
     * 无资金划转的动作（ACCEPT）返回 null。
     */
    public TxReceipt getTransferReceipt() {
        return transferReceipt;
    }

    public boolean isExecuted() {
        return actionType != ActionType.NONE;
    }
}
