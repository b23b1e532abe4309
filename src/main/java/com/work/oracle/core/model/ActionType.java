package com.work.oracle.core.model;

/**
 * 评估结果的类型。每种需要执行的类型都绑定一次状态迁移调用及其期望的迁移后状态。
 */
public enum ActionType {
    NONE(null, null, false),
    DISCARD(CallKind.DISCARD_CAMPAIGN, CampaignStatus.DISCARDED, true),
    FULFIL_AND_PAY(CallKind.FULFIL_PROJECT_CAMPAIGN, CampaignStatus.FULFILLED, true),
    MARK_UNFULFILLED_AND_REFUND(CallKind.UNFULFILL_CAMPAIGN, CampaignStatus.UNFULFILLED, true),
    ACCEPT(CallKind.ACCEPT_PROJECT_CAMPAIGN, CampaignStatus.ACCEPTED, false);

    private final CallKind transition;
    private final CampaignStatus targetStatus;
    private final boolean transfersFunds;

    ActionType(CallKind transition, CampaignStatus targetStatus, boolean transfersFunds) {
        this.transition = transition;
        this.targetStatus = targetStatus;
        this.transfersFunds = transfersFunds;
    }

    public CallKind getTransition() {
        return transition;
    }

    public CampaignStatus getTargetStatus() {
        return targetStatus;
    }

    public boolean transfersFunds() {
        return transfersFunds;
    }
}
