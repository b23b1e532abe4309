package com.work.oracle.core.model;

import java.math.BigInteger;
import java.util.Objects;

import static com.work.oracle.core.support.ValidationUtils.requireAddress;
import static com.work.oracle.core.support.ValidationUtils.requireNonNegative;
import static com.work.oracle.core.support.ValidationUtils.requireNonNull;

/**
 * 评估器输出：至多一个动作，外加可选的资金划转。只在单轮编排内存活，不持久化。
 */
public class SettlementAction {

    private static final SettlementAction NONE = new SettlementAction(ActionType.NONE, null, null, null);

    private final ActionType type;
    private final CampaignId campaignId;
    private final String transferTo;
    private final BigInteger amount;

    private SettlementAction(ActionType type, CampaignId campaignId, String transferTo, BigInteger amount) {
        this.type = type;
        this.campaignId = campaignId;
        this.transferTo = transferTo;
        this.amount = amount;
    }

    public static SettlementAction none() {
        return NONE;
    }

    public static SettlementAction discard(CampaignId campaignId, String creator, BigInteger amount) {
        return withTransfer(ActionType.DISCARD, campaignId, creator, amount);
    }

    public static SettlementAction fulfilAndPay(CampaignId campaignId, String kol, BigInteger amount) {
        return withTransfer(ActionType.FULFIL_AND_PAY, campaignId, kol, amount);
    }

    public static SettlementAction markUnfulfilledAndRefund(CampaignId campaignId, String creator, BigInteger amount) {
        return withTransfer(ActionType.MARK_UNFULFILLED_AND_REFUND, campaignId, creator, amount);
    }

    /**
     * 管理操作：不由轮询自动触发。
     */
    public static SettlementAction accept(CampaignId campaignId) {
        return new SettlementAction(ActionType.ACCEPT, requireNonNull(campaignId, "campaignId"), null, null);
    }

    private static SettlementAction withTransfer(ActionType type, CampaignId campaignId, String to, BigInteger amount) {
        return new SettlementAction(type,
                requireNonNull(campaignId, "campaignId"),
                requireAddress(to, "transferTo"),
                requireNonNegative(amount, "amount"));
    }

    public ActionType getType() {
        return type;
    }

    public boolean isNone() {
        return type == ActionType.NONE;
    }

    public CampaignId getCampaignId() {
        return campaignId;
    }

    public String getTransferTo() {
        return transferTo;
    }

    public BigInteger getAmount() {
        return amount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SettlementAction)) return false;
        SettlementAction that = (SettlementAction) o;
        return type == that.type
                && Objects.equals(campaignId, that.campaignId)
                && Objects.equals(transferTo, that.transferTo)
                && Objects.equals(amount, that.amount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, campaignId, transferTo, amount);
    }

    @Override
    public String toString() {
        if (isNone()) {
            return "SettlementAction{NONE}";
        }
        return "SettlementAction{type=" + type
                + ", campaignId=" + campaignId
                + (transferTo == null ? "" : ", transferTo=" + transferTo + ", amount=" + amount)
                + '}';
    }
}
