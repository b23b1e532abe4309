package com.work.oracle.core.model;

import java.math.BigInteger;

import static com.work.oracle.core.support.ValidationUtils.requireAddress;
import static com.work.oracle.core.support.ValidationUtils.requireNonNegative;
import static com.work.oracle.core.support.ValidationUtils.requireNonNull;

/**
 * 一次待签名的合约写调用（不含 nonce/gas，这两者在提交时才确定）。
 */
public class ContractCall {

    private final CallKind kind;
    private final CampaignId campaignId;
    private final String recipient;
    private final BigInteger amount;

    private ContractCall(CallKind kind, CampaignId campaignId, String recipient, BigInteger amount) {
        this.kind = kind;
        this.campaignId = campaignId;
        this.recipient = recipient;
        this.amount = amount;
    }

    /**
     * 状态迁移调用（accept/fulfil/discard/unfulfill）。
     */
    public static ContractCall transition(CallKind kind, CampaignId campaignId) {
        requireNonNull(kind, "kind");
        if (!kind.isMarketplaceCall()) {
            throw new IllegalArgumentException(kind + " 不是状态迁移调用");
        }
        return new ContractCall(kind, requireNonNull(campaignId, "campaignId"), null, null);
    }

    /**
     * 代币划转，campaignId 仅用于日志关联。
     */
    public static ContractCall transfer(CampaignId campaignId, String recipient, BigInteger amount) {
        return new ContractCall(CallKind.TRANSFER,
                campaignId,
                requireAddress(recipient, "recipient"),
                requireNonNegative(amount, "amount"));
    }

    public CallKind getKind() {
        return kind;
    }

    public CampaignId getCampaignId() {
        return campaignId;
    }

    public String getRecipient() {
        return recipient;
    }

    public BigInteger getAmount() {
        return amount;
    }

    @Override
    public String toString() {
        if (kind == CallKind.TRANSFER) {
            return kind.getFunctionName() + "(" + recipient + ", " + amount + ")";
        }
        return kind.getFunctionName() + "(" + campaignId + ")";
    }
}
