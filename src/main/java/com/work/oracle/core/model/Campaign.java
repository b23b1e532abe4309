package com.work.oracle.core.model;

import java.math.BigInteger;
import java.util.Objects;

import static com.work.oracle.core.support.ValidationUtils.requireNonNegative;
import static com.work.oracle.core.support.ValidationUtils.requireNonNull;

/**
 * 每轮从链上读取的 campaign 只读快照，不跨轮缓存。
 * <p>
 * 截止时间保持链上原始数值，单位由配置决定（见 DeadlineUnit），比较前统一换算。
 * totalAmount 为结算代币最小单位下的整数。
 */
public class Campaign {

    private final CampaignId id;
    private final String creator;
    private final String kol;
    private final BigInteger offerDeadline;
    private final BigInteger promotionDeadline;
    private final BigInteger totalAmount;
    private final CampaignStatus status;

    public Campaign(CampaignId id,
                    String creator,
                    String kol,
                    BigInteger offerDeadline,
                    BigInteger promotionDeadline,
                    BigInteger totalAmount,
                    CampaignStatus status) {
        this.id = requireNonNull(id, "id");
        this.creator = requireNonNull(creator, "creator");
        this.kol = requireNonNull(kol, "kol");
        this.offerDeadline = requireNonNegative(offerDeadline, "offerDeadline");
        this.promotionDeadline = requireNonNegative(promotionDeadline, "promotionDeadline");
        this.totalAmount = requireNonNegative(totalAmount, "totalAmount");
        this.status = requireNonNull(status, "status");
    }

    public CampaignId getId() {
        return id;
    }

    public String getCreator() {
        return creator;
    }

    public String getKol() {
        return kol;
    }

    public BigInteger getOfferDeadline() {
        return offerDeadline;
    }

    public BigInteger getPromotionDeadline() {
        return promotionDeadline;
    }

    public BigInteger getTotalAmount() {
        return totalAmount;
    }

    public CampaignStatus getStatus() {
        return status;
    }

    /**
     * 复制一份仅状态不同的快照（供内存链模拟合约状态迁移）。
     */
    public Campaign withStatus(CampaignStatus newStatus) {
        return new Campaign(id, creator, kol, offerDeadline, promotionDeadline, totalAmount, newStatus);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Campaign)) return false;
        Campaign that = (Campaign) o;
        return id.equals(that.id)
                && creator.equalsIgnoreCase(that.creator)
                && kol.equalsIgnoreCase(that.kol)
                && offerDeadline.equals(that.offerDeadline)
                && promotionDeadline.equals(that.promotionDeadline)
                && totalAmount.equals(that.totalAmount)
                && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, offerDeadline, promotionDeadline, totalAmount, status);
    }

    @Override
    public String toString() {
        return "Campaign{id=" + id
                + ", status=" + status
                + ", creator=" + creator
                + ", kol=" + kol
                + ", offerDeadline=" + offerDeadline
                + ", promotionDeadline=" + promotionDeadline
                + ", totalAmount=" + totalAmount
                + '}';
    }
}
