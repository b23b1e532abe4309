package com.work.oracle.core.evaluate;

import com.work.oracle.core.config.DeadlineUnit;
import com.work.oracle.core.model.ActionType;
import com.work.oracle.core.model.Campaign;
import com.work.oracle.core.model.SettlementAction;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;

import static com.work.oracle.core.support.ValidationUtils.requireFraction;
import static com.work.oracle.core.support.ValidationUtils.requireNonNull;

/**
 * 纯函数评估器：(campaign 快照, 当前时间) -> 至多一个动作。无副作用，同样的输入永远得到同样的输出。
 * <p>
 * 规则：
 * <ul>
 *   <li>OPEN 且 now &gt; offerDeadline：discard，全额退给 creator</li>
 *   <li>ACCEPTED 且 now &gt; promotionDeadline：unfulfill，全额退给 creator</li>
 *   <li>ACCEPTED 且 now &lt;= promotionDeadline：fulfil，按结算比例付给 kol（autoFulfil=false 时等待）</li>
 *   <li>其余（含终态）：不动作</li>
 * </ul>
 * 截止时间恰好等于 now 时不动作。
 * <p>
 * 金额口径：链上金额已是代币最小单位，退款直接用原值，不再做任何 decimals 缩放；
 * 付款 = round_half_up(totalAmount * fraction)，与退款同一单位。
 */
public class SettlementEvaluator {

    private final BigDecimal settlementFraction;
    private final DeadlineUnit deadlineUnit;
    private final boolean autoFulfil;

    public SettlementEvaluator(BigDecimal settlementFraction, DeadlineUnit deadlineUnit, boolean autoFulfil) {
        this.settlementFraction = requireFraction(settlementFraction, "settlementFraction");
        this.deadlineUnit = requireNonNull(deadlineUnit, "deadlineUnit");
        this.autoFulfil = autoFulfil;
    }

    public SettlementAction evaluate(Campaign campaign, Instant now) {
        requireNonNull(campaign, "campaign");
        requireNonNull(now, "now");

        switch (campaign.getStatus()) {
            case OPEN:
                if (isPast(campaign.getOfferDeadline(), now)) {
                    return SettlementAction.discard(campaign.getId(), campaign.getCreator(), campaign.getTotalAmount());
                }
                return SettlementAction.none();
            case ACCEPTED:
                if (isPast(campaign.getPromotionDeadline(), now)) {
                    return SettlementAction.markUnfulfilledAndRefund(
                            campaign.getId(), campaign.getCreator(), campaign.getTotalAmount());
                }
                if (!autoFulfil) {
                    return SettlementAction.none();
                }
                return SettlementAction.fulfilAndPay(campaign.getId(), campaign.getKol(), payoutAmount(campaign.getTotalAmount()));
            case FULFILLED:
            case UNFULFILLED:
            case DISCARDED:
            default:
                return SettlementAction.none();
        }
    }

    /**
     * 状态迁移已确认后，基于重新读取的快照推导资金划转（收款方与金额），
     * 不使用迁移前捕获的值。
     */
    public SettlementAction transferAfterTransition(Campaign fresh, ActionType type) {
        requireNonNull(fresh, "fresh");
        requireNonNull(type, "type");
        switch (type) {
            case DISCARD:
                return SettlementAction.discard(fresh.getId(), fresh.getCreator(), fresh.getTotalAmount());
            case MARK_UNFULFILLED_AND_REFUND:
                return SettlementAction.markUnfulfilledAndRefund(fresh.getId(), fresh.getCreator(), fresh.getTotalAmount());
            case FULFIL_AND_PAY:
                return SettlementAction.fulfilAndPay(fresh.getId(), fresh.getKol(), payoutAmount(fresh.getTotalAmount()));
            default:
                throw new IllegalArgumentException(type + " 不涉及资金划转");
        }
    }

    /**
     * kol 应得金额：round_half_up(totalAmount * fraction)，单位与 totalAmount 相同。
     */
    public BigInteger payoutAmount(BigInteger totalAmount) {
        requireNonNull(totalAmount, "totalAmount");
        return new BigDecimal(totalAmount)
                .multiply(settlementFraction)
                .setScale(0, RoundingMode.HALF_UP)
                .toBigIntegerExact();
    }

    /**
     * now 先按截止时间的单位向下取整，再做严格大于比较。
     */
    private boolean isPast(BigInteger deadline, Instant now) {
        return deadlineUnit.fromInstant(now).compareTo(deadline) > 0;
    }
}
