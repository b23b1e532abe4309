package com.work.oracle.core.evaluate;

import com.work.oracle.core.config.DeadlineUnit;
import com.work.oracle.core.model.ActionType;
import com.work.oracle.core.model.Campaign;
import com.work.oracle.core.model.CampaignStatus;
import com.work.oracle.core.model.SettlementAction;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

import static com.work.oracle.core.TestCampaigns.CREATOR;
import static com.work.oracle.core.TestCampaigns.KOL;
import static com.work.oracle.core.TestCampaigns.campaign;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SettlementEvaluatorTest {

    private static final Instant NOW = Instant.ofEpochSecond(1_000);

    private final SettlementEvaluator evaluator =
            new SettlementEvaluator(new BigDecimal("0.9"), DeadlineUnit.SECONDS, true);

    @Test
    public void open_past_offer_deadline_discards_with_full_refund_to_creator() {
        SettlementAction a = evaluator.evaluate(campaign(1, CampaignStatus.OPEN, 999, 2_000, 1_000_000), NOW);

        assertEquals(ActionType.DISCARD, a.getType());
        assertEquals(CREATOR, a.getTransferTo());
        assertEquals(BigInteger.valueOf(1_000_000), a.getAmount());
    }

    @Test
    public void open_at_offer_deadline_does_nothing() {
        assertTrue(evaluator.evaluate(campaign(1, CampaignStatus.OPEN, 1_000, 2_000, 5), NOW).isNone());
        assertTrue(evaluator.evaluate(campaign(1, CampaignStatus.OPEN, 1_001, 2_000, 5), NOW).isNone());
    }

    @Test
    public void accepted_past_promotion_deadline_marks_unfulfilled_and_refunds_creator() {
        SettlementAction a = evaluator.evaluate(campaign(2, CampaignStatus.ACCEPTED, 500, 999, 1_000_000), NOW);

        assertEquals(ActionType.MARK_UNFULFILLED_AND_REFUND, a.getType());
        assertEquals(CREATOR, a.getTransferTo());
        assertEquals(BigInteger.valueOf(1_000_000), a.getAmount());
    }

    @Test
    public void accepted_before_promotion_deadline_pays_kol_the_settlement_fraction() {
        SettlementAction a = evaluator.evaluate(campaign(3, CampaignStatus.ACCEPTED, 500, 2_000, 1_000_000), NOW);

        assertEquals(ActionType.FULFIL_AND_PAY, a.getType());
        assertEquals(KOL, a.getTransferTo());
        assertEquals(BigInteger.valueOf(900_000), a.getAmount());
    }

    @Test
    public void accepted_exactly_at_promotion_deadline_still_fulfils() {
        SettlementAction a = evaluator.evaluate(campaign(3, CampaignStatus.ACCEPTED, 500, 1_000, 10), NOW);
        assertEquals(ActionType.FULFIL_AND_PAY, a.getType());
    }

    @Test
    public void accepted_waits_when_auto_fulfil_disabled() {
        SettlementEvaluator manual = new SettlementEvaluator(new BigDecimal("0.9"), DeadlineUnit.SECONDS, false);

        assertTrue(manual.evaluate(campaign(3, CampaignStatus.ACCEPTED, 500, 2_000, 10), NOW).isNone());
        assertEquals(ActionType.MARK_UNFULFILLED_AND_REFUND,
                manual.evaluate(campaign(3, CampaignStatus.ACCEPTED, 500, 999, 10), NOW).getType());
    }

    @Test
    public void terminal_statuses_never_act() {
        for (CampaignStatus s : new CampaignStatus[]{CampaignStatus.FULFILLED, CampaignStatus.UNFULFILLED, CampaignStatus.DISCARDED}) {
            assertTrue(evaluator.evaluate(campaign(4, s, 0, 0, 10), NOW).isNone(), s.name());
        }
    }

    @Test
    public void evaluation_is_pure() {
        Campaign c = campaign(5, CampaignStatus.ACCEPTED, 500, 2_000, 777);
        assertEquals(evaluator.evaluate(c, NOW), evaluator.evaluate(c, NOW));
    }

    @Test
    public void millisecond_deadlines_are_compared_in_milliseconds() {
        SettlementEvaluator ms = new SettlementEvaluator(new BigDecimal("0.9"), DeadlineUnit.MILLISECONDS, true);
        Instant now = Instant.ofEpochMilli(1_000_500);

        assertEquals(ActionType.DISCARD, ms.evaluate(campaign(6, CampaignStatus.OPEN, 1_000_499, 0, 10), now).getType());
        assertTrue(ms.evaluate(campaign(6, CampaignStatus.OPEN, 1_000_500, 0, 10), now).isNone());
    }

    @Test
    public void sub_second_now_is_floored_for_second_deadlines() {
        Instant now = Instant.ofEpochSecond(1_000, 999_000_000);
        assertTrue(evaluator.evaluate(campaign(7, CampaignStatus.OPEN, 1_000, 0, 10), now).isNone());
    }

    @Test
    public void payout_rounds_half_up_in_base_units() {
        assertEquals(BigInteger.valueOf(900_001), evaluator.payoutAmount(BigInteger.valueOf(1_000_001)));
        // 0.9 * 5 = 4.5 -> 5
        assertEquals(BigInteger.valueOf(5), evaluator.payoutAmount(BigInteger.valueOf(5)));
        assertEquals(BigInteger.ZERO, evaluator.payoutAmount(BigInteger.ZERO));
    }

    @Test
    public void transfer_after_transition_uses_fresh_snapshot() {
        Campaign fresh = new Campaign(campaign(8, CampaignStatus.FULFILLED, 0, 0, 0).getId(),
                CREATOR, "0x00000000000000000000000000000000000000b2",
                BigInteger.ZERO, BigInteger.ZERO, BigInteger.valueOf(2_000), CampaignStatus.FULFILLED);

        SettlementAction t = evaluator.transferAfterTransition(fresh, ActionType.FULFIL_AND_PAY);

        assertEquals("0x00000000000000000000000000000000000000b2", t.getTransferTo());
        assertEquals(BigInteger.valueOf(1_800), t.getAmount());
        assertThrows(IllegalArgumentException.class, () -> evaluator.transferAfterTransition(fresh, ActionType.ACCEPT));
    }

    @Test
    public void rejects_fraction_outside_unit_interval() {
        assertThrows(IllegalArgumentException.class,
                () -> new SettlementEvaluator(BigDecimal.ZERO, DeadlineUnit.SECONDS, true));
        assertThrows(IllegalArgumentException.class,
                () -> new SettlementEvaluator(new BigDecimal("1.01"), DeadlineUnit.SECONDS, true));
    }
}
