package com.work.oracle.app.web.dto;

import com.work.oracle.core.model.SettlementOutcome;
import com.work.oracle.core.model.TxReceipt;

public class OutcomeView {

    private final String campaignId;
    private final String action;
    private final String transitionTxHash;
    private final String transferTxHash;

    private OutcomeView(SettlementOutcome o) {
        this.campaignId = o.getCampaignId().toString();
        this.action = o.getActionType().name();
        this.transitionTxHash = hashOf(o.getTransitionReceipt());
        this.transferTxHash = hashOf(o.getTransferReceipt());
    }

    public static OutcomeView of(SettlementOutcome outcome) {
        return new OutcomeView(outcome);
    }

    private static String hashOf(TxReceipt receipt) {
        return receipt == null ? null : receipt.getTxHash();
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

    public String getTransferTxHash() {
        return transferTxHash;
    }
}
