package com.work.oracle.app.web.dto;

import com.work.oracle.core.model.CampaignEvaluation;
import com.work.oracle.core.model.SettlementAction;

import java.time.Instant;

/**
 * 只读评估结果：快照 + 评估时刻 + 将要执行的动作（不执行）。
 */
public class EvaluationView {

    private final CampaignView campaign;
    private final Instant evaluatedAt;
    private final String action;
    private final String transferTo;
    private final String amount;

    private EvaluationView(CampaignEvaluation e) {
        SettlementAction a = e.getAction();
        this.campaign = CampaignView.of(e.getSnapshot());
        this.evaluatedAt = e.getEvaluatedAt();
        this.action = a.getType().name();
        this.transferTo = a.getTransferTo();
        this.amount = a.getAmount() == null ? null : a.getAmount().toString();
    }

    public static EvaluationView of(CampaignEvaluation evaluation) {
        return new EvaluationView(evaluation);
    }

    public CampaignView getCampaign() {
        return campaign;
    }

    public Instant getEvaluatedAt() {
        return evaluatedAt;
    }

    public String getAction() {
        return action;
    }

    public String getTransferTo() {
        return transferTo;
    }

    public String getAmount() {
        return amount;
    }
}
