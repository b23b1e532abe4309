package com.work.oracle.core.model;

import java.time.Instant;

/**
 * 只评估不执行的结果（供运维接口预览）。
 */
public class CampaignEvaluation {

    private final Campaign snapshot;
    private final Instant evaluatedAt;
    private final SettlementAction action;

    public CampaignEvaluation(Campaign snapshot, Instant evaluatedAt, SettlementAction action) {
        this.snapshot = snapshot;
        this.evaluatedAt = evaluatedAt;
        this.action = action;
    }

    public Campaign getSnapshot() {
        return snapshot;
    }

    public Instant getEvaluatedAt() {
        return evaluatedAt;
    }

    public SettlementAction getAction() {
        return action;
    }
}
