package com.work.oracle.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * 一轮轮询的汇总。skipped=true 表示上一轮尚未结束，本次未执行。
 */
public class PassReport {

    private final Instant startedAt;
    private final Instant finishedAt;
    private final int campaignCount;
    private final List<SettlementOutcome> executed;
    private final List<CampaignFailure> failures;
    private final boolean skipped;

    public PassReport(Instant startedAt,
                      Instant finishedAt,
                      int campaignCount,
                      List<SettlementOutcome> executed,
                      List<CampaignFailure> failures) {
        this(startedAt, finishedAt, campaignCount, executed, failures, false);
    }

    private PassReport(Instant startedAt,
                       Instant finishedAt,
                       int campaignCount,
                       List<SettlementOutcome> executed,
                       List<CampaignFailure> failures,
                       boolean skipped) {
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.campaignCount = campaignCount;
        this.executed = executed == null ? Collections.emptyList() : Collections.unmodifiableList(executed);
        this.failures = failures == null ? Collections.emptyList() : Collections.unmodifiableList(failures);
        this.skipped = skipped;
    }

    public static PassReport skipped(Instant at) {
        return new PassReport(at, at, 0, null, null, true);
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public int getCampaignCount() {
        return campaignCount;
    }

    public List<SettlementOutcome> getExecuted() {
        return executed;
    }

    public List<CampaignFailure> getFailures() {
        return failures;
    }

    public boolean isSkipped() {
        return skipped;
    }
}
