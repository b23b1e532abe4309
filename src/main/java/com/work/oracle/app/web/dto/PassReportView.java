package com.work.oracle.app.web.dto;

import com.work.oracle.core.model.CampaignFailure;
import com.work.oracle.core.model.PassReport;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class PassReportView {

    /**
     * 单个 campaign 的失败摘要
     */
    public static class FailureView {
        private final String campaignId;
        private final String kind;
        private final String message;

        FailureView(CampaignFailure f) {
            this.campaignId = f.getCampaignId().toString();
            this.kind = f.getKind() == null ? null : f.getKind().name();
            this.message = f.getMessage();
        }

        public String getCampaignId() {
            return campaignId;
        }

        public String getKind() {
            return kind;
        }

        public String getMessage() {
            return message;
        }
    }

    private final Instant startedAt;
    private final Instant finishedAt;
    private final int campaignCount;
    private final List<OutcomeView> executed = new ArrayList<>();
    private final List<FailureView> failures = new ArrayList<>();

    private PassReportView(PassReport report) {
        this.startedAt = report.getStartedAt();
        this.finishedAt = report.getFinishedAt();
        this.campaignCount = report.getCampaignCount();
        report.getExecuted().forEach(o -> executed.add(OutcomeView.of(o)));
        report.getFailures().forEach(f -> failures.add(new FailureView(f)));
    }

    public static PassReportView of(PassReport report) {
        return report == null ? null : new PassReportView(report);
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

    public List<OutcomeView> getExecuted() {
        return executed;
    }

    public List<FailureView> getFailures() {
        return failures;
    }
}
