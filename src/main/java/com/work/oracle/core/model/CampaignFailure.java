package com.work.oracle.core.model;

import com.work.oracle.core.exception.ErrorKind;

/**
 * 单轮中某个 campaign 的失败记录。snapshot 可能为 null（读取阶段即失败）。
 */
public class CampaignFailure {

    private final CampaignId campaignId;
    private final ErrorKind kind;
    private final String message;
    private final Campaign snapshot;

    public CampaignFailure(CampaignId campaignId, ErrorKind kind, String message, Campaign snapshot) {
        this.campaignId = campaignId;
        this.kind = kind;
        this.message = message;
        this.snapshot = snapshot;
    }

    public CampaignId getCampaignId() {
        return campaignId;
    }

    /**
     * 未归类的异常为 null。
     */
    public ErrorKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public Campaign getSnapshot() {
        return snapshot;
    }
}
