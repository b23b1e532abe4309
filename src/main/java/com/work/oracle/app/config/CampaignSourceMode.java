package com.work.oracle.app.config;

/**
 * campaign id 的来源。
 */
public enum CampaignSourceMode {

    /**
     * 合约 getAllCampaigns()
     */
    CHAIN,

    /**
     * 外部登记处 GET /get-all-campaigns
     */
    REGISTRY
}
