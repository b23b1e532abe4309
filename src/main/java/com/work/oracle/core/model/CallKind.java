package com.work.oracle.core.model;

/**
 * 本系统会发出的合约写调用。
 */
public enum CallKind {
    ACCEPT_PROJECT_CAMPAIGN("acceptProjectCampaign", true),
    FULFIL_PROJECT_CAMPAIGN("fulfilProjectCampaign", true),
    DISCARD_CAMPAIGN("discardCampaign", true),
    UNFULFILL_CAMPAIGN("unfulfillCampaign", true),
    TRANSFER("transfer", false);

    private final String functionName;
    private final boolean marketplaceCall;

    CallKind(String functionName, boolean marketplaceCall) {
        this.functionName = functionName;
        this.marketplaceCall = marketplaceCall;
    }

    public String getFunctionName() {
        return functionName;
    }

    /**
     * true: 发往 marketplace 合约；false: 发往结算代币合约。
     */
    public boolean isMarketplaceCall() {
        return marketplaceCall;
    }
}
