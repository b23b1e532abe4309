package com.work.oracle.app.web.dto;

public class SettlementStatusView {

    private final String state;
    private final String account;
    private final boolean pollingEnabled;
    private final PassReportView lastPass;

    public SettlementStatusView(String state, String account, boolean pollingEnabled, PassReportView lastPass) {
        this.state = state;
        this.account = account;
        this.pollingEnabled = pollingEnabled;
        this.lastPass = lastPass;
    }

    public String getState() {
        return state;
    }

    public String getAccount() {
        return account;
    }

    public boolean isPollingEnabled() {
        return pollingEnabled;
    }

    public PassReportView getLastPass() {
        return lastPass;
    }
}
