package com.work.oracle.core.model;

/**
 * 合约侧 campaign 状态。顺序与合约枚举一致（OPEN=0 ... DISCARDED=4），不可调整。
 * <p>
 * 状态只由合约推进，本系统只“请求”迁移。
 */
public enum CampaignStatus {
    OPEN,
    ACCEPTED,
    FULFILLED,
    UNFULFILLED,
    DISCARDED;

    public boolean isTerminal() {
        return this == FULFILLED || this == UNFULFILLED || this == DISCARDED;
    }

    public static CampaignStatus fromOrdinal(int ordinal) {
        CampaignStatus[] values = values();
        if (ordinal < 0 || ordinal >= values.length) {
            throw new IllegalArgumentException("unknown campaign status ordinal: " + ordinal);
        }
        return values[ordinal];
    }
}
