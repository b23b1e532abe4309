package com.work.oracle.core.anomaly;

import com.work.oracle.core.model.SettlementAnomaly;

import java.util.List;

/**
 * 部分结算的记录处，供人工对账。
 */
public interface AnomalyJournal {

    void record(SettlementAnomaly anomaly);

    /**
     * 按记录时间倒序返回最近的若干条。
     */
    List<SettlementAnomaly> recent(int limit);
}
