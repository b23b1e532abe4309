package com.work.oracle.core.anomaly;

import com.work.oracle.core.model.SettlementAnomaly;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

import static com.work.oracle.core.support.ValidationUtils.requireNonNull;

/**
 * 有界内存实现：超过容量丢弃最旧的记录（日志中仍有 ERROR 级别的完整信息）。
 */
public class InMemoryAnomalyJournal implements AnomalyJournal {

    private final int capacity;
    private final Deque<SettlementAnomaly> entries = new ArrayDeque<>();

    public InMemoryAnomalyJournal(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity 必须大于0");
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void record(SettlementAnomaly anomaly) {
        requireNonNull(anomaly, "anomaly");
        entries.addFirst(anomaly);
        while (entries.size() > capacity) {
            entries.removeLast();
        }
    }

    @Override
    public synchronized List<SettlementAnomaly> recent(int limit) {
        List<SettlementAnomaly> out = new ArrayList<>(Math.min(Math.max(limit, 0), entries.size()));
        Iterator<SettlementAnomaly> it = entries.iterator();
        while (it.hasNext() && out.size() < limit) {
            out.add(it.next());
        }
        return out;
    }
}
