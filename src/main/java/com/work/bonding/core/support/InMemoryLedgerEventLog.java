package com.work.bonding.core.support;

import com.work.bonding.core.event.LedgerEvent;
import com.work.bonding.core.event.LedgerEventRecord;
import com.work.bonding.core.repository.LedgerEventLog;

import java.util.ArrayList;
import java.util.List;

/**
 * 内存版通知日志。回滚时撤销追加的记录，seq 也随之回退，保证日志中不出现空洞。
 */
public class InMemoryLedgerEventLog implements LedgerEventLog {

    private final List<LedgerEventRecord> records = new ArrayList<>();

    @Override
    public synchronized long append(LedgerEvent event) {
        long seq = records.size() + 1L;
        records.add(new LedgerEventRecord(seq, event));
        UndoJournal.record(this::removeLast);
        return seq;
    }

    @Override
    public synchronized List<LedgerEventRecord> listAfter(Long afterSeq, int limit) {
        int from = afterSeq == null ? 0 : (int) Math.min(Math.max(afterSeq, 0L), records.size());
        int to = Math.min(records.size(), from + Math.max(limit, 0));
        return new ArrayList<>(records.subList(from, to));
    }

    private synchronized void removeLast() {
        records.remove(records.size() - 1);
    }
}
