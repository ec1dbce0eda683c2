package com.work.bonding.core.event;

/**
 * 已落入通知日志的事件，seq 为日志内单调递增的序号，可用作增量拉取的游标。
 */
public final class LedgerEventRecord {

    private final long seq;
    private final LedgerEvent event;

    public LedgerEventRecord(long seq, LedgerEvent event) {
        this.seq = seq;
        this.event = event;
    }

    public long getSeq() {
        return seq;
    }

    public LedgerEvent getEvent() {
        return event;
    }
}
