package com.work.bonding.web.dto;

import com.work.bonding.core.event.LedgerEvent;

public class LedgerEventView {

    private long seq;
    private LedgerEvent event;

    public long getSeq() {
        return seq;
    }

    public void setSeq(long seq) {
        this.seq = seq;
    }

    public LedgerEvent getEvent() {
        return event;
    }

    public void setEvent(LedgerEvent event) {
        this.event = event;
    }
}
