package com.work.bonding.web.dto;

import java.math.BigInteger;

public class BondView {

    private String bondId;
    private boolean active;
    private BigInteger slashedAtStart;
    private long willUnlock;

    public String getBondId() {
        return bondId;
    }

    public void setBondId(String bondId) {
        this.bondId = bondId;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public BigInteger getSlashedAtStart() {
        return slashedAtStart;
    }

    public void setSlashedAtStart(BigInteger slashedAtStart) {
        this.slashedAtStart = slashedAtStart;
    }

    public long getWillUnlock() {
        return willUnlock;
    }

    public void setWillUnlock(long willUnlock) {
        this.willUnlock = willUnlock;
    }
}
