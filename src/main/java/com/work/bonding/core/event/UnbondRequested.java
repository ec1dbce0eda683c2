package com.work.bonding.core.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.work.bonding.core.model.BondId;

public final class UnbondRequested extends LedgerEvent {

    public static final String TYPE = "UnbondRequested";

    private final String owner;
    private final BondId bondId;
    private final long willUnlock;

    @JsonCreator
    public UnbondRequested(@JsonProperty("owner") String owner,
                           @JsonProperty("bondId") BondId bondId,
                           @JsonProperty("willUnlock") long willUnlock,
                           @JsonProperty("time") long time) {
        super(time);
        this.owner = owner;
        this.bondId = bondId;
        this.willUnlock = willUnlock;
    }

    public String getOwner() {
        return owner;
    }

    public BondId getBondId() {
        return bondId;
    }

    public long getWillUnlock() {
        return willUnlock;
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
