package com.work.bonding.core.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.work.bonding.core.model.PoolId;

import java.math.BigInteger;

public final class SlashApplied extends LedgerEvent {

    public static final String TYPE = "SlashApplied";

    private final PoolId poolId;
    private final BigInteger newTotal;

    @JsonCreator
    public SlashApplied(@JsonProperty("poolId") PoolId poolId,
                        @JsonProperty("newTotal") BigInteger newTotal,
                        @JsonProperty("time") long time) {
        super(time);
        this.poolId = poolId;
        this.newTotal = newTotal;
    }

    public PoolId getPoolId() {
        return poolId;
    }

    public BigInteger getNewTotal() {
        return newTotal;
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
