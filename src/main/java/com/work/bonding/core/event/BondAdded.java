package com.work.bonding.core.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.work.bonding.core.model.PoolId;

import java.math.BigInteger;

public final class BondAdded extends LedgerEvent {

    public static final String TYPE = "BondAdded";

    private final String owner;
    private final BigInteger amount;
    private final PoolId poolId;
    private final BigInteger nonce;
    private final BigInteger slashedAtStart;

    @JsonCreator
    public BondAdded(@JsonProperty("owner") String owner,
                     @JsonProperty("amount") BigInteger amount,
                     @JsonProperty("poolId") PoolId poolId,
                     @JsonProperty("nonce") BigInteger nonce,
                     @JsonProperty("slashedAtStart") BigInteger slashedAtStart,
                     @JsonProperty("time") long time) {
        super(time);
        this.owner = owner;
        this.amount = amount;
        this.poolId = poolId;
        this.nonce = nonce;
        this.slashedAtStart = slashedAtStart;
    }

    public String getOwner() {
        return owner;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public PoolId getPoolId() {
        return poolId;
    }

    public BigInteger getNonce() {
        return nonce;
    }

    public BigInteger getSlashedAtStart() {
        return slashedAtStart;
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
