package com.work.bonding.core.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.work.bonding.core.model.BondId;

public final class Unbonded extends LedgerEvent {

    public static final String TYPE = "Unbonded";

    private final String owner;
    private final BondId bondId;

    @JsonCreator
    public Unbonded(@JsonProperty("owner") String owner,
                    @JsonProperty("bondId") BondId bondId,
                    @JsonProperty("time") long time) {
        super(time);
        this.owner = owner;
        this.bondId = bondId;
    }

    public String getOwner() {
        return owner;
    }

    public BondId getBondId() {
        return bondId;
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
