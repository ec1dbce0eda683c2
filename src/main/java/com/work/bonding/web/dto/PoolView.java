package com.work.bonding.web.dto;

import java.math.BigInteger;

public class PoolView {

    private String poolId;
    private BigInteger slashPoints;
    private BigInteger maxSlash;

    public String getPoolId() {
        return poolId;
    }

    public void setPoolId(String poolId) {
        this.poolId = poolId;
    }

    public BigInteger getSlashPoints() {
        return slashPoints;
    }

    public void setSlashPoints(BigInteger slashPoints) {
        this.slashPoints = slashPoints;
    }

    public BigInteger getMaxSlash() {
        return maxSlash;
    }

    public void setMaxSlash(BigInteger maxSlash) {
        this.maxSlash = maxSlash;
    }
}
