package com.work.bonding.core.model;

import java.math.BigInteger;

/**
 * 一次解绑结算的结果：payout 返还给 owner，burned 转入销毁地址。
 */
public final class UnbondSettlement {

    private final BondId bondId;
    private final BigInteger payout;
    private final BigInteger burned;

    public UnbondSettlement(BondId bondId, BigInteger payout, BigInteger burned) {
        this.bondId = bondId;
        this.payout = payout;
        this.burned = burned;
    }

    public BondId getBondId() {
        return bondId;
    }

    public BigInteger getPayout() {
        return payout;
    }

    public BigInteger getBurned() {
        return burned;
    }
}
