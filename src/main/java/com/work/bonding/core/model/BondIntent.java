package com.work.bonding.core.model;

import com.work.bonding.core.math.Uint256Math;

import java.math.BigInteger;
import java.util.Objects;

import static com.work.bonding.core.support.ValidationUtils.requireNonNegative;
import static com.work.bonding.core.support.ValidationUtils.requireNonNull;

/**
 * 调用方提交的 bond 意图。本身不落库，仅用于推导 {@link BondId}：
 * add / requestUnbond / unbond / replace 必须携带完全相同的三元组才能定位到同一个 bond。
 */
public final class BondIntent {

    private final BigInteger amount;
    private final PoolId poolId;
    private final BigInteger nonce;

    public BondIntent(BigInteger amount, PoolId poolId, BigInteger nonce) {
        this.amount = requireUint256(amount, "amount");
        this.poolId = requireNonNull(poolId, "poolId");
        this.nonce = requireUint256(nonce, "nonce");
    }

    private static BigInteger requireUint256(BigInteger value, String paramName) {
        requireNonNegative(value, paramName);
        if (value.compareTo(Uint256Math.MAX_VALUE) > 0) {
            throw new IllegalArgumentException(paramName + " 超出 uint256 范围");
        }
        return value;
    }

    public static BondIntent of(long amount, PoolId poolId, long nonce) {
        return new BondIntent(BigInteger.valueOf(amount), poolId, BigInteger.valueOf(nonce));
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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BondIntent that = (BondIntent) o;
        return amount.equals(that.amount) && poolId.equals(that.poolId) && nonce.equals(that.nonce);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount, poolId, nonce);
    }

    @Override
    public String toString() {
        return "BondIntent{" +
                "amount=" + amount +
                ", poolId=" + poolId +
                ", nonce=" + nonce +
                '}';
    }
}
