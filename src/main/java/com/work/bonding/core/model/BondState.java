package com.work.bonding.core.model;

import java.math.BigInteger;

import static com.work.bonding.core.support.ValidationUtils.requireNonNegative;

/**
 * 对应 bond_state 表的一行。
 *
 * 注意：
 * 1. slashedAtStart 是建仓时池子 slash points 的快照，恒小于 MAX_SLASH
 * 2. willUnlock 为 0 表示尚未申请解绑；非 0 即解锁时间（epoch 秒），只允许写一次
 * 3. 解绑成功后整行删除，同一 BondId 可以重新建仓
 */
public final class BondState {

    private static final long UNSET = 0L;

    private final boolean active;
    private final BigInteger slashedAtStart;
    private final long willUnlock;

    public BondState(boolean active, BigInteger slashedAtStart, long willUnlock) {
        requireNonNegative(slashedAtStart, "slashedAtStart");
        if (willUnlock < 0) {
            throw new IllegalArgumentException("willUnlock 不能为负数");
        }
        this.active = active;
        this.slashedAtStart = slashedAtStart;
        this.willUnlock = willUnlock;
    }

    /**
     * 新建一个尚未申请解绑的 active bond。
     */
    public static BondState open(BigInteger slashedAtStart) {
        return new BondState(true, slashedAtStart, UNSET);
    }

    public BondState withWillUnlock(long willUnlock) {
        if (willUnlock <= 0) {
            throw new IllegalArgumentException("willUnlock 必须大于0");
        }
        return new BondState(active, slashedAtStart, willUnlock);
    }

    public boolean isActive() {
        return active;
    }

    public BigInteger getSlashedAtStart() {
        return slashedAtStart;
    }

    public long getWillUnlock() {
        return willUnlock;
    }

    public boolean isUnbondRequested() {
        return willUnlock != UNSET;
    }

    @Override
    public String toString() {
        return "BondState{" +
                "active=" + active +
                ", slashedAtStart=" + slashedAtStart +
                ", willUnlock=" + willUnlock +
                '}';
    }
}
