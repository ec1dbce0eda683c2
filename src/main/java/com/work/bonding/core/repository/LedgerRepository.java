package com.work.bonding.core.repository;

import com.work.bonding.core.model.BondId;
import com.work.bonding.core.model.BondState;
import com.work.bonding.core.model.PoolId;

import java.math.BigInteger;
import java.util.Optional;

/**
 * 账本的两张表：pool → slash points，bondId → bond state。
 * <p>所有写方法都必须在 {@link com.work.bonding.core.execution.LedgerOperationExecutor} 打开的事务中调用。</p>
 */
public interface LedgerRepository {

    /**
     * 读取池子的累计 slash points，从未被 slash 过的池子返回 0。
     */
    BigInteger loadSlashPoints(PoolId poolId);

    void saveSlashPoints(PoolId poolId, BigInteger slashPoints);

    Optional<BondState> findBond(BondId bondId);

    /**
     * 新建 bond。调用方已校验该 id 上不存在 active 记录。
     */
    void insertBond(BondId bondId, BondState state);

    /**
     * 写入解锁时间（只会发生一次）。
     */
    void updateWillUnlock(BondId bondId, long willUnlock);

    void deleteBond(BondId bondId);
}
