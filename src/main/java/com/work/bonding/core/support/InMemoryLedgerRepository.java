package com.work.bonding.core.support;

import com.work.bonding.core.model.BondId;
import com.work.bonding.core.model.BondState;
import com.work.bonding.core.model.PoolId;
import com.work.bonding.core.repository.LedgerRepository;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 纯内存实现，方便在没有 Postgres 的环境下运行账本。
 * 每次写入都会向 {@link UndoJournal} 登记逆操作，事务回滚后内存表恢复原状。
 */
public class InMemoryLedgerRepository implements LedgerRepository {

    private final Map<PoolId, BigInteger> slashPointsTable = new ConcurrentHashMap<>();
    private final Map<BondId, BondState> bondTable = new ConcurrentHashMap<>();

    @Override
    public BigInteger loadSlashPoints(PoolId poolId) {
        return slashPointsTable.getOrDefault(poolId, BigInteger.ZERO);
    }

    @Override
    public void saveSlashPoints(PoolId poolId, BigInteger slashPoints) {
        BigInteger previous = slashPointsTable.put(poolId, slashPoints);
        UndoJournal.record(() -> restore(slashPointsTable, poolId, previous));
    }

    @Override
    public Optional<BondState> findBond(BondId bondId) {
        return Optional.ofNullable(bondTable.get(bondId));
    }

    @Override
    public void insertBond(BondId bondId, BondState state) {
        BondState previous = bondTable.putIfAbsent(bondId, state);
        if (previous != null) {
            throw new IllegalStateException("bond 已存在: " + bondId);
        }
        UndoJournal.record(() -> bondTable.remove(bondId));
    }

    @Override
    public void updateWillUnlock(BondId bondId, long willUnlock) {
        BondState previous = bondTable.get(bondId);
        if (previous == null) {
            throw new IllegalStateException("未找到 bond: " + bondId);
        }
        bondTable.put(bondId, previous.withWillUnlock(willUnlock));
        UndoJournal.record(() -> bondTable.put(bondId, previous));
    }

    @Override
    public void deleteBond(BondId bondId) {
        BondState previous = bondTable.remove(bondId);
        if (previous != null) {
            UndoJournal.record(() -> bondTable.put(bondId, previous));
        }
    }

    private static <K, V> void restore(Map<K, V> table, K key, V previous) {
        if (previous == null) {
            table.remove(key);
        } else {
            table.put(key, previous);
        }
    }
}
