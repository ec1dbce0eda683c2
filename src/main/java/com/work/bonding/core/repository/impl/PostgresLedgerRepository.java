package com.work.bonding.core.repository.impl;

import com.work.bonding.core.model.BondId;
import com.work.bonding.core.model.BondState;
import com.work.bonding.core.model.PoolId;
import com.work.bonding.core.repository.LedgerRepository;
import com.work.bonding.core.repository.entity.BondStateEntity;
import com.work.bonding.core.repository.entity.PoolSlashPointsEntity;
import com.work.bonding.core.repository.mapper.BondStateMapper;
import com.work.bonding.core.repository.mapper.PoolSlashPointsMapper;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Optional;

import static com.work.bonding.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的 LedgerRepository 实现
 *
 * 注意：
 * 1. 所有写方法都必须在事务中调用，事务边界由 LedgerOperationExecutor 统一管理
 * 2. 账本全局锁已保证串行，这里不再使用 SELECT FOR UPDATE
 */
public class PostgresLedgerRepository implements LedgerRepository {

    private final PoolSlashPointsMapper slashPointsMapper;
    private final BondStateMapper bondStateMapper;

    public PostgresLedgerRepository(PoolSlashPointsMapper slashPointsMapper, BondStateMapper bondStateMapper) {
        this.slashPointsMapper = slashPointsMapper;
        this.bondStateMapper = bondStateMapper;
    }

    @Override
    public BigInteger loadSlashPoints(PoolId poolId) {
        requireNonNull(poolId, "poolId");
        PoolSlashPointsEntity entity = slashPointsMapper.selectByPoolId(poolId.toHex());
        if (entity == null || entity.getSlashPoints() == null) {
            return BigInteger.ZERO;
        }
        return entity.getSlashPoints();
    }

    @Override
    public void saveSlashPoints(PoolId poolId, BigInteger slashPoints) {
        requireNonNull(poolId, "poolId");
        requireNonNull(slashPoints, "slashPoints");
        slashPointsMapper.upsert(poolId.toHex(), slashPoints, Instant.now());
    }

    @Override
    public Optional<BondState> findBond(BondId bondId) {
        requireNonNull(bondId, "bondId");
        BondStateEntity entity = bondStateMapper.selectByBondId(bondId.toHex());
        if (entity == null) {
            return Optional.empty();
        }
        return Optional.of(convertToState(entity));
    }

    @Override
    public void insertBond(BondId bondId, BondState state) {
        requireNonNull(bondId, "bondId");
        requireNonNull(state, "state");
        int inserted = bondStateMapper.insertActive(bondId.toHex(), state.getSlashedAtStart(),
                state.getWillUnlock(), Instant.now());
        if (inserted != 1) {
            throw new IllegalStateException("插入 bond 失败: " + bondId);
        }
    }

    @Override
    public void updateWillUnlock(BondId bondId, long willUnlock) {
        requireNonNull(bondId, "bondId");
        int updated = bondStateMapper.updateWillUnlock(bondId.toHex(), willUnlock);
        if (updated != 1) {
            throw new IllegalStateException("更新 willUnlock 失败，bond 不存在或已申请过解绑: " + bondId);
        }
    }

    @Override
    public void deleteBond(BondId bondId) {
        requireNonNull(bondId, "bondId");
        bondStateMapper.deleteByBondId(bondId.toHex());
    }

    private BondState convertToState(BondStateEntity entity) {
        long willUnlock = entity.getWillUnlock() == null ? 0L : entity.getWillUnlock();
        BigInteger slashedAtStart = entity.getSlashedAtStart() == null ? BigInteger.ZERO : entity.getSlashedAtStart();
        return new BondState(Boolean.TRUE.equals(entity.getActive()), slashedAtStart, willUnlock);
    }
}
