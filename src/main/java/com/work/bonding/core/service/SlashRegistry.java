package com.work.bonding.core.service;

import com.work.bonding.core.config.BondingConfig;
import com.work.bonding.core.event.SlashApplied;
import com.work.bonding.core.exception.BondingError;
import com.work.bonding.core.exception.BondingException;
import com.work.bonding.core.execution.LedgerOperationExecutor;
import com.work.bonding.core.math.Uint256Math;
import com.work.bonding.core.model.PoolId;
import com.work.bonding.core.repository.LedgerEventLog;
import com.work.bonding.core.repository.LedgerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

import static com.work.bonding.core.config.BondingConstants.MAX_SLASH;
import static com.work.bonding.core.support.ValidationUtils.requireAddress;
import static com.work.bonding.core.support.ValidationUtils.requireNonNegative;
import static com.work.bonding.core.support.ValidationUtils.requireNonNull;

/**
 * 负责记录每个池子的累计 slash points，是该状态唯一的写入方。
 * <p>
 * slash 只改池子一行，不触碰任何 bond：各 bond 的可提取金额在提取时按
 * "建仓快照 vs 当前累计值" 惰性重算，所以 slash 的开销与 bond 数量无关。
 */
@Service
public class SlashRegistry {

    private static final Logger log = LoggerFactory.getLogger(SlashRegistry.class);

    private final LedgerRepository repository;
    private final LedgerEventLog eventLog;
    private final LedgerOperationExecutor executor;
    private final BondingConfig config;

    public SlashRegistry(LedgerRepository repository,
                         LedgerEventLog eventLog,
                         LedgerOperationExecutor executor,
                         BondingConfig config) {
        this.repository = repository;
        this.eventLog = eventLog;
        this.executor = executor;
        this.config = config;
    }

    /**
     * 为池子追加 slash points，仅 authority 可调用。
     *
     * @return 追加后的累计值
     */
    public BigInteger slash(String caller, PoolId poolId, BigInteger points) {
        String normalizedCaller = requireAddress(caller, "caller");
        requireNonNull(poolId, "poolId");
        requireNonNegative(points, "points");

        return executor.execute("slash", now -> {
            if (!config.getAuthorityAddress().equals(normalizedCaller)) {
                throw new BondingException(BondingError.NOT_AUTHORIZED, "无权 slash: caller=" + normalizedCaller);
            }
            BigInteger current = repository.loadSlashPoints(poolId);
            BigInteger newTotal = Uint256Math.add(current, points);
            if (newTotal.compareTo(MAX_SLASH) > 0) {
                throw new BondingException(BondingError.POINTS_TOO_HIGH,
                        "slash points 超过上限: pool=" + poolId + " current=" + current + " points=" + points);
            }
            repository.saveSlashPoints(poolId, newTotal);
            eventLog.append(new SlashApplied(poolId, newTotal, now));
            log.info("slash applied pool={} points={} newTotal={}", poolId, points, newTotal);
            return newTotal;
        });
    }

    public BigInteger getSlashPoints(PoolId poolId) {
        return repository.loadSlashPoints(requireNonNull(poolId, "poolId"));
    }
}
