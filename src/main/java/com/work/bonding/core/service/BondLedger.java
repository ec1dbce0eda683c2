package com.work.bonding.core.service;

import com.work.bonding.core.config.BondingConfig;
import com.work.bonding.core.event.BondAdded;
import com.work.bonding.core.event.UnbondRequested;
import com.work.bonding.core.event.Unbonded;
import com.work.bonding.core.exception.BondingError;
import com.work.bonding.core.exception.BondingException;
import com.work.bonding.core.execution.LedgerOperationExecutor;
import com.work.bonding.core.identity.BondIdentity;
import com.work.bonding.core.math.Uint256Math;
import com.work.bonding.core.math.WithdrawMath;
import com.work.bonding.core.model.BondId;
import com.work.bonding.core.model.BondIntent;
import com.work.bonding.core.model.BondState;
import com.work.bonding.core.model.PoolId;
import com.work.bonding.core.model.UnbondSettlement;
import com.work.bonding.core.repository.LedgerEventLog;
import com.work.bonding.core.repository.LedgerRepository;
import com.work.bonding.core.token.TokenGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Optional;

import static com.work.bonding.core.config.BondingConstants.BURN_ADDRESS;
import static com.work.bonding.core.config.BondingConstants.MAX_SLASH;
import static com.work.bonding.core.config.BondingConstants.UNBOND_DELAY;
import static com.work.bonding.core.support.ValidationUtils.requireAddress;
import static com.work.bonding.core.support.ValidationUtils.requireNonNegative;
import static com.work.bonding.core.support.ValidationUtils.requireNonNull;

/**
 * 负责 bond 的完整生命周期：
 * <pre>
 *     ∅ → Active(willUnlock=0) → Active(willUnlock=t) → ∅
 * </pre>
 * replaceBond 可以从任一 Active 子状态直接结算回到 ∅ 并立即建新仓。
 * <p>
 * 每个公开写操作都经 {@link LedgerOperationExecutor} 执行：先校验前置条件，再写状态、转账、记事件，
 * 任一步失败整体回滚。
 */
@Service
public class BondLedger {

    private static final Logger log = LoggerFactory.getLogger(BondLedger.class);

    private final LedgerRepository repository;
    private final LedgerEventLog eventLog;
    private final TokenGateway tokenGateway;
    private final BondIdentity identity;
    private final LedgerOperationExecutor executor;
    private final BondingConfig config;

    public BondLedger(LedgerRepository repository,
                      LedgerEventLog eventLog,
                      TokenGateway tokenGateway,
                      BondIdentity identity,
                      LedgerOperationExecutor executor,
                      BondingConfig config) {
        this.repository = repository;
        this.eventLog = eventLog;
        this.tokenGateway = tokenGateway;
        this.identity = identity;
        this.executor = executor;
        this.config = config;
    }

    /**
     * 建仓：快照池子当前 slash points，并把 amount 从 caller 转入托管账户。
     */
    public BondId addBond(String caller, BondIntent intent) {
        String owner = requireAddress(caller, "caller");
        requireNonNull(intent, "intent");
        return executor.execute("addBond", now -> doAddBond(owner, intent, now));
    }

    /**
     * 申请解绑，启动 30 天时间锁；每个 bond 只能申请一次。
     *
     * @return 解锁时间（epoch 秒）
     */
    public long requestUnbond(String caller, BondIntent intent) {
        String owner = requireAddress(caller, "caller");
        requireNonNull(intent, "intent");
        return executor.execute("requestUnbond", now -> {
            BondId bondId = identity.derive(owner, intent);
            BondState state = requireActive(bondId);
            if (state.isUnbondRequested()) {
                throw new BondingException(BondingError.BOND_NOT_ACTIVE,
                        "bond 已申请过解绑: " + bondId + " willUnlock=" + state.getWillUnlock());
            }
            long willUnlock = Math.addExact(now, UNBOND_DELAY.getSeconds());
            repository.updateWillUnlock(bondId, willUnlock);
            eventLog.append(new UnbondRequested(owner, bondId, willUnlock, now));
            log.info("unbond requested owner={} bondId={} willUnlock={}", owner, bondId, willUnlock);
            return willUnlock;
        });
    }

    /**
     * 时间锁到期后（严格大于 willUnlock）结算：按比例返还，剩余部分转入销毁地址。
     */
    public UnbondSettlement unbond(String caller, BondIntent intent) {
        String owner = requireAddress(caller, "caller");
        requireNonNull(intent, "intent");
        return executor.execute("unbond", now -> {
            BondId bondId = identity.derive(owner, intent);
            Optional<BondState> state = repository.findBond(bondId).filter(BondState::isActive);
            long willUnlock = state.map(BondState::getWillUnlock).orElse(0L);
            if (willUnlock == 0L || now <= willUnlock) {
                throw new BondingException(BondingError.BOND_NOT_UNLOCKED,
                        "bond 尚未解锁: " + bondId + " willUnlock=" + willUnlock + " now=" + now);
            }
            return settle(owner, intent, bondId, state.get(), now);
        });
    }

    /**
     * 用新 bond 替换旧 bond（同一池子），不受时间锁约束，解绑申请进行中也可以替换。
     * <p>
     * 新金额不得小于旧 bond 当前可提取金额，否则就能借替换拿到一个全新的 slashedAtStart 快照，
     * 把已经发生的 slash 抹掉。
     *
     * @return 新 bond 的 id
     */
    public BondId replaceBond(String caller, BondIntent oldIntent, BondIntent newIntent) {
        String owner = requireAddress(caller, "caller");
        requireNonNull(oldIntent, "oldIntent");
        requireNonNull(newIntent, "newIntent");
        return executor.execute("replaceBond", now -> {
            BondId oldId = identity.derive(owner, oldIntent);
            BondState oldState = requireActive(oldId);
            if (!newIntent.getPoolId().equals(oldIntent.getPoolId())) {
                throw new BondingException(BondingError.POOL_ID_MISMATCH,
                        "替换前后 poolId 不一致: old=" + oldIntent.getPoolId() + " new=" + newIntent.getPoolId());
            }
            BigInteger withdrawable = calcWithdrawAmount(oldIntent.getAmount(), oldIntent.getPoolId(),
                    oldState.getSlashedAtStart());
            if (newIntent.getAmount().compareTo(withdrawable) < 0) {
                throw new BondingException(BondingError.NEW_BOND_TOO_SMALL,
                        "新 bond 金额过小: new=" + newIntent.getAmount() + " withdrawable=" + withdrawable);
            }
            settle(owner, oldIntent, oldId, oldState, now);
            return doAddBond(owner, newIntent, now);
        });
    }

    /**
     * amount * (MAX_SLASH - slashPoints[pool]) / (MAX_SLASH - slashedAtStart)，只读。
     */
    public BigInteger calcWithdrawAmount(BigInteger amount, PoolId poolId, BigInteger slashedAtStart) {
        requireNonNegative(amount, "amount");
        requireNonNull(poolId, "poolId");
        requireNonNegative(slashedAtStart, "slashedAtStart");
        return WithdrawMath.calcWithdrawAmount(amount, repository.loadSlashPoints(poolId), slashedAtStart);
    }

    /**
     * 查询某个意图当前可提取的金额；bond 不是 active 时返回 0 而不是报错。
     */
    public BigInteger getWithdrawAmount(String owner, BondIntent intent) {
        BondId bondId = bondIdOf(owner, intent);
        return repository.findBond(bondId)
                .filter(BondState::isActive)
                .map(state -> calcWithdrawAmount(intent.getAmount(), intent.getPoolId(), state.getSlashedAtStart()))
                .orElse(BigInteger.ZERO);
    }

    public BondId bondIdOf(String owner, BondIntent intent) {
        return identity.derive(owner, requireNonNull(intent, "intent"));
    }

    public Optional<BondState> findBond(BondId bondId) {
        return repository.findBond(requireNonNull(bondId, "bondId"));
    }

    private BondId doAddBond(String owner, BondIntent intent, long now) {
        BondId bondId = identity.derive(owner, intent);
        if (repository.findBond(bondId).map(BondState::isActive).orElse(false)) {
            throw new BondingException(BondingError.BOND_ALREADY_ACTIVE, "bond 已存在: " + bondId);
        }
        BigInteger slashPoints = repository.loadSlashPoints(intent.getPoolId());
        if (slashPoints.compareTo(MAX_SLASH) >= 0) {
            throw new BondingException(BondingError.POOL_FULLY_SLASHED, "池子已被完全 slash: " + intent.getPoolId());
        }

        repository.insertBond(bondId, BondState.open(slashPoints));
        tokenGateway.transferFrom(config.getTokenAddress(), owner, config.getInstanceAddress(), intent.getAmount());
        eventLog.append(new BondAdded(owner, intent.getAmount(), intent.getPoolId(), intent.getNonce(), slashPoints, now));
        log.info("bond added owner={} bondId={} amount={} pool={} slashedAtStart={}",
                owner, bondId, intent.getAmount(), intent.getPoolId(), slashPoints);
        return bondId;
    }

    private UnbondSettlement settle(String owner, BondIntent intent, BondId bondId, BondState state, long now) {
        BigInteger payout = calcWithdrawAmount(intent.getAmount(), intent.getPoolId(), state.getSlashedAtStart());
        BigInteger burned = Uint256Math.sub(intent.getAmount(), payout);

        repository.deleteBond(bondId);
        tokenGateway.transfer(config.getTokenAddress(), owner, payout);
        if (burned.signum() > 0) {
            tokenGateway.transfer(config.getTokenAddress(), BURN_ADDRESS, burned);
        }
        eventLog.append(new Unbonded(owner, bondId, now));
        log.info("unbonded owner={} bondId={} payout={} burned={}", owner, bondId, payout, burned);
        return new UnbondSettlement(bondId, payout, burned);
    }

    private BondState requireActive(BondId bondId) {
        return repository.findBond(bondId)
                .filter(BondState::isActive)
                .orElseThrow(() -> new BondingException(BondingError.BOND_NOT_ACTIVE, "bond 不存在或已结束: " + bondId));
    }
}
