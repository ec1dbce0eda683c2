package com.work.bonding.core.execution;

import com.work.bonding.core.config.BondingConfig;
import com.work.bonding.core.exception.LedgerBusyException;
import com.work.bonding.core.lock.LedgerLockManager;
import com.work.bonding.core.support.TransactionLockSynchronizer;
import com.work.bonding.core.support.metrics.LedgerMetrics;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;
import java.util.function.Supplier;

import static com.work.bonding.core.support.ValidationUtils.requireNonNull;

/**
 * 账本操作的执行模板：全局锁 + 事务 + 单次读时钟。
 * <p>
 * 每笔操作要么全部生效，要么在任何异常下整体回滚；锁在持有期间自动续期、在事务完成后才释放，
 * 保证后续操作不会看到半完成的状态。
 * <p>
 * 事务时限取自 {@link BondingConfig#getTransactionTimeout()}，必须大于操作内转账等待 receipt 的最长时间，
 * 否则转账上链后数据库事务才超时，两边状态会分叉。
 */
public class LedgerOperationExecutor {

    static final String LEDGER_LOCK_KEY = "ledger";

    private static final long INITIAL_BACKOFF_MS = 8L;
    private static final long MAX_BACKOFF_MS = 200L;

    private final LedgerLockManager lockManager;
    private final BondingConfig config;
    private final Clock clock;
    private final LedgerMetrics metrics;
    private final TransactionTemplate txTemplate;
    private final ScheduledExecutorService lockRenewer;

    public LedgerOperationExecutor(LedgerLockManager lockManager,
                                   BondingConfig config,
                                   Clock clock,
                                   LedgerMetrics metrics,
                                   PlatformTransactionManager transactionManager) {
        this.lockManager = requireNonNull(lockManager, "lockManager");
        this.config = requireNonNull(config, "config");
        this.clock = requireNonNull(clock, "clock");
        this.metrics = requireNonNull(metrics, "metrics");
        requireNonNull(transactionManager, "transactionManager");
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        template.setTimeout(toTimeoutSeconds(config.getTransactionTimeout()));
        this.txTemplate = template;
        this.lockRenewer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ledger-lock-renewer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 以原子方式执行一笔账本操作。work 收到本次操作唯一的时间读数（epoch 秒）。
     */
    public <T> T execute(String operation, Function<Long, T> work) {
        String lockOwner = config.getLockOwner() + ":" + UUID.randomUUID();
        try {
            T result = withLockRetry(() -> txTemplate.execute(status ->
                    TransactionLockSynchronizer.executeWithLock(lockManager, LEDGER_LOCK_KEY, lockOwner,
                            config.getLockTtl(), lockRenewer, () -> work.apply(now()))));
            metrics.operation(operation, "ok");
            return result;
        } catch (RuntimeException e) {
            metrics.operation(operation, e.getClass().getSimpleName());
            throw e;
        }
    }

    /**
     * 停止续期线程，由容器在关闭时调用。
     */
    public void shutdown() {
        lockRenewer.shutdownNow();
    }

    static int toTimeoutSeconds(Duration timeout) {
        long seconds = (timeout.toMillis() + 999L) / 1000L;
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1L, seconds));
    }

    private long now() {
        return Instant.now(clock).getEpochSecond();
    }

    private <T> T withLockRetry(Supplier<T> attemptWork) {
        // 只覆盖短暂竞争；等待超过 lockWait 后交给上游退避
        long deadline = System.nanoTime() + config.getLockWait().toNanos();
        long backoffMs = INITIAL_BACKOFF_MS;
        while (true) {
            try {
                return attemptWork.get();
            } catch (LedgerBusyException ex) {
                if (System.nanoTime() >= deadline) {
                    throw ex;
                }
                // 0.7x ~ 1.3x：轻量抖动，避免同步冲撞
                double factor = 0.7 + ThreadLocalRandom.current().nextDouble() * 0.6;
                long sleepMs = Math.max(1L, (long) (backoffMs * factor));
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw ex;
                }
                backoffMs = Math.min(backoffMs * 2, MAX_BACKOFF_MS);
            }
        }
    }
}
