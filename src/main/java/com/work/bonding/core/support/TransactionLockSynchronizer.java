package com.work.bonding.core.support;

import com.work.bonding.core.exception.LedgerBusyException;
import com.work.bonding.core.exception.LedgerLockLostException;
import com.work.bonding.core.lock.LedgerLockManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 事务同步工具：
 * 1. 持锁期间按 ttl/3 周期续期，操作耗时超过 ttl 也不会被其他操作抢到锁
 * 2. 锁在事务结束（提交或回滚）之后才释放，下一笔操作不会读到尚未提交的状态
 * 3. 续期失败说明锁已丢失，提交前直接失败，由事务整体回滚
 */
public final class TransactionLockSynchronizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransactionLockSynchronizer.class);

    private TransactionLockSynchronizer() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 加锁后执行操作；处于事务中时锁在事务完成后释放，否则在操作返回后立即释放。
     *
     * @param renewer 执行续期任务的调度器
     * @throws LedgerBusyException     锁被其他操作持有
     * @throws LedgerLockLostException 持有期间续期失败
     */
    public static <T> T executeWithLock(LedgerLockManager lockManager,
                                        String lockKey,
                                        String lockOwner,
                                        Duration lockTtl,
                                        ScheduledExecutorService renewer,
                                        Supplier<T> operation) {
        if (!lockManager.tryLock(lockKey, lockOwner, lockTtl)) {
            throw new LedgerBusyException("账本锁被占用: " + lockKey);
        }
        LockLease lease = new LockLease(lockManager, lockKey, lockOwner, lockTtl);
        lease.start(renewer);

        boolean inTransaction = TransactionSynchronizationManager.isSynchronizationActive();
        if (inTransaction) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void beforeCommit(boolean readOnly) {
                    lease.ensureHeld();
                }

                @Override
                public void afterCompletion(int status) {
                    lease.release();
                }
            });
        }

        try {
            T result = operation.get();
            lease.ensureHeld();
            return result;
        } finally {
            if (!inTransaction) {
                lease.release();
            }
        }
    }

    /**
     * 一次持锁的续期状态。
     */
    private static final class LockLease implements Runnable {

        private final LedgerLockManager lockManager;
        private final String lockKey;
        private final String lockOwner;
        private final Duration lockTtl;
        private volatile boolean lost;
        private volatile ScheduledFuture<?> renewal;

        LockLease(LedgerLockManager lockManager, String lockKey, String lockOwner, Duration lockTtl) {
            this.lockManager = lockManager;
            this.lockKey = lockKey;
            this.lockOwner = lockOwner;
            this.lockTtl = lockTtl;
        }

        void start(ScheduledExecutorService renewer) {
            long periodMs = Math.max(1L, lockTtl.toMillis() / 3);
            renewal = renewer.scheduleAtFixedRate(this, periodMs, periodMs, TimeUnit.MILLISECONDS);
        }

        @Override
        public void run() {
            if (lost) {
                return;
            }
            boolean renewed;
            try {
                renewed = lockManager.renew(lockKey, lockOwner, lockTtl);
            } catch (RuntimeException e) {
                LOGGER.warn("[bonding] 续期账本锁异常 lockKey={} owner={}", lockKey, lockOwner, e);
                renewed = false;
            }
            if (!renewed) {
                lost = true;
                LOGGER.warn("[bonding] 账本锁已丢失，当前操作将回滚 lockKey={} owner={}", lockKey, lockOwner);
                cancel();
            }
        }

        void ensureHeld() {
            if (lost) {
                throw new LedgerLockLostException("账本锁在操作期间丢失: " + lockKey);
            }
        }

        void release() {
            cancel();
            try {
                lockManager.unlock(lockKey, lockOwner);
            } catch (Exception e) {
                LOGGER.warn("[bonding] 释放账本锁失败 lockKey={} owner={} err={}", lockKey, lockOwner, e.toString());
            }
        }

        private void cancel() {
            ScheduledFuture<?> f = renewal;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
