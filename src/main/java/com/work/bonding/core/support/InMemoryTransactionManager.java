package com.work.bonding.core.support;

import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;
import org.springframework.transaction.support.DefaultTransactionStatus;
import org.springframework.transaction.support.SmartTransactionObject;

/**
 * 纯内存存储使用的事务管理器：本身不持有任何资源，只负责驱动事务同步，
 * 真正的回滚由 {@link UndoJournal} 在 afterCompletion 中完成。
 * 注意：该实现仅适用于单进程，不具备跨进程一致性。
 */
public class InMemoryTransactionManager extends AbstractPlatformTransactionManager {

    private static final class TxHolder {
        boolean rollbackOnly;
    }

    private static final class InMemoryTransaction implements SmartTransactionObject {
        private final TxHolder holder;

        InMemoryTransaction(TxHolder holder) {
            this.holder = holder;
        }

        @Override
        public boolean isRollbackOnly() {
            return holder != null && holder.rollbackOnly;
        }

        @Override
        public void flush() {
        }
    }

    private final ThreadLocal<TxHolder> current = new ThreadLocal<>();

    @Override
    protected Object doGetTransaction() {
        return new InMemoryTransaction(current.get());
    }

    @Override
    protected boolean isExistingTransaction(Object transaction) {
        return ((InMemoryTransaction) transaction).holder != null;
    }

    @Override
    protected void doBegin(Object transaction, TransactionDefinition definition) {
        current.set(new TxHolder());
    }

    @Override
    protected void doCommit(DefaultTransactionStatus status) {
        // 写入已直接落在内存表上，提交无需额外动作
    }

    @Override
    protected void doRollback(DefaultTransactionStatus status) {
        // 由 UndoJournal 在 afterCompletion 中回放
    }

    @Override
    protected void doSetRollbackOnly(DefaultTransactionStatus status) {
        TxHolder holder = current.get();
        if (holder != null) {
            holder.rollbackOnly = true;
        }
    }

    @Override
    protected void doCleanupAfterCompletion(Object transaction) {
        current.remove();
    }
}
