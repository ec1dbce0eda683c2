package com.work.bonding.core.support;

import org.springframework.core.Ordered;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 内存实现的回滚日志：每次内存写入前登记一条逆操作，事务未提交时按登记的逆序执行。
 * <p>
 * 日志作为事务资源绑定在当前线程上，和 DataSourceTransactionManager / {@link InMemoryTransactionManager}
 * 都能配合；没有事务同步时写入直接生效，不做登记。
 */
public final class UndoJournal {

    private static final Object RESOURCE_KEY = UndoJournal.class;

    private final Deque<Runnable> undoActions = new ArrayDeque<>();

    private UndoJournal() {
    }

    public static void record(Runnable undo) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        UndoJournal journal = (UndoJournal) TransactionSynchronizationManager.getResource(RESOURCE_KEY);
        if (journal == null) {
            journal = new UndoJournal();
            TransactionSynchronizationManager.bindResource(RESOURCE_KEY, journal);
            TransactionSynchronizationManager.registerSynchronization(journal.new Replay());
        }
        journal.undoActions.push(undo);
    }

    private final class Replay implements TransactionSynchronization {

        /**
         * 必须先于释放账本锁的同步执行，否则下一笔操作可能读到尚未撤销的写入。
         */
        @Override
        public int getOrder() {
            return Ordered.HIGHEST_PRECEDENCE;
        }

        @Override
        public void afterCompletion(int status) {
            TransactionSynchronizationManager.unbindResourceIfPossible(RESOURCE_KEY);
            if (status != STATUS_COMMITTED) {
                while (!undoActions.isEmpty()) {
                    undoActions.pop().run();
                }
            }
            undoActions.clear();
        }
    }
}
