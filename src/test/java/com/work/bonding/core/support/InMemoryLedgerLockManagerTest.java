package com.work.bonding.core.support;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryLedgerLockManagerTest {

    @Test
    public void lock_is_exclusive_until_released() {
        InMemoryLedgerLockManager lock = new InMemoryLedgerLockManager();
        assertTrue(lock.tryLock("ledger", "a", Duration.ofSeconds(5)));
        assertFalse(lock.tryLock("ledger", "a", Duration.ofSeconds(5)));
        assertFalse(lock.tryLock("ledger", "b", Duration.ofSeconds(5)));

        lock.unlock("ledger", "b");
        assertFalse(lock.tryLock("ledger", "b", Duration.ofSeconds(5)));

        lock.unlock("ledger", "a");
        assertTrue(lock.tryLock("ledger", "b", Duration.ofSeconds(5)));
    }

    @Test
    public void renew_extends_only_own_live_lock() throws Exception {
        InMemoryLedgerLockManager lock = new InMemoryLedgerLockManager();
        assertTrue(lock.tryLock("ledger", "a", Duration.ofMillis(80)));
        assertFalse(lock.renew("ledger", "b", Duration.ofSeconds(5)));
        assertTrue(lock.renew("ledger", "a", Duration.ofSeconds(5)));

        Thread.sleep(120);
        assertFalse(lock.tryLock("ledger", "b", Duration.ofSeconds(5)));
    }

    @Test
    public void expired_lock_cannot_be_renewed_and_can_be_taken() throws Exception {
        InMemoryLedgerLockManager lock = new InMemoryLedgerLockManager();
        assertTrue(lock.tryLock("ledger", "a", Duration.ofMillis(20)));
        Thread.sleep(50);

        assertFalse(lock.renew("ledger", "a", Duration.ofSeconds(5)));
        assertTrue(lock.tryLock("ledger", "b", Duration.ofSeconds(5)));
        assertFalse(lock.renew("ledger", "a", Duration.ofSeconds(5)));
    }

    @Test
    public void renew_of_missing_lock_fails() {
        assertFalse(new InMemoryLedgerLockManager().renew("ledger", "a", Duration.ofSeconds(1)));
    }
}
