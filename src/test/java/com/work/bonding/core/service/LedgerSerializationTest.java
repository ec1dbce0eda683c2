package com.work.bonding.core.service;

import com.work.bonding.core.config.BondingConfig;
import com.work.bonding.core.event.BondAdded;
import com.work.bonding.core.event.LedgerEventRecord;
import com.work.bonding.core.event.SlashApplied;
import com.work.bonding.core.exception.BondingError;
import com.work.bonding.core.exception.BondingException;
import com.work.bonding.core.execution.LedgerOperationExecutor;
import com.work.bonding.core.identity.BondIdentity;
import com.work.bonding.core.model.BondId;
import com.work.bonding.core.model.BondIntent;
import com.work.bonding.core.model.PoolId;
import com.work.bonding.core.support.InMemoryLedgerEventLog;
import com.work.bonding.core.support.InMemoryLedgerLockManager;
import com.work.bonding.core.support.InMemoryLedgerRepository;
import com.work.bonding.core.support.InMemoryTokenLedger;
import com.work.bonding.core.support.InMemoryTransactionManager;
import com.work.bonding.core.support.MutableClock;
import com.work.bonding.core.support.metrics.NoopLedgerMetrics;
import com.work.bonding.core.token.TokenGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class LedgerSerializationTest {

    private static final String TOKEN = "0x1111111111111111111111111111111111111111";
    private static final String AUTHORITY = "0x2222222222222222222222222222222222222222";
    private static final String INSTANCE = "0x3333333333333333333333333333333333333333";
    private static final String OWNER = "0x4444444444444444444444444444444444444444";
    private static final PoolId POOL = PoolId.of(new byte[32]);
    private static final BigInteger E17 = BigInteger.TEN.pow(17);

    /**
     * transferFrom 在放行前一直阻塞，模拟等待链上 receipt。
     */
    private static final class BlockingTokenGateway implements TokenGateway {
        final TokenGateway delegate;
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        BlockingTokenGateway(TokenGateway delegate) {
            this.delegate = delegate;
        }

        @Override
        public void transferFrom(String token, String from, String to, BigInteger amount) {
            entered.countDown();
            try {
                if (!release.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("not released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            delegate.transferFrom(token, from, to, amount);
        }

        @Override
        public void transfer(String token, String to, BigInteger amount) {
            delegate.transfer(token, to, amount);
        }
    }

    private final ExecutorService background = Executors.newSingleThreadExecutor();
    private LedgerOperationExecutor executor;

    @AfterEach
    public void tearDown() {
        background.shutdownNow();
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    public void slow_operation_keeps_lock_beyond_ttl() throws Exception {
        BondingConfig config = new BondingConfig(TOKEN, AUTHORITY, INSTANCE,
                Duration.ofMillis(100), Duration.ofMillis(50), "test");
        InMemoryLedgerRepository repository = new InMemoryLedgerRepository();
        InMemoryLedgerEventLog eventLog = new InMemoryLedgerEventLog();
        InMemoryTokenLedger token = new InMemoryTokenLedger(INSTANCE);
        token.mint(TOKEN, OWNER, BigInteger.valueOf(1000));
        token.approve(TOKEN, OWNER, INSTANCE, BigInteger.valueOf(1000));
        BlockingTokenGateway gateway = new BlockingTokenGateway(token);

        executor = new LedgerOperationExecutor(new InMemoryLedgerLockManager(), config,
                new MutableClock(Instant.ofEpochSecond(1_700_000_000L)), new NoopLedgerMetrics(),
                new InMemoryTransactionManager());
        SlashRegistry registry = new SlashRegistry(repository, eventLog, executor, config);
        BondLedger ledger = new BondLedger(repository, eventLog, gateway, new BondIdentity(INSTANCE), executor, config);

        Future<BondId> adding = background.submit(() -> ledger.addBond(OWNER, BondIntent.of(1000, POOL, 1)));
        assertTrue(gateway.entered.await(5, TimeUnit.SECONDS));

        // 超过 ttl 两倍以上，锁仍由 addBond 持有
        Thread.sleep(300);
        BondingException ex = assertThrows(BondingException.class, () -> registry.slash(AUTHORITY, POOL, E17));
        assertEquals(BondingError.LEDGER_BUSY, ex.getError());
        assertEquals(BigInteger.ZERO, registry.getSlashPoints(POOL));

        gateway.release.countDown();
        BondId bondId = adding.get(5, TimeUnit.SECONDS);
        assertEquals(BigInteger.ZERO, ledger.findBond(bondId).get().getSlashedAtStart());

        assertEquals(E17, registry.slash(AUTHORITY, POOL, E17));
        List<LedgerEventRecord> events = eventLog.listAfter(null, 10);
        assertEquals(2, events.size());
        assertTrue(events.get(0).getEvent() instanceof BondAdded);
        assertTrue(events.get(1).getEvent() instanceof SlashApplied);
    }
}
