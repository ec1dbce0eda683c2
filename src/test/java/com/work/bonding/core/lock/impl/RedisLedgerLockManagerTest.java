package com.work.bonding.core.lock.impl;

import com.work.bonding.core.exception.LedgerBusyException;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class RedisLedgerLockManagerTest {

    @Test
    @SuppressWarnings("unchecked")
    public void lock_uses_prefixed_key_and_ttl() {
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        ValueOperations<String, String> ops = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(ops);
        when(ops.setIfAbsent(eq("bonding:lock:ledger"), eq("node1:a"), eq(Duration.ofSeconds(10)))).thenReturn(true);

        RedisLedgerLockManager lock = new RedisLedgerLockManager(redis);
        assertTrue(lock.tryLock("ledger", "node1:a", Duration.ofSeconds(10)));
        assertFalse(lock.tryLock("ledger", "node1:b", Duration.ofSeconds(10)));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void redis_failure_on_lock_is_reported_as_busy() {
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        ValueOperations<String, String> ops = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(ops);
        when(ops.setIfAbsent(anyString(), anyString(), any(Duration.class)))
                .thenThrow(new RedisConnectionFailureException("down"));

        RedisLedgerLockManager lock = new RedisLedgerLockManager(redis);
        assertThrows(LedgerBusyException.class, () -> lock.tryLock("ledger", "node1:a", Duration.ofSeconds(10)));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void unlock_runs_owner_checked_script() {
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        when(redis.execute(any(RedisScript.class), anyList(), any())).thenReturn(1L);

        RedisLedgerLockManager lock = new RedisLedgerLockManager(redis);
        lock.unlock("ledger", "node1:a");

        verify(redis).execute(any(RedisScript.class), eq(Collections.singletonList("bonding:lock:ledger")), eq("node1:a"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void renew_runs_owner_checked_pexpire() {
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        when(redis.execute(any(RedisScript.class), anyList(), eq("node1:a"), eq("10000"))).thenReturn(1L);
        when(redis.execute(any(RedisScript.class), anyList(), eq("node1:b"), eq("10000"))).thenReturn(0L);

        RedisLedgerLockManager lock = new RedisLedgerLockManager(redis);
        assertTrue(lock.renew("ledger", "node1:a", Duration.ofSeconds(10)));
        assertFalse(lock.renew("ledger", "node1:b", Duration.ofSeconds(10)));

        verify(redis).execute(any(RedisScript.class), eq(Collections.singletonList("bonding:lock:ledger")),
                eq("node1:a"), eq("10000"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void redis_failure_on_renew_counts_as_lost() {
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        when(redis.execute(any(RedisScript.class), anyList(), any(), any()))
                .thenThrow(new RedisConnectionFailureException("down"));

        RedisLedgerLockManager lock = new RedisLedgerLockManager(redis);
        assertFalse(lock.renew("ledger", "node1:a", Duration.ofSeconds(10)));
    }
}
