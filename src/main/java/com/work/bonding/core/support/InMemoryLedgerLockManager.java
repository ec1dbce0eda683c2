package com.work.bonding.core.support;

import com.work.bonding.core.lock.LedgerLockManager;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 单进程部署使用的账本锁：不可重入，带 TTL，过期后可被其他 owner 抢占。
 * 语义与 {@link com.work.bonding.core.lock.impl.RedisLedgerLockManager} 一致，包括 owner 校验的续期与释放。
 */
public class InMemoryLedgerLockManager implements LedgerLockManager {

    private static final class Holder {
        final String owner;
        final Instant expireAt;

        Holder(String owner, Instant expireAt) {
            this.owner = owner;
            this.expireAt = expireAt;
        }

        boolean isHeldBy(String lockOwner, Instant now) {
            return owner.equals(lockOwner) && expireAt.isAfter(now);
        }
    }

    private final Map<String, Holder> holders = new ConcurrentHashMap<>();

    @Override
    public boolean tryLock(String lockKey, String lockOwner, Duration ttl) {
        Instant now = Instant.now();
        Holder candidate = new Holder(lockOwner, now.plus(ttl));
        Holder current = holders.compute(lockKey, (key, existing) ->
                existing == null || !existing.expireAt.isAfter(now) ? candidate : existing);
        return current == candidate;
    }

    @Override
    public boolean renew(String lockKey, String lockOwner, Duration ttl) {
        Instant now = Instant.now();
        Holder renewed = new Holder(lockOwner, now.plus(ttl));
        Holder current = holders.computeIfPresent(lockKey, (key, existing) ->
                existing.isHeldBy(lockOwner, now) ? renewed : existing);
        return current == renewed;
    }

    @Override
    public void unlock(String lockKey, String lockOwner) {
        holders.computeIfPresent(lockKey, (key, existing) -> existing.owner.equals(lockOwner) ? null : existing);
    }
}
