package com.work.bonding.core.lock;

import java.time.Duration;

/**
 * 账本全局锁：保证任一时刻只有一笔操作在读写账本状态。
 * <p>
 * 锁带 TTL 防止持有者崩溃后永久占用；操作耗时可能超过 TTL（例如等待链上 receipt），
 * 持有期间由执行器按 {@link #renew} 周期续期，续期失败即视为锁已丢失。
 */
public interface LedgerLockManager {

    /**
     * 尝试获取锁。
     *
     * @param lockKey   锁名
     * @param lockOwner 本次操作的唯一标识
     * @param ttl       锁超时时间
     * @return true 表示加锁成功
     */
    boolean tryLock(String lockKey, String lockOwner, Duration ttl);

    /**
     * 仅当锁仍由 lockOwner 持有且未过期时，把过期时间重置为 ttl。
     *
     * @return false 表示锁已过期或已被其他 owner 持有
     */
    boolean renew(String lockKey, String lockOwner, Duration ttl);

    /**
     * 释放锁，只删除 lockOwner 自己持有的锁。
     */
    void unlock(String lockKey, String lockOwner);
}
