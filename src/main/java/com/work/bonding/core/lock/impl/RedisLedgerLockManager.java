package com.work.bonding.core.lock.impl;

import com.work.bonding.core.exception.LedgerBusyException;
import com.work.bonding.core.lock.LedgerLockManager;
import com.work.bonding.core.support.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.Collections;

import static com.work.bonding.core.support.ValidationUtils.requireNonEmpty;
import static com.work.bonding.core.support.ValidationUtils.requirePositive;

/**
 * 基于 Redis 的分布式锁实现
 *
 * 特性：
 * 1. SET NX + 过期时间，锁超时自动释放
 * 2. 续期与释放都用 Lua 脚本校验 owner，不会延长或删除其他实例的锁
 */
public class RedisLedgerLockManager implements LedgerLockManager {

    private static final String LOCK_KEY_PREFIX = "bonding:lock:";
    private static final Logger LOGGER = LoggerFactory.getLogger(RedisLedgerLockManager.class);

    // 只有锁的 owner 匹配时才删除
    private static final String UNLOCK_SCRIPT =
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
            "    return redis.call('del', KEYS[1]) " +
            "else " +
            "    return 0 " +
            "end";

    // 只有锁的 owner 匹配时才重置过期时间
    private static final String RENEW_SCRIPT =
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
            "    return redis.call('pexpire', KEYS[1], ARGV[2]) " +
            "else " +
            "    return 0 " +
            "end";

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> unlockScript;
    private final DefaultRedisScript<Long> renewScript;

    public RedisLedgerLockManager(StringRedisTemplate redisTemplate) {
        this.redisTemplate = ValidationUtils.requireNonNull(redisTemplate, "redisTemplate");
        this.unlockScript = new DefaultRedisScript<>();
        this.unlockScript.setScriptText(UNLOCK_SCRIPT);
        this.unlockScript.setResultType(Long.class);
        this.renewScript = new DefaultRedisScript<>();
        this.renewScript.setScriptText(RENEW_SCRIPT);
        this.renewScript.setResultType(Long.class);
    }

    /**
     * @throws LedgerBusyException 如果 Redis 操作异常
     */
    @Override
    public boolean tryLock(String lockKey, String lockOwner, Duration ttl) {
        requireNonEmpty(lockKey, "lockKey");
        requireNonEmpty(lockOwner, "lockOwner");
        requirePositive(ttl, "ttl");

        String key = LOCK_KEY_PREFIX + lockKey;
        try {
            Boolean result = redisTemplate.opsForValue().setIfAbsent(key, lockOwner, ttl);
            return Boolean.TRUE.equals(result);
        } catch (Exception e) {
            throw new LedgerBusyException("Redis 加锁异常: " + lockKey, e);
        }
    }

    /**
     * Redis 异常时返回 false，由调用方按锁丢失处理。
     */
    @Override
    public boolean renew(String lockKey, String lockOwner, Duration ttl) {
        requireNonEmpty(lockKey, "lockKey");
        requireNonEmpty(lockOwner, "lockOwner");
        requirePositive(ttl, "ttl");

        String key = LOCK_KEY_PREFIX + lockKey;
        try {
            Long result = redisTemplate.execute(renewScript, Collections.singletonList(key),
                    lockOwner, String.valueOf(ttl.toMillis()));
            return result != null && result == 1L;
        } catch (Exception e) {
            LOGGER.warn("[bonding] Redis 续期锁异常: lockKey={}, owner={}", lockKey, lockOwner, e);
            return false;
        }
    }

    @Override
    public void unlock(String lockKey, String lockOwner) {
        requireNonEmpty(lockKey, "lockKey");
        requireNonEmpty(lockOwner, "lockOwner");

        String key = LOCK_KEY_PREFIX + lockKey;
        try {
            Long result = redisTemplate.execute(unlockScript, Collections.singletonList(key), lockOwner);
            if (result == null || result == 0) {
                // 锁已过期或已被其他实例持有
                LOGGER.debug("[bonding] unlock noop, key may be expired or owned by others, lockKey={}, owner={}",
                        lockKey, lockOwner);
            }
        } catch (Exception e) {
            // 锁最终会因 TTL 过期释放，这里只记录
            LOGGER.warn("[bonding] Redis 释放锁异常: lockKey={}, owner={}", lockKey, lockOwner, e);
        }
    }
}
