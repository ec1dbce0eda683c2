package com.work.bonding.core.config;

import java.time.Duration;

import static com.work.bonding.core.support.ValidationUtils.requireAddress;
import static com.work.bonding.core.support.ValidationUtils.requireNonEmpty;
import static com.work.bonding.core.support.ValidationUtils.requirePositive;

/**
 * 纯组件侧的配置定义，不依赖任意框架。宿主应用（如 Spring Boot）只需在装配时
 * 将自身读取到的配置参数注入即可。
 * <p>
 * tokenAddress / authorityAddress / instanceAddress 在构造后不可变：
 * instanceAddress 既参与 BondId 的哈希，也是托管代币的账户。
 */
public class BondingConfig {

    public static final Duration DEFAULT_TRANSACTION_TIMEOUT = Duration.ofMinutes(5);

    private final String tokenAddress;
    private final String authorityAddress;
    private final String instanceAddress;
    private final Duration lockTtl;
    private final Duration lockWait;
    private final String lockOwner;
    private final Duration transactionTimeout;

    public BondingConfig(String tokenAddress,
                         String authorityAddress,
                         String instanceAddress,
                         Duration lockTtl,
                         Duration lockWait,
                         String lockOwner) {
        this(tokenAddress, authorityAddress, instanceAddress, lockTtl, lockWait, lockOwner, DEFAULT_TRANSACTION_TIMEOUT);
    }

    /**
     * @param transactionTimeout 单笔操作的数据库事务时限，必须覆盖操作内全部转账的最长等待时间
     */
    public BondingConfig(String tokenAddress,
                         String authorityAddress,
                         String instanceAddress,
                         Duration lockTtl,
                         Duration lockWait,
                         String lockOwner,
                         Duration transactionTimeout) {
        this.tokenAddress = requireAddress(tokenAddress, "tokenAddress");
        this.authorityAddress = requireAddress(authorityAddress, "authorityAddress");
        this.instanceAddress = requireAddress(instanceAddress, "instanceAddress");
        this.lockTtl = requirePositive(lockTtl, "lockTtl");
        this.lockWait = requirePositive(lockWait, "lockWait");
        this.lockOwner = requireNonEmpty(lockOwner, "lockOwner");
        this.transactionTimeout = requirePositive(transactionTimeout, "transactionTimeout");
    }

    public String getTokenAddress() {
        return tokenAddress;
    }

    public String getAuthorityAddress() {
        return authorityAddress;
    }

    public String getInstanceAddress() {
        return instanceAddress;
    }

    public Duration getLockTtl() {
        return lockTtl;
    }

    public Duration getLockWait() {
        return lockWait;
    }

    public String getLockOwner() {
        return lockOwner;
    }

    public Duration getTransactionTimeout() {
        return transactionTimeout;
    }
}
