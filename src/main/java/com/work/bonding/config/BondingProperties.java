package com.work.bonding.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 从 application.yml 读取账本配置，再由配置类转换为 core 包所需的
 * {@link com.work.bonding.core.config.BondingConfig}。
 */
@ConfigurationProperties(prefix = "bonding")
public class BondingProperties {

    /**
     * 账本托管的 ERC-20 代币地址
     */
    private String tokenAddress;

    /**
     * 唯一可以 slash 的账户
     */
    private String authorityAddress;

    /**
     * 账本实例地址：参与 BondId 哈希，同时是托管账户
     */
    private String instanceAddress;

    /**
     * postgres 或 memory
     */
    private String storage = "postgres";

    /**
     * redis 或 memory
     */
    private String lockMode = "redis";

    private Duration lockTtl = Duration.ofSeconds(10);

    /**
     * 拿不到账本锁时最多等待多久，超过后返回可重试错误
     */
    private Duration lockWait = Duration.ofSeconds(3);

    /**
     * 当前节点标识，用作锁 owner 前缀
     */
    private String nodeId = "local";

    /**
     * 单笔操作的数据库事务时限。
     * chain.mode=web3j 时必须不小于 receipt-poll-interval × receipt-poll-attempts × 3
     * （replaceBond 最多三笔转账：返还、销毁、建新仓），启动时校验。
     */
    private Duration transactionTimeout = Duration.ofMinutes(5);

    public String getTokenAddress() {
        return tokenAddress;
    }

    public void setTokenAddress(String tokenAddress) {
        this.tokenAddress = tokenAddress;
    }

    public String getAuthorityAddress() {
        return authorityAddress;
    }

    public void setAuthorityAddress(String authorityAddress) {
        this.authorityAddress = authorityAddress;
    }

    public String getInstanceAddress() {
        return instanceAddress;
    }

    public void setInstanceAddress(String instanceAddress) {
        this.instanceAddress = instanceAddress;
    }

    public String getStorage() {
        return storage;
    }

    public void setStorage(String storage) {
        this.storage = storage;
    }

    public String getLockMode() {
        return lockMode;
    }

    public void setLockMode(String lockMode) {
        this.lockMode = lockMode;
    }

    public Duration getLockTtl() {
        return lockTtl;
    }

    public void setLockTtl(Duration lockTtl) {
        this.lockTtl = lockTtl;
    }

    public Duration getLockWait() {
        return lockWait;
    }

    public void setLockWait(Duration lockWait) {
        this.lockWait = lockWait;
    }

    public String getNodeId() {
        return nodeId;
    }

    public void setNodeId(String nodeId) {
        this.nodeId = nodeId;
    }

    public Duration getTransactionTimeout() {
        return transactionTimeout;
    }

    public void setTransactionTimeout(Duration transactionTimeout) {
        this.transactionTimeout = transactionTimeout;
    }
}
