package com.work.bonding.core.config;

import java.math.BigInteger;
import java.time.Duration;

/**
 * 账本的固定常量，部署后不可调整。
 */
public final class BondingConstants {

    /**
     * 100% slash 对应的刻度（10^18）。
     */
    public static final BigInteger MAX_SLASH = BigInteger.TEN.pow(18);

    /**
     * 申请解绑到可以提取之间的时间锁。
     */
    public static final Duration UNBOND_DELAY = Duration.ofDays(30);

    /**
     * 被 slash 掉的部分转入的销毁地址。部分代币拒绝向零地址转账，所以不用 0x0。
     */
    public static final String BURN_ADDRESS = "0x000000000000000000000000000000000000dead";

    private BondingConstants() {
        throw new AssertionError("常量类不允许实例化");
    }
}
