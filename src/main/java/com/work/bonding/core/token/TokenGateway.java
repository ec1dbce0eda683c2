package com.work.bonding.core.token;

import java.math.BigInteger;

/**
 * 代币转账原语。任何失败都必须以异常形式抛出（{@link com.work.bonding.core.exception.TokenTransferException}），
 * 由外层事务整体回滚，不允许留下部分转账。
 */
public interface TokenGateway {

    /**
     * 从 from 账户向 to 转账，需要 from 事先对账本托管账户授权。
     */
    void transferFrom(String token, String from, String to, BigInteger amount);

    /**
     * 从账本托管账户向 to 转账。
     */
    void transfer(String token, String to, BigInteger amount);
}
