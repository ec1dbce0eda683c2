package com.work.bonding.core.exception;

/**
 * 转账原语失败（余额/授权不足、合约 revert、返回 false 等），整笔操作随之中止。
 */
public class TokenTransferException extends BondingException {

    public TokenTransferException(String message) {
        super(BondingError.TRANSFER_FAILED, message);
    }

    public TokenTransferException(String message, Throwable cause) {
        super(BondingError.TRANSFER_FAILED, message, cause);
    }
}
