package com.work.bonding.core.exception;

/**
 * 操作执行期间账本锁续期失败。本地状态会整体回滚，但执行器不会自动重放该操作：
 * 链上转账可能已经发出，需要人工对账后再决定是否重试。
 */
public class LedgerLockLostException extends BondingException {

    public LedgerLockLostException(String message) {
        super(BondingError.LEDGER_BUSY, message);
    }
}
