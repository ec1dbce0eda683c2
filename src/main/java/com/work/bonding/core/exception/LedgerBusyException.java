package com.work.bonding.core.exception;

/**
 * 未能在等待时间内拿到账本全局锁，调用方应当退避后重试。
 */
public class LedgerBusyException extends BondingException {

    public LedgerBusyException(String message) {
        super(BondingError.LEDGER_BUSY, message);
    }

    public LedgerBusyException(String message, Throwable cause) {
        super(BondingError.LEDGER_BUSY, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
