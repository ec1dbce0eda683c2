package com.work.bonding.core.exception;

/**
 * 账本统一异常类型，携带 {@link BondingError}，便于业务侧捕获或转换为 HTTP/RPC 错误码。
 */
public class BondingException extends RuntimeException {

    private final BondingError error;

    public BondingException(BondingError error, String message) {
        super(message);
        this.error = error;
    }

    public BondingException(BondingError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public BondingError getError() {
        return error;
    }

    /**
     * 标识该异常是否可通过重试解决。账本规则类的拒绝默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}
