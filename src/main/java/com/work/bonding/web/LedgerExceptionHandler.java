package com.work.bonding.web;

import com.work.bonding.core.exception.BondingException;
import com.work.bonding.web.dto.ErrorView;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 账本异常到 HTTP 状态码的映射：权限 403，锁竞争 503，其余规则拒绝 409/422，参数错误 400。
 */
@RestControllerAdvice
public class LedgerExceptionHandler {

    @ExceptionHandler(BondingException.class)
    public ResponseEntity<ErrorView> handleBonding(BondingException e) {
        return ResponseEntity.status(statusOf(e))
                .body(new ErrorView(e.getError().name(), e.getMessage(), e.isRetryable()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorView> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorView("INVALID_ARGUMENT", e.getMessage(), false));
    }

    static HttpStatus statusOf(BondingException e) {
        switch (e.getError()) {
            case NOT_AUTHORIZED:
                return HttpStatus.FORBIDDEN;
            case LEDGER_BUSY:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case BOND_ALREADY_ACTIVE:
            case BOND_NOT_ACTIVE:
                return HttpStatus.CONFLICT;
            default:
                return HttpStatus.UNPROCESSABLE_ENTITY;
        }
    }
}
