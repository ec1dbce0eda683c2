package com.work.bonding.web;

import com.work.bonding.core.exception.BondingError;
import com.work.bonding.core.exception.BondingException;
import com.work.bonding.core.exception.LedgerBusyException;
import com.work.bonding.core.exception.TokenTransferException;
import com.work.bonding.web.dto.ErrorView;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

public class LedgerExceptionHandlerTest {

    private final LedgerExceptionHandler handler = new LedgerExceptionHandler();

    @Test
    public void ledger_errors_map_to_status_codes() {
        assertEquals(HttpStatus.FORBIDDEN, LedgerExceptionHandler.statusOf(new BondingException(BondingError.NOT_AUTHORIZED, "x")));
        assertEquals(HttpStatus.CONFLICT, LedgerExceptionHandler.statusOf(new BondingException(BondingError.BOND_ALREADY_ACTIVE, "x")));
        assertEquals(HttpStatus.CONFLICT, LedgerExceptionHandler.statusOf(new BondingException(BondingError.BOND_NOT_ACTIVE, "x")));
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, LedgerExceptionHandler.statusOf(new BondingException(BondingError.NEW_BOND_TOO_SMALL, "x")));
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, LedgerExceptionHandler.statusOf(new TokenTransferException("x")));
    }

    @Test
    public void busy_ledger_is_marked_retryable() {
        ResponseEntity<ErrorView> resp = handler.handleBonding(new LedgerBusyException("busy"));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, resp.getStatusCode());
        assertEquals("LEDGER_BUSY", resp.getBody().getError());
        assertTrue(resp.getBody().isRetryable());
    }

    @Test
    public void bad_input_is_400() {
        ResponseEntity<ErrorView> resp = handler.handleIllegalArgument(new IllegalArgumentException("poolId 必须为 32 字节"));
        assertEquals(HttpStatus.BAD_REQUEST, resp.getStatusCode());
        assertFalse(resp.getBody().isRetryable());
    }
}
