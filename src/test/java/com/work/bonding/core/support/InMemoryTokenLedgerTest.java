package com.work.bonding.core.support;

import com.work.bonding.core.exception.TokenTransferException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryTokenLedgerTest {

    private static final String TOKEN = "0x1111111111111111111111111111111111111111";
    private static final String CUSTODY = "0x3333333333333333333333333333333333333333";
    private static final String ALICE = "0x4444444444444444444444444444444444444444";
    private static final String BOB = "0x5555555555555555555555555555555555555555";

    @Test
    public void transfer_from_consumes_allowance_granted_to_custody() {
        InMemoryTokenLedger ledger = new InMemoryTokenLedger(CUSTODY);
        ledger.mint(TOKEN, ALICE, BigInteger.valueOf(100));
        ledger.approve(TOKEN, ALICE, CUSTODY, BigInteger.valueOf(60));

        ledger.transferFrom(TOKEN, ALICE, CUSTODY, BigInteger.valueOf(50));
        assertEquals(BigInteger.valueOf(50), ledger.balanceOf(TOKEN, ALICE));
        assertEquals(BigInteger.valueOf(50), ledger.balanceOf(TOKEN, CUSTODY));

        assertThrows(TokenTransferException.class,
                () -> ledger.transferFrom(TOKEN, ALICE, CUSTODY, BigInteger.valueOf(20)));
    }

    @Test
    public void transfer_pays_out_of_custody_only() {
        InMemoryTokenLedger ledger = new InMemoryTokenLedger(CUSTODY);
        ledger.mint(TOKEN, CUSTODY, BigInteger.TEN);

        ledger.transfer(TOKEN, BOB, BigInteger.valueOf(4));
        assertEquals(BigInteger.valueOf(4), ledger.balanceOf(TOKEN, BOB));
        assertThrows(TokenTransferException.class, () -> ledger.transfer(TOKEN, BOB, BigInteger.TEN));
        assertEquals(BigInteger.valueOf(6), ledger.balanceOf(TOKEN, CUSTODY));
    }

    @Test
    public void allowance_granted_to_someone_else_does_not_count() {
        InMemoryTokenLedger ledger = new InMemoryTokenLedger(CUSTODY);
        ledger.mint(TOKEN, ALICE, BigInteger.valueOf(100));
        ledger.approve(TOKEN, ALICE, BOB, BigInteger.valueOf(100));

        assertThrows(TokenTransferException.class,
                () -> ledger.transferFrom(TOKEN, ALICE, CUSTODY, BigInteger.ONE));
    }
}
