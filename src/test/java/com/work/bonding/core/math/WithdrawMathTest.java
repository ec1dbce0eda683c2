package com.work.bonding.core.math;

import com.work.bonding.core.exception.BondingError;
import com.work.bonding.core.exception.BondingException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.work.bonding.core.config.BondingConstants.MAX_SLASH;
import static org.junit.jupiter.api.Assertions.*;

public class WithdrawMathTest {

    private static final BigInteger E17 = BigInteger.TEN.pow(17);

    @Test
    public void slash_after_bond_reduces_payout_pro_rata() {
        BigInteger out = WithdrawMath.calcWithdrawAmount(BigInteger.valueOf(1000), E17.multiply(BigInteger.valueOf(2)), BigInteger.ZERO);
        assertEquals(BigInteger.valueOf(800), out);
    }

    @Test
    public void only_slash_after_snapshot_is_applied() {
        BigInteger out = WithdrawMath.calcWithdrawAmount(BigInteger.valueOf(1000),
                E17.multiply(BigInteger.valueOf(3)), E17.multiply(BigInteger.valueOf(2)));
        assertEquals(BigInteger.valueOf(875), out);
    }

    @Test
    public void unchanged_pool_returns_full_amount() {
        BigInteger snapshot = E17.multiply(BigInteger.valueOf(4));
        assertEquals(BigInteger.valueOf(12345), WithdrawMath.calcWithdrawAmount(BigInteger.valueOf(12345), snapshot, snapshot));
    }

    @Test
    public void fully_slashed_pool_pays_nothing() {
        assertEquals(BigInteger.ZERO, WithdrawMath.calcWithdrawAmount(BigInteger.valueOf(1000), MAX_SLASH, E17));
    }

    @Test
    public void result_rounds_down() {
        // 10 * (1e18 - 1) / 1e18 = 9.99... -> 9
        BigInteger out = WithdrawMath.calcWithdrawAmount(BigInteger.TEN, BigInteger.ONE, BigInteger.ZERO);
        assertEquals(BigInteger.valueOf(9), out);
    }

    @Test
    public void snapshot_above_current_points_is_rejected() {
        assertThrows(IllegalStateException.class,
                () -> WithdrawMath.calcWithdrawAmount(BigInteger.TEN, BigInteger.ONE, BigInteger.valueOf(2)));
    }

    @Test
    public void huge_amount_overflows_instead_of_wrapping() {
        BondingException ex = assertThrows(BondingException.class,
                () -> WithdrawMath.calcWithdrawAmount(Uint256Math.MAX_VALUE, BigInteger.ZERO, BigInteger.ZERO));
        assertEquals(BondingError.ARITHMETIC_OVERFLOW, ex.getError());
    }
}
