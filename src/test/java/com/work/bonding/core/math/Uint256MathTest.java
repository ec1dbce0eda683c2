package com.work.bonding.core.math;

import com.work.bonding.core.exception.BondingError;
import com.work.bonding.core.exception.BondingException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class Uint256MathTest {

    @Test
    public void add_at_upper_bound_is_allowed() {
        assertEquals(Uint256Math.MAX_VALUE, Uint256Math.add(Uint256Math.MAX_VALUE.subtract(BigInteger.ONE), BigInteger.ONE));
    }

    @Test
    public void add_past_upper_bound_fails() {
        BondingException ex = assertThrows(BondingException.class,
                () -> Uint256Math.add(Uint256Math.MAX_VALUE, BigInteger.ONE));
        assertEquals(BondingError.ARITHMETIC_OVERFLOW, ex.getError());
    }

    @Test
    public void sub_below_zero_fails() {
        assertThrows(BondingException.class, () -> Uint256Math.sub(BigInteger.ONE, BigInteger.TEN));
    }

    @Test
    public void div_by_zero_fails() {
        assertThrows(BondingException.class, () -> Uint256Math.div(BigInteger.TEN, BigInteger.ZERO));
    }

    @Test
    public void negative_operand_is_rejected() {
        assertThrows(BondingException.class, () -> Uint256Math.mul(BigInteger.valueOf(-1), BigInteger.ONE));
        assertThrows(IllegalArgumentException.class, () -> Uint256Math.requireUint(null));
    }
}
