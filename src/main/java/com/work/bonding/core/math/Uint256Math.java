package com.work.bonding.core.math;

import com.work.bonding.core.exception.BondingError;
import com.work.bonding.core.exception.BondingException;

import java.math.BigInteger;

/**
 * uint256 语义下的检查运算：结果超出 [0, 2^256 - 1] 时直接中止，而不是回绕。
 */
public final class Uint256Math {

    public static final BigInteger MAX_VALUE = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private Uint256Math() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static BigInteger add(BigInteger a, BigInteger b) {
        return checked(requireUint(a).add(requireUint(b)), "add");
    }

    public static BigInteger sub(BigInteger a, BigInteger b) {
        return checked(requireUint(a).subtract(requireUint(b)), "sub");
    }

    public static BigInteger mul(BigInteger a, BigInteger b) {
        return checked(requireUint(a).multiply(requireUint(b)), "mul");
    }

    public static BigInteger div(BigInteger a, BigInteger b) {
        if (requireUint(b).signum() == 0) {
            throw new BondingException(BondingError.ARITHMETIC_OVERFLOW, "除数为 0");
        }
        return requireUint(a).divide(b);
    }

    public static BigInteger requireUint(BigInteger value) {
        if (value == null) {
            throw new IllegalArgumentException("操作数不能为null");
        }
        return checked(value, "operand");
    }

    private static BigInteger checked(BigInteger value, String op) {
        if (value.signum() < 0 || value.compareTo(MAX_VALUE) > 0) {
            throw new BondingException(BondingError.ARITHMETIC_OVERFLOW, "uint256 " + op + " 越界: " + value);
        }
        return value;
    }
}
