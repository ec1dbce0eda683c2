package com.work.bonding.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.web3j.utils.Numeric;

import java.util.Arrays;

/**
 * 池标识：调用方提供的 32 字节不透明值，账本只做相等比较，不解释其含义。
 */
public final class PoolId {

    public static final int LENGTH = 32;

    private final byte[] value;

    private PoolId(byte[] value) {
        this.value = value;
    }

    public static PoolId of(byte[] value) {
        if (value == null || value.length != LENGTH) {
            throw new IllegalArgumentException("poolId 必须为 32 字节");
        }
        return new PoolId(value.clone());
    }

    /**
     * 解析 0x 开头的 64 位十六进制字符串。
     */
    @JsonCreator
    public static PoolId fromHex(String hex) {
        return of(Bytes32Hex.parse(hex, "poolId"));
    }

    public byte[] toBytes() {
        return value.clone();
    }

    @JsonValue
    public String toHex() {
        return Numeric.toHexString(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(value, ((PoolId) o).value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
