package com.work.bonding.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.web3j.utils.Numeric;

import java.util.Arrays;

/**
 * bond 标识，由 {@link com.work.bonding.core.identity.BondIdentity} 对 (instance, owner, amount, poolId, nonce)
 * 做 keccak256 得到。相同 owner 的相同意图总会落到同一个 BondId 上。
 */
public final class BondId {

    private final byte[] value;

    private BondId(byte[] value) {
        this.value = value;
    }

    public static BondId of(byte[] value) {
        if (value == null || value.length != 32) {
            throw new IllegalArgumentException("bondId 必须为 32 字节");
        }
        return new BondId(value.clone());
    }

    @JsonCreator
    public static BondId fromHex(String hex) {
        return of(Bytes32Hex.parse(hex, "bondId"));
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
        return Arrays.equals(value, ((BondId) o).value);
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
