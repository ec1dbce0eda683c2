package com.work.bonding.core.identity;

import com.work.bonding.core.model.BondId;
import com.work.bonding.core.model.BondIntent;
import com.work.bonding.core.model.PoolId;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class BondIdentityTest {

    private static final String INSTANCE = "0x3333333333333333333333333333333333333333";
    private static final String OWNER = "0xAbCdEf0123456789aBcDeF0123456789AbCdEf01";
    private static final PoolId POOL = PoolId.fromHex("0x" + repeat("ab", 32));

    @Test
    public void id_matches_abi_encoded_keccak() {
        BondIdentity identity = new BondIdentity(INSTANCE);
        BondIntent intent = new BondIntent(BigInteger.valueOf(1000), POOL, BigInteger.valueOf(7));

        String encoded = word("3333333333333333333333333333333333333333")
                + word("abcdef0123456789abcdef0123456789abcdef01")
                + word(Long.toHexString(1000))
                + repeat("ab", 32)
                + word("7");
        byte[] expected = Hash.sha3(Numeric.hexStringToByteArray(encoded));

        assertEquals(BondId.of(expected), identity.derive(OWNER, intent));
    }

    @Test
    public void owner_case_does_not_change_id() {
        BondIdentity identity = new BondIdentity(INSTANCE);
        BondIntent intent = BondIntent.of(1000, POOL, 1);
        assertEquals(identity.derive(OWNER, intent), identity.derive(OWNER.toLowerCase(), intent));
    }

    @Test
    public void every_field_participates() {
        BondIdentity identity = new BondIdentity(INSTANCE);
        BondId base = identity.derive(OWNER, BondIntent.of(1000, POOL, 1));

        assertNotEquals(base, identity.derive("0x4444444444444444444444444444444444444444", BondIntent.of(1000, POOL, 1)));
        assertNotEquals(base, identity.derive(OWNER, BondIntent.of(1001, POOL, 1)));
        assertNotEquals(base, identity.derive(OWNER, BondIntent.of(1000, POOL, 2)));
        assertNotEquals(base, identity.derive(OWNER, BondIntent.of(1000, PoolId.of(new byte[32]), 1)));
        assertNotEquals(base, new BondIdentity("0x5555555555555555555555555555555555555555")
                .derive(OWNER, BondIntent.of(1000, POOL, 1)));
    }

    @Test
    public void invalid_owner_is_rejected() {
        BondIdentity identity = new BondIdentity(INSTANCE);
        assertThrows(IllegalArgumentException.class, () -> identity.derive("0x1234", BondIntent.of(1, POOL, 1)));
    }

    private static String word(String hex) {
        return repeat("0", 64 - hex.length()) + hex;
    }

    private static String repeat(String s, int n) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < n; i++) {
            sb.append(s);
        }
        return sb.toString();
    }
}
