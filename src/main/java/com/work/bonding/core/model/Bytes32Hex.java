package com.work.bonding.core.model;

import org.web3j.utils.Numeric;

import java.util.regex.Pattern;

final class Bytes32Hex {

    private static final Pattern BYTES32_PATTERN = Pattern.compile("^0x[0-9a-fA-F]{64}$");

    private Bytes32Hex() {
        throw new AssertionError("工具类不允许实例化");
    }

    static byte[] parse(String hex, String paramName) {
        if (hex == null || !BYTES32_PATTERN.matcher(hex.trim()).matches()) {
            throw new IllegalArgumentException(paramName + " 非法，必须是 0x 开头的 32 字节十六进制");
        }
        return Numeric.hexStringToByteArray(hex.trim());
    }
}
