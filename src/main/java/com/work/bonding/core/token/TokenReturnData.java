package com.work.bonding.core.token;

import org.web3j.utils.Numeric;

import java.math.BigInteger;

/**
 * ERC-20 transfer / transferFrom 返回值的兼容判定：
 * <ul>
 *     <li>没有返回值（部分老代币不遵循标准）视为成功</li>
 *     <li>返回 32 字节 bool，非 0 为成功</li>
 *     <li>其余情况（返回 false、长度不合法）视为失败</li>
 * </ul>
 */
public final class TokenReturnData {

    private static final int WORD_HEX_LENGTH = 64;

    private TokenReturnData() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static boolean isSuccess(String returnData) {
        String clean = returnData == null ? "" : Numeric.cleanHexPrefix(returnData.trim());
        if (clean.isEmpty()) {
            return true;
        }
        if (clean.length() != WORD_HEX_LENGTH) {
            return false;
        }
        try {
            return new BigInteger(clean, 16).signum() != 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
