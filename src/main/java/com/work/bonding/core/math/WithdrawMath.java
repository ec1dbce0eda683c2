package com.work.bonding.core.math;

import java.math.BigInteger;

import static com.work.bonding.core.config.BondingConstants.MAX_SLASH;

/**
 * 按比例计算 bond 可提取金额：
 * <pre>
 *     payout = amount * (MAX_SLASH - slashPoints) / (MAX_SLASH - slashedAtStart)
 * </pre>
 * 先乘后除，只对建仓之后发生的 slash 折算。
 */
public final class WithdrawMath {

    private WithdrawMath() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * @param amount         bond 金额
     * @param slashPoints    池子当前累计 slash points
     * @param slashedAtStart 建仓时的快照，必须小于 MAX_SLASH 且不大于 slashPoints
     */
    public static BigInteger calcWithdrawAmount(BigInteger amount, BigInteger slashPoints, BigInteger slashedAtStart) {
        if (slashedAtStart.compareTo(slashPoints) > 0) {
            throw new IllegalStateException("slashedAtStart 不能大于当前 slashPoints: "
                    + slashedAtStart + " > " + slashPoints);
        }
        BigInteger remaining = Uint256Math.sub(MAX_SLASH, slashPoints);
        BigInteger remainingAtStart = Uint256Math.sub(MAX_SLASH, slashedAtStart);
        return Uint256Math.div(Uint256Math.mul(amount, remaining), remainingAtStart);
    }
}
