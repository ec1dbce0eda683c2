package com.work.bonding.core.exception;

/**
 * 账本拒绝一次操作的原因。全部是前置条件失败，发生时不会留下任何状态变更。
 */
public enum BondingError {

    NOT_AUTHORIZED("调用方不是 slash 权限账户"),
    POINTS_TOO_HIGH("slash 后累计值将超过 100%"),
    BOND_ALREADY_ACTIVE("该 bond 已处于 active 状态"),
    POOL_FULLY_SLASHED("池子已被 100% slash，不能再建仓"),
    BOND_NOT_ACTIVE("bond 不存在或已结束"),
    BOND_NOT_UNLOCKED("bond 尚未申请解绑或时间锁未到期"),
    POOL_ID_MISMATCH("替换前后的 poolId 不一致"),
    NEW_BOND_TOO_SMALL("新 bond 金额小于旧 bond 的可提取金额"),
    TRANSFER_FAILED("代币转账失败"),
    ARITHMETIC_OVERFLOW("256 位整数运算溢出"),
    LEDGER_BUSY("账本正忙，请稍后重试");

    private final String description;

    BondingError(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
