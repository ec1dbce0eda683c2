package com.work.bonding.web.dto;

import java.math.BigInteger;

/**
 * 写操作的统一返回体，按操作填充对应字段，未涉及的字段为 null。
 */
public class BondOperationView {

    private String bondId;

    /** requestUnbond：解锁时间（epoch 秒）。 */
    private Long willUnlock;

    /** unbond：返还给 owner 的金额。 */
    private BigInteger payout;

    /** unbond：转入销毁地址的金额。 */
    private BigInteger burned;

    /** withdraw-amount 查询结果。 */
    private BigInteger withdrawAmount;

    public static BondOperationView ofBond(String bondId) {
        BondOperationView v = new BondOperationView();
        v.setBondId(bondId);
        return v;
    }

    public String getBondId() {
        return bondId;
    }

    public void setBondId(String bondId) {
        this.bondId = bondId;
    }

    public Long getWillUnlock() {
        return willUnlock;
    }

    public void setWillUnlock(Long willUnlock) {
        this.willUnlock = willUnlock;
    }

    public BigInteger getPayout() {
        return payout;
    }

    public void setPayout(BigInteger payout) {
        this.payout = payout;
    }

    public BigInteger getBurned() {
        return burned;
    }

    public void setBurned(BigInteger burned) {
        this.burned = burned;
    }

    public BigInteger getWithdrawAmount() {
        return withdrawAmount;
    }

    public void setWithdrawAmount(BigInteger withdrawAmount) {
        this.withdrawAmount = withdrawAmount;
    }
}
