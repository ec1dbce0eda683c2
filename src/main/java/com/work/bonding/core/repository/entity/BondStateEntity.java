package com.work.bonding.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.math.BigInteger;
import java.time.Instant;

@TableName("bond_state")
public class BondStateEntity {

    @TableId(type = IdType.INPUT)
    private String bondId;

    private Boolean active;

    private BigInteger slashedAtStart;

    /**
     * 0 表示尚未申请解绑。
     */
    private Long willUnlock;

    private Instant createdAt;

    public String getBondId() {
        return bondId;
    }

    public void setBondId(String bondId) {
        this.bondId = bondId;
    }

    public Boolean getActive() {
        return active;
    }

    public void setActive(Boolean active) {
        this.active = active;
    }

    public BigInteger getSlashedAtStart() {
        return slashedAtStart;
    }

    public void setSlashedAtStart(BigInteger slashedAtStart) {
        this.slashedAtStart = slashedAtStart;
    }

    public Long getWillUnlock() {
        return willUnlock;
    }

    public void setWillUnlock(Long willUnlock) {
        this.willUnlock = willUnlock;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
