package com.work.bonding.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.math.BigInteger;
import java.time.Instant;

@TableName("pool_slash_points")
public class PoolSlashPointsEntity {

    @TableId(type = IdType.INPUT)
    private String poolId;

    private BigInteger slashPoints;

    private Instant updatedAt;

    public String getPoolId() {
        return poolId;
    }

    public void setPoolId(String poolId) {
        this.poolId = poolId;
    }

    public BigInteger getSlashPoints() {
        return slashPoints;
    }

    public void setSlashPoints(BigInteger slashPoints) {
        this.slashPoints = slashPoints;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
