package com.work.bonding.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.bonding.core.repository.entity.PoolSlashPointsEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.math.BigInteger;
import java.time.Instant;

public interface PoolSlashPointsMapper extends BaseMapper<PoolSlashPointsEntity> {

    @Select("SELECT pool_id, slash_points, updated_at FROM pool_slash_points WHERE pool_id = #{poolId}")
    PoolSlashPointsEntity selectByPoolId(@Param("poolId") String poolId);

    @Insert("INSERT INTO pool_slash_points (pool_id, slash_points, updated_at) " +
            "VALUES (#{poolId}, #{slashPoints}, #{updatedAt}) " +
            "ON CONFLICT (pool_id) DO UPDATE SET slash_points = EXCLUDED.slash_points, updated_at = EXCLUDED.updated_at")
    int upsert(@Param("poolId") String poolId,
               @Param("slashPoints") BigInteger slashPoints,
               @Param("updatedAt") Instant updatedAt);
}
