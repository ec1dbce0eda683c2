package com.work.bonding.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.bonding.core.repository.entity.BondStateEntity;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.math.BigInteger;
import java.time.Instant;

public interface BondStateMapper extends BaseMapper<BondStateEntity> {

    @Select("SELECT bond_id, active, slashed_at_start, will_unlock, created_at FROM bond_state WHERE bond_id = #{bondId}")
    BondStateEntity selectByBondId(@Param("bondId") String bondId);

    @Insert("INSERT INTO bond_state (bond_id, active, slashed_at_start, will_unlock, created_at) " +
            "VALUES (#{bondId}, TRUE, #{slashedAtStart}, #{willUnlock}, #{createdAt})")
    int insertActive(@Param("bondId") String bondId,
                     @Param("slashedAtStart") BigInteger slashedAtStart,
                     @Param("willUnlock") long willUnlock,
                     @Param("createdAt") Instant createdAt);

    /**
     * 只在尚未申请解绑时写入，返回 0 表示记录不存在或已写过。
     */
    @Update("UPDATE bond_state SET will_unlock = #{willUnlock} WHERE bond_id = #{bondId} AND will_unlock = 0")
    int updateWillUnlock(@Param("bondId") String bondId, @Param("willUnlock") long willUnlock);

    @Delete("DELETE FROM bond_state WHERE bond_id = #{bondId}")
    int deleteByBondId(@Param("bondId") String bondId);
}
