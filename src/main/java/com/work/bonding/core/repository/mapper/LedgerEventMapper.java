package com.work.bonding.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.bonding.core.repository.entity.LedgerEventEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface LedgerEventMapper extends BaseMapper<LedgerEventEntity> {

    @Select("SELECT seq, event_type, event_time, payload FROM ledger_event " +
            "WHERE seq > COALESCE(#{afterSeq,jdbcType=BIGINT}, 0) ORDER BY seq ASC LIMIT #{limit}")
    List<LedgerEventEntity> listAfterSeq(@Param("afterSeq") Long afterSeq, @Param("limit") int limit);
}
