package com.work.bonding.core.repository.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.bonding.core.event.LedgerEvent;
import com.work.bonding.core.event.LedgerEventRecord;
import com.work.bonding.core.repository.LedgerEventLog;
import com.work.bonding.core.repository.entity.LedgerEventEntity;
import com.work.bonding.core.repository.mapper.LedgerEventMapper;

import java.util.ArrayList;
import java.util.List;

import static com.work.bonding.core.support.ValidationUtils.requireNonNull;

/**
 * 通知日志落在 ledger_event 表，seq 由数据库自增生成；payload 为 Jackson 序列化的事件 JSON。
 */
public class PostgresLedgerEventLog implements LedgerEventLog {

    private final LedgerEventMapper eventMapper;
    private final ObjectMapper objectMapper;

    public PostgresLedgerEventLog(LedgerEventMapper eventMapper, ObjectMapper objectMapper) {
        this.eventMapper = eventMapper;
        this.objectMapper = objectMapper;
    }

    @Override
    public long append(LedgerEvent event) {
        requireNonNull(event, "event");
        LedgerEventEntity entity = new LedgerEventEntity();
        entity.setEventType(event.getType());
        entity.setEventTime(event.getTime());
        try {
            entity.setPayload(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("事件序列化失败: " + event.getType(), e);
        }
        eventMapper.insert(entity);
        return entity.getSeq();
    }

    @Override
    public List<LedgerEventRecord> listAfter(Long afterSeq, int limit) {
        List<LedgerEventEntity> rows = eventMapper.listAfterSeq(afterSeq, limit);
        List<LedgerEventRecord> records = new ArrayList<>();
        if (rows == null) {
            return records;
        }
        for (LedgerEventEntity row : rows) {
            try {
                records.add(new LedgerEventRecord(row.getSeq(), objectMapper.readValue(row.getPayload(), LedgerEvent.class)));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("事件反序列化失败: seq=" + row.getSeq(), e);
            }
        }
        return records;
    }
}
