package com.work.bonding.core.repository.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.bonding.core.event.BondAdded;
import com.work.bonding.core.event.LedgerEventRecord;
import com.work.bonding.core.model.PoolId;
import com.work.bonding.core.repository.entity.LedgerEventEntity;
import com.work.bonding.core.repository.mapper.LedgerEventMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class PostgresLedgerEventLogTest {

    private static final PoolId POOL = PoolId.of(new byte[32]);

    @Test
    public void appended_payload_reads_back_as_same_event_type() {
        LedgerEventMapper mapper = mock(LedgerEventMapper.class);
        doAnswer(inv -> {
            ((LedgerEventEntity) inv.getArgument(0)).setSeq(7L);
            return 1;
        }).when(mapper).insert(any(LedgerEventEntity.class));

        PostgresLedgerEventLog log = new PostgresLedgerEventLog(mapper, new ObjectMapper());
        BondAdded event = new BondAdded("0x4444444444444444444444444444444444444444", BigInteger.valueOf(1000),
                POOL, BigInteger.ONE, BigInteger.ZERO, 99L);
        assertEquals(7L, log.append(event));

        ArgumentCaptor<LedgerEventEntity> captor = ArgumentCaptor.forClass(LedgerEventEntity.class);
        verify(mapper).insert(captor.capture());
        LedgerEventEntity row = captor.getValue();
        assertEquals(BondAdded.TYPE, row.getEventType());
        assertEquals(99L, row.getEventTime());

        when(mapper.listAfterSeq(eq(6L), eq(10))).thenReturn(Collections.singletonList(row));
        List<LedgerEventRecord> records = log.listAfter(6L, 10);

        assertEquals(1, records.size());
        assertEquals(7L, records.get(0).getSeq());
        BondAdded read = (BondAdded) records.get(0).getEvent();
        assertEquals(POOL, read.getPoolId());
        assertEquals(BigInteger.valueOf(1000), read.getAmount());
        assertEquals(99L, read.getTime());
    }
}
