package com.work.bonding.core.repository;

import com.work.bonding.core.event.LedgerEvent;
import com.work.bonding.core.event.LedgerEventRecord;

import java.util.List;

/**
 * 只追加的通知日志。append 与账本写入处于同一事务，操作回滚时事件一并丢弃。
 */
public interface LedgerEventLog {

    /**
     * @return 分配给该事件的序号
     */
    long append(LedgerEvent event);

    /**
     * 按 seq 升序返回 seq &gt; afterSeq 的事件；afterSeq 为 null 时从头开始。
     */
    List<LedgerEventRecord> listAfter(Long afterSeq, int limit);
}
