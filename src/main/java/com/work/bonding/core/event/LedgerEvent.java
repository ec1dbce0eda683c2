package com.work.bonding.core.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 通知日志中的一条记录。日志只追加、全局有序，供链下观察者（奖励计算、slash 治理）消费。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SlashApplied.class, name = SlashApplied.TYPE),
        @JsonSubTypes.Type(value = BondAdded.class, name = BondAdded.TYPE),
        @JsonSubTypes.Type(value = UnbondRequested.class, name = UnbondRequested.TYPE),
        @JsonSubTypes.Type(value = Unbonded.class, name = Unbonded.TYPE)
})
public abstract class LedgerEvent {

    private final long time;

    protected LedgerEvent(long time) {
        this.time = time;
    }

    /**
     * 操作发生时刻（epoch 秒）。
     */
    public long getTime() {
        return time;
    }

    @JsonIgnore
    public abstract String getType();
}
