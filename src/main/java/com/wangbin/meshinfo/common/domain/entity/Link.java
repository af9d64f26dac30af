package com.wangbin.meshinfo.common.domain.entity;

import com.wangbin.meshinfo.common.domain.enums.LifecycleStatus;
import com.wangbin.meshinfo.common.domain.enums.LinkType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 持久化的有向链路，以 (源节点ID, 目的节点ID, 介质) 为键
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Link {

    private long sourceId;

    private long destinationId;

    private LinkType type;

    private String sourceName;

    private String destinationName;

    private Integer signal;

    private Integer noise;

    private Double txRate;

    private Double rxRate;

    /** 百分比 [0, 100] */
    private Double quality;

    /** 百分比 [0, 100] */
    private Double neighborQuality;

    /** [0, 99.99] */
    private Double cost;

    /** 距离（公里） */
    private Double distance;

    /** 方位角 [0, 360) */
    private Double bearing;

    private Instant firstSeen;

    private Instant lastSeen;

    private LifecycleStatus status;

    public LinkKey key() {
        return new LinkKey(sourceId, destinationId, type);
    }

    @Override
    public String toString() {
        return sourceName + " -> " + destinationName + " (" + type + ")";
    }
}
