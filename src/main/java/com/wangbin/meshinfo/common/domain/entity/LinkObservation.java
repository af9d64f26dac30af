package com.wangbin.meshinfo.common.domain.entity;

import com.wangbin.meshinfo.common.domain.enums.LinkType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单次采集中由源节点上报的一条出向链路
 *
 * 数值字段为 null 表示未知；信号/噪声/速率仅射频链路有值。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LinkObservation {

    /** 链路成本上限，表示不可达 */
    public static final double MAX_COST = 99.99;

    /** 源节点名称（小写） */
    private String source;

    /** 目的节点名称（小写，去除 .local.mesh） */
    private String destination;

    /** 目的节点IP */
    private String destinationIp;

    private LinkType type;

    /** OLSR接口名称 */
    private String interfaceName;

    /** 链路质量，百分比 [0, 100] */
    private Double quality;

    /** 邻居链路质量，百分比 [0, 100] */
    private Double neighborQuality;

    private Integer signal;

    private Integer noise;

    private Double txRate;

    private Double rxRate;

    /** 路由成本 [0, 99.99] */
    private Double cost;
}
