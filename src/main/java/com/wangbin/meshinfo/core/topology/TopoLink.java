package com.wangbin.meshinfo.core.topology;

import com.wangbin.meshinfo.common.domain.entity.LinkObservation;

/**
 * 路由表中的一条有向边
 */
public record TopoLink(String source, String destination, double cost) {

    /**
     * 由路由表文本构造，INFINITE 视为不可达成本
     */
    public static TopoLink fromStrings(String source, String destination, String label) {
        double cost;
        if ("INFINITE".equalsIgnoreCase(label)) {
            cost = LinkObservation.MAX_COST;
        } else {
            cost = Math.max(0.0, Math.min(LinkObservation.MAX_COST, Double.parseDouble(label)));
        }
        return new TopoLink(source, destination, cost);
    }

    @Override
    public String toString() {
        return source + " -> " + destination + " (" + cost + ")";
    }
}
