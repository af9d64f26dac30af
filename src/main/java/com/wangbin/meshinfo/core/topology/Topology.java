package com.wangbin.meshinfo.core.topology;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 网络拓扑：参与节点地址集合与按源地址分组的链路成本
 */
@Getter
public class Topology {

    private final Set<String> nodes = new TreeSet<>();

    private final Map<String, List<TopoLink>> linksBySource = new TreeMap<>();

    /** 拓扑来源名称 */
    private final String source;

    /** 仅包含本地节点的直连邻居 */
    private final boolean partial;

    public Topology(String source, boolean partial) {
        this.source = source;
        this.partial = partial;
    }

    public void addNode(String address) {
        nodes.add(address);
    }

    public void addLink(TopoLink link) {
        linksBySource.computeIfAbsent(link.source(), k -> new ArrayList<>()).add(link);
    }

    public List<TopoLink> linksFrom(String source) {
        return linksBySource.getOrDefault(source, Collections.emptyList());
    }

    /**
     * 目的地址 -> 成本
     */
    public Map<String, Double> costsFrom(String source) {
        return linksFrom(source).stream()
                .collect(Collectors.toMap(TopoLink::destination, TopoLink::cost, Math::min));
    }

    public int linkCount() {
        return linksBySource.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
