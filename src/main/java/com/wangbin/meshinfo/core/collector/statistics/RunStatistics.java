package com.wangbin.meshinfo.core.collector.statistics;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 单轮采集的命名计数器，最终写入 PollRun.otherStats
 */
public class RunStatistics {

    public static final String NODES_ADDED = "nodes: added";
    public static final String NODES_UPDATED = "nodes: updated";
    public static final String NODES_RENAMED = "nodes: renamed";
    public static final String NODES_REAPPEARED = "nodes: reappeared";
    public static final String NODES_CONFLICTS = "nodes: conflicts";
    public static final String LINKS_NEW = "links: new";
    public static final String LINKS_UPDATED = "links: updated";
    public static final String LINKS_ERRORS = "links: errors";
    public static final String LINKS_DUPLICATE = "links: duplicate";
    public static final String LINKS_MISSING_LOCATION = "links: missing location info";
    public static final String ROUTING_TABLE_LINKS = "using routing table for link data";
    public static final String ROUTING_TABLE_COST = "using routing table for link cost";
    public static final String EXPIRED_NODES = "expired: nodes";
    public static final String EXPIRED_LINKS = "expired: links";

    private final Map<String, AtomicInteger> counters = new ConcurrentHashMap<>();

    public void increment(String name) {
        add(name, 1);
    }

    public void add(String name, int delta) {
        counters.computeIfAbsent(name, k -> new AtomicInteger()).addAndGet(delta);
    }

    public int get(String name) {
        AtomicInteger counter = counters.get(name);
        return counter == null ? 0 : counter.get();
    }

    /**
     * 按名称排序的只读快照
     */
    public Map<String, Integer> snapshot() {
        Map<String, Integer> snapshot = new TreeMap<>();
        counters.forEach((name, counter) -> snapshot.put(name, counter.get()));
        return Collections.unmodifiableMap(snapshot);
    }
}
