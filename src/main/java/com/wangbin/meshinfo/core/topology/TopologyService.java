package com.wangbin.meshinfo.core.topology;

import com.wangbin.meshinfo.common.exception.TopologyUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 拓扑发现：按优先级依次尝试各来源，首选路由表，失败时回退到邻居列表
 */
@Slf4j
@Service
public class TopologyService {

    private final List<TopologySource> sources;

    public TopologyService(List<TopologySource> sources) {
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("至少需要一个拓扑来源");
        }
        this.sources = List.copyOf(sources);
    }

    /**
     * 发现网络中的节点
     *
     * @param localNode 本地节点
     * @return 拓扑，回退来源的结果会标记为 partial
     * @throws TopologyUnavailableException 所有来源都失败
     */
    public Topology discover(String localNode) {
        TopologySourceException lastError = null;
        for (TopologySource source : sources) {
            try {
                Topology topology = source.load(localNode);
                if (topology.isPartial()) {
                    log.warn("使用回退拓扑来源 {}，仅包含直连邻居: {} 个", source.getName(), topology.getNodes().size());
                }
                return topology;
            } catch (TopologySourceException e) {
                log.warn("拓扑来源 {} 不可用: {}", source.getName(), e.getMessage());
                lastError = e;
            }
        }
        throw new TopologyUnavailableException(localNode,
                "无法从本地节点获取拓扑: " + localNode, lastError);
    }
}
