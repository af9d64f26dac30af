package com.wangbin.meshinfo.core.topology;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.wangbin.meshinfo.common.utils.JsonUtil;
import com.wangbin.meshinfo.core.collector.protocol.http.StatusDocumentClient;
import com.wangbin.meshinfo.core.collector.protocol.http.StatusResponse;
import com.wangbin.meshinfo.core.config.MeshInfoProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;

/**
 * 回退来源：解析本地节点 sysinfo.json 中的邻居列表，只能得到一跳邻居
 */
@Slf4j
@Order(2)
@Component
public class StatusDocumentTopologySource implements TopologySource {

    private static final Map<String, String> PARAMS = Map.of("link_info", "1", "topology", "1");

    private final StatusDocumentClient client;
    private final Duration timeout;

    public StatusDocumentTopologySource(StatusDocumentClient client, MeshInfoProperties properties) {
        this.client = client;
        this.timeout = properties.getTopology().getOlsrTimeout();
    }

    @Override
    public String getName() {
        return "sysinfo";
    }

    @Override
    public Topology load(String localNode) throws TopologySourceException {
        StatusResponse response;
        try {
            response = client.fetch(localNode, PARAMS, timeout).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TopologySourceException("获取本地节点状态文档被中断: " + localNode, e);
        } catch (ExecutionException e) {
            throw new TopologySourceException("获取本地节点状态文档失败: " + localNode, e.getCause());
        }
        if (!response.isOk()) {
            throw new TopologySourceException("本地节点状态文档返回 HTTP " + response.statusCode());
        }

        Topology topology;
        try {
            topology = parse(JsonUtil.parseObject(response.body()));
        } catch (JSONException e) {
            throw new TopologySourceException("本地节点状态文档不是有效JSON: " + localNode, e);
        }
        if (topology.isEmpty()) {
            throw new TopologySourceException("本地节点状态文档中没有邻居: " + localNode);
        }
        log.info("已从本地节点状态文档加载邻居, 节点数: {}", topology.getNodes().size());
        return topology;
    }

    Topology parse(JSONObject document) {
        Topology topology = new Topology(getName(), true);
        JSONObject linkInfo = JsonUtil.getObject(document, "link_info");
        if (linkInfo != null) {
            linkInfo.keySet().forEach(topology::addNode);
        }
        JSONArray entries = JsonUtil.getArray(document, "topology");
        if (entries != null) {
            for (Object item : entries) {
                if (!(item instanceof JSONObject entry)) {
                    continue;
                }
                String destination = JsonUtil.getText(entry, "destinationIP", "");
                if (!destination.isBlank()) {
                    topology.addNode(destination);
                }
            }
        }
        return topology;
    }
}
