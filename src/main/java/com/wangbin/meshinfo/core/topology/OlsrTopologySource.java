package com.wangbin.meshinfo.core.topology;

import com.wangbin.meshinfo.core.config.MeshInfoProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

/**
 * 通过本地节点的 OLSR daemon 获取全网拓扑（权威来源）
 */
@Slf4j
@Order(1)
@Component
public class OlsrTopologySource implements TopologySource {

    private final int port;
    private final int timeoutMs;

    public OlsrTopologySource(MeshInfoProperties properties) {
        this.port = properties.getTopology().getOlsrPort();
        this.timeoutMs = (int) properties.getTopology().getOlsrTimeout().toMillis();
    }

    @Override
    public String getName() {
        return "olsr";
    }

    @Override
    public Topology load(String localNode) throws TopologySourceException {
        log.debug("连接OLSR daemon获取拓扑: {}:{}", localNode, port);
        Topology topology;
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(localNode, port), timeoutMs);
            socket.setSoTimeout(timeoutMs);
            BufferedReader reader = new BufferedReader(
                    new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            topology = OlsrTopologyParser.parse(reader, getName());
        } catch (SocketTimeoutException e) {
            throw new TopologySourceException("连接OLSR daemon超时: " + localNode + ":" + port, e);
        } catch (IOException e) {
            throw new TopologySourceException("连接OLSR daemon失败: " + localNode + ":" + port, e);
        }

        if (topology.isEmpty()) {
            throw new TopologySourceException("OLSR响应中没有可识别的节点: " + localNode);
        }
        log.info("已从OLSR加载拓扑, 节点数: {}, 链路数: {}", topology.getNodes().size(), topology.linkCount());
        return topology;
    }
}
