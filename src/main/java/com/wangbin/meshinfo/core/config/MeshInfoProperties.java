package com.wangbin.meshinfo.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 采集器配置类
 */
@Data
@Component
@ConfigurationProperties(prefix = "mesh-info")
public class MeshInfoProperties {

    /**
     * 本地节点（拓扑查询入口）
     */
    private String localNode = "localnode.local.mesh";

    /**
     * 采集配置
     */
    private CollectorConfig collector = new CollectorConfig();

    /**
     * 拓扑配置
     */
    private TopologyConfig topology = new TopologyConfig();

    /**
     * DNS配置
     */
    private DnsConfig dns = new DnsConfig();

    // =============== 配置类定义 ===============

    @Data
    public static class CollectorConfig {
        /** 是否启用定时采集 */
        private boolean enabled = true;
        /** 单节点总超时（连接+读取） */
        private Duration timeout = Duration.ofSeconds(30);
        /** 同时进行中的请求上限 */
        private int concurrency = 50;
        /** 节点失活阈值 */
        private Duration nodeInactive = Duration.ofDays(7);
        /** 链路失活阈值 */
        private Duration linkInactive = Duration.ofDays(1);
        /** 采集周期 */
        private Duration period = Duration.ofMinutes(5);
        /** 启动后首次采集的延迟 */
        private Duration initialDelay = Duration.ofSeconds(10);
    }

    @Data
    public static class TopologyConfig {
        /** OLSR daemon 端口 */
        private int olsrPort = 2004;
        private Duration olsrTimeout = Duration.ofSeconds(5);
        /** 节点状态文档端口 */
        private int statusPort = 8080;
    }

    @Data
    public static class DnsConfig {
        /** 缓存有效期 */
        private Duration cacheTtl = Duration.ofHours(1);
        private long cacheSize = 10_000;
    }
}
