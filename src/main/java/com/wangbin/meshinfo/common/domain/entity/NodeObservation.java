package com.wangbin.meshinfo.common.domain.entity;

import com.wangbin.meshinfo.common.domain.enums.Band;
import com.wangbin.meshinfo.common.domain.enums.LinkType;
import com.wangbin.meshinfo.common.domain.enums.SchemaGeneration;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单次采集中某个节点的状态快照（由 sysinfo.json 归一化而来）
 *
 * 字符串字段缺失时为空串；数值字段缺失或格式错误时为 null，不使用 0 代替。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class NodeObservation {

    // ==================== 身份信息 ====================

    /** 本次轮询使用的地址 */
    private String connectionAddress;

    /** 节点名称（小写） */
    private String name;

    /** 节点显示名称（保留大小写） */
    private String displayName;

    /** 无线/主接口IP，找不到时回退为轮询地址 */
    private String ipAddress;

    /** 主接口MAC地址（小写、无冒号） */
    private String macAddress;

    private String lanIpAddress;

    private String description;

    // ==================== 硬件与固件 ====================

    private String model;

    private String boardId;

    private String firmwareVersion;

    private String firmwareManufacturer;

    private String apiVersion;

    private SchemaGeneration schemaGeneration;

    // ==================== 系统状态 ====================

    private String upTime;

    private Long upTimeSeconds;

    private List<Double> loadAverages;

    // ==================== 位置 ====================

    private Double latitude;

    private Double longitude;

    private String gridSquare;

    // ==================== 射频 ====================

    private String radioStatus;

    private String ssid;

    private String channel;

    private String channelBandwidth;

    private String frequency;

    private Band band;

    // ==================== 服务与隧道 ====================

    @Builder.Default
    private List<NodeService> services = new ArrayList<>();

    /** 活动隧道数量，始终 >= 0 */
    private int tunnelCount;

    @Builder.Default
    private Map<String, NodeInterface> interfaces = new LinkedHashMap<>();

    // ==================== 链路 ====================

    /** 文档中是否包含 link_info（API 1.7 之前没有） */
    private boolean linkInfoReported;

    @Builder.Default
    private List<LinkObservation> links = new ArrayList<>();

    /**
     * 身份键：无线IP是最强的身份信号
     */
    public String identityKey() {
        return ipAddress;
    }

    public Integer radioLinkCount() {
        return countLinks(LinkType.RADIO);
    }

    public Integer dtdLinkCount() {
        return countLinks(LinkType.DTD);
    }

    /**
     * 隧道链路数量，没有链路表时使用上报的隧道数量
     */
    public int tunnelLinkCount() {
        if (!linkInfoReported || links.isEmpty()) {
            return tunnelCount;
        }
        return countLinks(LinkType.TUNNEL);
    }

    /**
     * API版本是否不低于指定版本，无法解析时视为最低版本
     */
    public boolean apiVersionAtLeast(int major, int minor) {
        int[] parts = parseVersion(apiVersion);
        if (parts[0] != major) {
            return parts[0] > major;
        }
        return parts[1] >= minor;
    }

    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }

    public String label() {
        return name + " (" + ipAddress + ")";
    }

    private Integer countLinks(LinkType type) {
        // 没有链路表说明是旧版API，数量未知
        if (!linkInfoReported || links.isEmpty()) {
            return null;
        }
        return (int) links.stream().filter(link -> link.getType() == type).count();
    }

    static int[] parseVersion(String version) {
        int[] parts = new int[]{0, 0};
        if (version == null || version.isBlank()) {
            return parts;
        }
        String[] tokens = version.trim().split("\\.");
        try {
            for (int i = 0; i < Math.min(2, tokens.length); i++) {
                parts[i] = Integer.parseInt(tokens[i]);
            }
        } catch (NumberFormatException e) {
            return new int[]{0, 0};
        }
        return parts;
    }
}
