package com.wangbin.meshinfo.common.domain.entity;

import com.wangbin.meshinfo.common.domain.enums.Band;
import com.wangbin.meshinfo.common.domain.enums.LifecycleStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 持久化的节点身份
 *
 * 活跃期间 id 不变；失活后以同一身份重新出现时会分配新 id，旧 id 不再复用。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Node {

    /** 主键ID */
    private Long id;

    /** 节点名称（小写） */
    private String name;

    /** 显示名称 */
    private String displayName;

    /** 无线IP，身份键 */
    private String ipAddress;

    /** 无线MAC地址 */
    private String macAddress;

    private String lanIpAddress;

    private String description;

    private String model;

    private String boardId;

    private String firmwareVersion;

    private String firmwareManufacturer;

    private String apiVersion;

    private String upTime;

    private Long upTimeSeconds;

    private List<Double> loadAverages;

    private Double latitude;

    private Double longitude;

    private String gridSquare;

    private String ssid;

    private String channel;

    private String channelBandwidth;

    private Band band;

    private List<NodeService> services;

    private int tunnelCount;

    private Integer linkCount;

    private Integer radioLinkCount;

    private Integer dtdLinkCount;

    private Integer tunnelLinkCount;

    /** 首次发现时间 */
    private Instant firstSeen;

    /** 最后一次发现时间 */
    private Instant lastSeen;

    private LifecycleStatus status;

    public String identityKey() {
        return ipAddress;
    }

    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }

    public boolean isActive() {
        return status != null && status.isActive();
    }

    /**
     * 用本次观测覆盖节点属性，不改动 id 与 firstSeen
     */
    public void applyObservation(NodeObservation observation) {
        this.name = observation.getName();
        this.displayName = observation.getDisplayName();
        this.ipAddress = observation.getIpAddress();
        this.macAddress = observation.getMacAddress();
        this.lanIpAddress = observation.getLanIpAddress();
        this.description = observation.getDescription();
        this.model = observation.getModel();
        this.boardId = observation.getBoardId();
        this.firmwareVersion = observation.getFirmwareVersion();
        this.firmwareManufacturer = observation.getFirmwareManufacturer();
        this.apiVersion = observation.getApiVersion();
        this.upTime = observation.getUpTime();
        this.upTimeSeconds = observation.getUpTimeSeconds();
        this.loadAverages = observation.getLoadAverages();
        this.latitude = observation.getLatitude();
        this.longitude = observation.getLongitude();
        this.gridSquare = observation.getGridSquare();
        this.ssid = observation.getSsid();
        this.channel = observation.getChannel();
        this.channelBandwidth = observation.getChannelBandwidth();
        this.band = observation.getBand();
        this.services = observation.getServices();
        this.tunnelCount = observation.getTunnelCount();
        this.radioLinkCount = observation.radioLinkCount();
        this.dtdLinkCount = observation.dtdLinkCount();
        this.tunnelLinkCount = observation.tunnelLinkCount();
        this.linkCount = observation.isLinkInfoReported() ? observation.getLinks().size() : null;
    }

    @Override
    public String toString() {
        return name + " (" + ipAddress + ")";
    }
}
