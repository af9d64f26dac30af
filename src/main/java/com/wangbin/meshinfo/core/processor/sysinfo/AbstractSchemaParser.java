package com.wangbin.meshinfo.core.processor.sysinfo;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.wangbin.meshinfo.common.domain.entity.LinkObservation;
import com.wangbin.meshinfo.common.domain.entity.NodeInterface;
import com.wangbin.meshinfo.common.domain.entity.NodeObservation;
import com.wangbin.meshinfo.common.domain.entity.NodeService;
import com.wangbin.meshinfo.common.domain.enums.Band;
import com.wangbin.meshinfo.common.domain.enums.LinkType;
import com.wangbin.meshinfo.common.domain.enums.PollingError;
import com.wangbin.meshinfo.common.utils.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.util.HtmlUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 状态文档解析基类
 *
 * 两代格式共有的部分（接口、服务、位置、系统负载、链路表）在这里解析，
 * 子类只负责有差异的硬件信息与隧道数量。
 */
@Slf4j
public abstract class AbstractSchemaParser implements SchemaParser {

    private static final List<String> PRIMARY_INTERFACES =
            List.of("wlan0", "wlan1", "eth0.3975", "eth1.3975", "br-nomesh");

    private static final List<String> LAN_INTERFACES = List.of("br-lan", "eth0", "eth0.0");

    private static final Pattern UPTIME_PATTERN = Pattern.compile("^(\\d+) days?, (\\d+):(\\d+):(\\d+)");

    private static final String MESH_DOMAIN = ".local.mesh";

    @Override
    public final NodeObservation parse(String connectionAddress, JSONObject document) throws SchemaParseException {
        String node = JsonUtil.getText(document, "node", "").trim();
        if (node.isEmpty()) {
            throw new SchemaParseException(PollingError.PARSE_ERROR, "缺少节点名称字段 node");
        }
        JSONArray interfaceArray = JsonUtil.getArray(document, "interfaces");
        if (interfaceArray == null) {
            throw new SchemaParseException(PollingError.PARSE_ERROR, "缺少接口列表 interfaces");
        }

        NodeObservation.NodeObservationBuilder builder = NodeObservation.builder()
                .connectionAddress(connectionAddress)
                .name(node.toLowerCase())
                .displayName(node)
                .apiVersion(JsonUtil.getText(document, "api_version", ""))
                .schemaGeneration(getGeneration())
                .gridSquare(JsonUtil.getText(document, "grid_square", ""))
                .latitude(JsonUtil.getDouble(document, "lat"))
                .longitude(JsonUtil.getDouble(document, "lon"))
                .services(parseServices(JsonUtil.getArray(document, "services_local")));

        Map<String, NodeInterface> interfaces = parseInterfaces(interfaceArray);
        NodeInterface primary = firstWithAddress(interfaces, PRIMARY_INTERFACES);
        if (primary == null) {
            log.warn("无法识别节点主接口，使用轮询地址: {} ({})", node, connectionAddress);
        }
        NodeInterface lan = firstWithAddress(interfaces, LAN_INTERFACES);
        builder.interfaces(interfaces)
                .ipAddress(primary != null ? primary.getIpAddress() : connectionAddress)
                .macAddress(primary != null ? normalizeMac(primary.getMacAddress()) : "")
                .lanIpAddress(lan != null ? lan.getIpAddress() : "");

        parseSystem(document, builder);
        parseRadio(document, builder);
        parseDetails(document, builder);
        builder.tunnelCount(Math.max(0, parseTunnelCount(document)));

        JSONObject linkInfo = JsonUtil.getObject(document, "link_info");
        builder.linkInfoReported(linkInfo != null);
        builder.links(parseLinks(linkInfo, node.toLowerCase()));

        NodeObservation observation = builder.build();
        observation.setBand(Band.resolve(observation.getRadioStatus(), observation.getBoardId(),
                observation.getChannel()));
        return observation;
    }

    /**
     * 固件、型号、描述等硬件信息
     */
    protected abstract void parseDetails(JSONObject document, NodeObservation.NodeObservationBuilder builder);

    /**
     * 活动隧道数量，未上报时为 0
     */
    protected abstract int parseTunnelCount(JSONObject document);

    // ==================== 共有部分 ====================

    private void parseSystem(JSONObject document, NodeObservation.NodeObservationBuilder builder) {
        JSONObject sysinfo = JsonUtil.getObject(document, "sysinfo");
        String upTime = JsonUtil.getText(sysinfo, "uptime", "");
        builder.upTime(upTime).upTimeSeconds(parseUpTime(upTime));

        JSONArray loads = JsonUtil.getArray(sysinfo, "loads");
        if (loads != null) {
            List<Double> averages = new ArrayList<>();
            for (Object load : loads) {
                Double value = JsonUtil.toDouble(load, "loads");
                if (value != null) {
                    averages.add(value);
                }
            }
            builder.loadAverages(averages);
        }
    }

    /**
     * 射频信息：新格式在 meshrf 中，旧格式在根节点
     */
    private void parseRadio(JSONObject document, NodeObservation.NodeObservationBuilder builder) {
        JSONObject meshrf = JsonUtil.getObject(document, "meshrf");
        if (meshrf != null) {
            builder.radioStatus(JsonUtil.getText(meshrf, "status", "on"))
                    .ssid(JsonUtil.getText(meshrf, "ssid", ""))
                    .channel(JsonUtil.getText(meshrf, "channel", ""))
                    .channelBandwidth(JsonUtil.getText(meshrf, "chanbw", ""))
                    .frequency(JsonUtil.getText(meshrf, "freq", ""));
        } else {
            builder.radioStatus("on")
                    .ssid(JsonUtil.getText(document, "ssid", ""))
                    .channel(JsonUtil.getText(document, "channel", ""))
                    .channelBandwidth(JsonUtil.getText(document, "chanbw", ""))
                    .frequency("");
        }
    }

    private Map<String, NodeInterface> parseInterfaces(JSONArray array) {
        Map<String, NodeInterface> interfaces = new LinkedHashMap<>();
        for (int i = 0; i < array.size(); i++) {
            Object item = array.get(i);
            if (!(item instanceof JSONObject raw)) {
                continue;
            }
            String name = JsonUtil.getText(raw, "name", "");
            if (name.isEmpty()) {
                continue;
            }
            String ip = JsonUtil.getText(raw, "ip", "");
            // 部分隧道接口没有MAC，没有地址时上报 "none"
            interfaces.put(name, new NodeInterface(name,
                    JsonUtil.getText(raw, "mac", ""),
                    ip.isEmpty() || "none".equals(ip) ? null : ip));
        }
        return interfaces;
    }

    private static NodeInterface firstWithAddress(Map<String, NodeInterface> interfaces, List<String> names) {
        for (String name : names) {
            NodeInterface candidate = interfaces.get(name);
            if (candidate != null && candidate.getIpAddress() != null) {
                return candidate;
            }
        }
        return null;
    }

    private List<NodeService> parseServices(JSONArray array) {
        List<NodeService> services = new ArrayList<>();
        if (array == null) {
            return services;
        }
        for (int i = 0; i < array.size(); i++) {
            if (array.get(i) instanceof JSONObject raw) {
                services.add(new NodeService(
                        JsonUtil.getText(raw, "name", ""),
                        JsonUtil.getText(raw, "protocol", ""),
                        JsonUtil.getText(raw, "link", "")));
            }
        }
        return services;
    }

    // ==================== 链路表 ====================

    private List<LinkObservation> parseLinks(JSONObject linkInfo, String source) {
        List<LinkObservation> links = new ArrayList<>();
        if (linkInfo == null) {
            return links;
        }
        for (Map.Entry<String, Object> entry : linkInfo.entrySet()) {
            if (entry.getValue() instanceof JSONObject raw) {
                links.add(parseLink(raw, source, entry.getKey()));
            } else {
                log.warn("忽略无法解析的链路: {} -> {}", source, entry.getKey());
            }
        }
        return links;
    }

    LinkObservation parseLink(JSONObject raw, String source, String destinationIp) {
        String interfaceName = JsonUtil.getText(raw, "olsrInterface", "");
        String reportedType = JsonUtil.getText(raw, "linkType", "");
        Integer signal = JsonUtil.getInteger(raw, "signal");
        Integer noise = JsonUtil.getInteger(raw, "noise");
        Double txRate = JsonUtil.getDouble(raw, "tx_rate");
        Double rxRate = JsonUtil.getDouble(raw, "rx_rate");

        // linkType 为空的 br-dtdlink 链路由接口名归为 DTD
        boolean radioMetrics = signal != null || noise != null || txRate != null || rxRate != null;
        LinkType type = LinkClassifier.classify(reportedType, interfaceName, radioMetrics);
        if (!reportedType.isEmpty() && LinkType.fromReported(reportedType) == null) {
            log.warn("未知的链路类型 {}，按接口 {} 分类为 {}", reportedType, interfaceName, type);
        }

        LinkObservation.LinkObservationBuilder builder = LinkObservation.builder()
                .source(source)
                .destination(normalizeHostName(JsonUtil.getText(raw, "hostname", "")))
                .destinationIp(destinationIp)
                .type(type)
                .interfaceName(interfaceName)
                .quality(toPercent(JsonUtil.getDouble(raw, "linkQuality")))
                .neighborQuality(toPercent(JsonUtil.getDouble(raw, "neighborLinkQuality")))
                .cost(clampCost(JsonUtil.getDouble(raw, "linkCost")));
        // 射频指标只对射频链路有意义
        if (type == LinkType.RADIO) {
            builder.signal(signal).noise(noise).txRate(txRate).rxRate(rxRate);
        }
        return builder.build();
    }

    // ==================== 工具方法 ====================

    static String normalizeHostName(String hostName) {
        String name = hostName.trim().replace(MESH_DOMAIN, "");
        while (name.startsWith(".")) {
            name = name.substring(1);
        }
        return name.toLowerCase();
    }

    static String normalizeMac(String mac) {
        return mac == null ? "" : mac.replace(":", "").toLowerCase();
    }

    /**
     * 链路质量由 [0, 1] 转为百分比并限定在 [0, 100]
     */
    static Double toPercent(Double quality) {
        if (quality == null || quality.isNaN()) {
            return null;
        }
        double percent = Math.round(quality * 10000.0) / 100.0;
        return Math.max(0.0, Math.min(100.0, percent));
    }

    static Double clampCost(Double cost) {
        if (cost == null || cost.isNaN()) {
            return null;
        }
        return Math.max(0.0, Math.min(LinkObservation.MAX_COST, cost));
    }

    static Long parseUpTime(String upTime) {
        if (upTime == null || upTime.isEmpty()) {
            return null;
        }
        Matcher matcher = UPTIME_PATTERN.matcher(upTime.trim());
        if (!matcher.find()) {
            log.warn("无法解析运行时长: {}", upTime);
            return null;
        }
        try {
            long seconds = Math.multiplyExact(86_400L, Long.parseLong(matcher.group(1)));
            seconds = Math.addExact(seconds, Math.multiplyExact(3_600L, Long.parseLong(matcher.group(2))));
            seconds = Math.addExact(seconds, Math.multiplyExact(60L, Long.parseLong(matcher.group(3))));
            return Math.addExact(seconds, Long.parseLong(matcher.group(4)));
        } catch (NumberFormatException | ArithmeticException e) {
            log.warn("运行时长超出范围: {}", upTime);
            return null;
        }
    }

    /**
     * 描述字段中的HTML实体（命名实体与数字实体）还原为字符
     */
    static String unescapeHtml(String text) {
        if (text == null || text.indexOf('&') < 0) {
            return text;
        }
        return HtmlUtils.htmlUnescape(text);
    }
}
