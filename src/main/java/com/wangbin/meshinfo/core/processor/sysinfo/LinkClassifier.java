package com.wangbin.meshinfo.core.processor.sysinfo;

import com.wangbin.meshinfo.common.domain.enums.LinkType;

/**
 * 链路介质分类
 *
 * 优先采用节点上报的 linkType，无法识别时按接口命名判断：
 * dtdlink 为 DTD，tun / wg 开头为隧道，带射频指标或 wlan 接口为射频，其余为未知。
 */
public final class LinkClassifier {

    private LinkClassifier() {
    }

    public static LinkType classify(String reportedType, String interfaceName, boolean radioMetricsPresent) {
        LinkType reported = LinkType.fromReported(reportedType);
        if (reported != null) {
            return reported;
        }
        String iface = interfaceName == null ? "" : interfaceName.trim().toLowerCase();
        if (iface.contains("dtdlink")) {
            return LinkType.DTD;
        }
        if (iface.startsWith("tun") || iface.startsWith("wg")) {
            return LinkType.TUNNEL;
        }
        if (radioMetricsPresent || iface.startsWith("wlan")) {
            return LinkType.RADIO;
        }
        return LinkType.UNKNOWN;
    }
}
