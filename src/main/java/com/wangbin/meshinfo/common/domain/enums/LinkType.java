package com.wangbin.meshinfo.common.domain.enums;

/**
 * 链路介质类型
 *
 * sortOrder 用于展示排序，与节点上报的 linkType 字段对应关系见 {@link #fromReported(String)}
 */
public enum LinkType {

    DTD(1, "DTD"),
    TUNNEL(2, "Tunnel"),
    RADIO(3, "Radio"),
    UNKNOWN(99, "Unknown");

    private final int sortOrder;
    private final String label;

    LinkType(int sortOrder, String label) {
        this.sortOrder = sortOrder;
        this.label = label;
    }

    public int getSortOrder() {
        return sortOrder;
    }

    public String getLabel() {
        return label;
    }

    /**
     * 将节点上报的 linkType 转换为枚举，无法识别时返回 null
     */
    public static LinkType fromReported(String reported) {
        if (reported == null) {
            return null;
        }
        switch (reported.trim().toUpperCase()) {
            case "RF":
                return RADIO;
            case "DTD":
                return DTD;
            case "TUN":
            case "WIREGUARD":
                return TUNNEL;
            default:
                return null;
        }
    }

    @Override
    public String toString() {
        return label;
    }
}
