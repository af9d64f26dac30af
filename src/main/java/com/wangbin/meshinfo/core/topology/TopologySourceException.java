package com.wangbin.meshinfo.core.topology;

/**
 * 单个拓扑来源获取失败（可回退到下一个来源）
 */
public class TopologySourceException extends Exception {

    public TopologySourceException(String message) {
        super(message);
    }

    public TopologySourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
