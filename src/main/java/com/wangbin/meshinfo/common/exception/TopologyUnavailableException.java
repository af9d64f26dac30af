package com.wangbin.meshinfo.common.exception;

import com.wangbin.meshinfo.common.domain.enums.ErrorCategory;
import lombok.Getter;

/**
 * 路由表与邻居列表均无法获取，本轮采集无节点可轮询
 */
@Getter
public class TopologyUnavailableException extends CollectorException {

    private final String localNode;

    public TopologyUnavailableException(String localNode, String message, Throwable cause) {
        super(ErrorCategory.TOPOLOGY_UNAVAILABLE, message, cause);
        this.localNode = localNode;
    }
}
