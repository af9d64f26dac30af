package com.wangbin.meshinfo.core.collector.protocol.http;

/**
 * 状态文档HTTP响应
 */
public record StatusResponse(String uri, int statusCode, String body) {

    public boolean isOk() {
        return statusCode == 200;
    }
}
