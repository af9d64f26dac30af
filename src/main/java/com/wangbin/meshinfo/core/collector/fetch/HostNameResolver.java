package com.wangbin.meshinfo.core.collector.fetch;

/**
 * 反向DNS解析，用于标注采集失败的节点
 */
@FunctionalInterface
public interface HostNameResolver {

    /**
     * @return 主机名，无法解析时返回空串
     */
    String resolve(String address);
}
