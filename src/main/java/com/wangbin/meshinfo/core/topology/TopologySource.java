package com.wangbin.meshinfo.core.topology;

/**
 * 拓扑来源
 */
public interface TopologySource {

    /**
     * 来源名称，用于日志与运行汇总
     */
    String getName();

    /**
     * 从本地节点获取拓扑
     *
     * @param localNode 本地节点地址
     * @return 拓扑，至少包含一个节点
     * @throws TopologySourceException 来源无响应或响应无法解析
     */
    Topology load(String localNode) throws TopologySourceException;
}
