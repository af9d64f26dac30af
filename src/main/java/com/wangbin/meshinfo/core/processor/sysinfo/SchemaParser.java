package com.wangbin.meshinfo.core.processor.sysinfo;

import com.alibaba.fastjson2.JSONObject;
import com.wangbin.meshinfo.common.domain.entity.NodeObservation;
import com.wangbin.meshinfo.common.domain.enums.SchemaGeneration;

/**
 * 某一代状态文档格式的解析器
 */
public interface SchemaParser {

    SchemaGeneration getGeneration();

    /**
     * 文档是否属于该格式
     */
    boolean supports(JSONObject document);

    /**
     * 解析为节点观测
     *
     * @param connectionAddress 轮询使用的地址
     * @param document          已确认受支持的文档
     * @throws SchemaParseException 缺少必需字段
     */
    NodeObservation parse(String connectionAddress, JSONObject document) throws SchemaParseException;
}
