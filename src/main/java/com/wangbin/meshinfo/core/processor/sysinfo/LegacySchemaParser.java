package com.wangbin.meshinfo.core.processor.sysinfo;

import com.alibaba.fastjson2.JSONObject;
import com.wangbin.meshinfo.common.domain.entity.NodeObservation;
import com.wangbin.meshinfo.common.domain.enums.SchemaGeneration;
import com.wangbin.meshinfo.common.utils.JsonUtil;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * 旧格式：硬件信息平铺在根节点，隧道以 tunnel_installed 标志上报
 */
@Order(2)
@Component
public class LegacySchemaParser extends AbstractSchemaParser {

    @Override
    public SchemaGeneration getGeneration() {
        return SchemaGeneration.LEGACY;
    }

    @Override
    public boolean supports(JSONObject document) {
        return JsonUtil.getObject(document, "node_details") == null;
    }

    @Override
    protected void parseDetails(JSONObject document, NodeObservation.NodeObservationBuilder builder) {
        builder.description("")
                .firmwareVersion(JsonUtil.getText(document, "firmware_version", ""))
                .firmwareManufacturer(JsonUtil.getText(document, "firmware_mfg", ""))
                .model(JsonUtil.getText(document, "model", ""))
                .boardId(JsonUtil.getText(document, "board_id", ""));
    }

    /**
     * 有数量时使用数量；只有标志时，标志为真记为 1，缺失或为否记为 0
     */
    @Override
    protected int parseTunnelCount(JSONObject document) {
        Integer count = JsonUtil.getInteger(document, "active_tunnel_count");
        if (count == null) {
            JSONObject tunnels = JsonUtil.getObject(document, "tunnels");
            count = JsonUtil.getInteger(tunnels, "active_tunnel_count");
        }
        if (count != null) {
            return count;
        }
        return Boolean.TRUE.equals(JsonUtil.getFlag(document, "tunnel_installed")) ? 1 : 0;
    }
}
