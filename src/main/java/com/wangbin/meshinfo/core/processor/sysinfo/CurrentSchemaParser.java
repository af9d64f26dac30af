package com.wangbin.meshinfo.core.processor.sysinfo;

import com.alibaba.fastjson2.JSONObject;
import com.wangbin.meshinfo.common.domain.entity.NodeObservation;
import com.wangbin.meshinfo.common.domain.enums.SchemaGeneration;
import com.wangbin.meshinfo.common.utils.JsonUtil;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * 新格式：硬件信息在 node_details 中，隧道数量在 tunnels.active_tunnel_count
 */
@Order(1)
@Component
public class CurrentSchemaParser extends AbstractSchemaParser {

    @Override
    public SchemaGeneration getGeneration() {
        return SchemaGeneration.CURRENT;
    }

    @Override
    public boolean supports(JSONObject document) {
        return JsonUtil.getObject(document, "node_details") != null;
    }

    @Override
    protected void parseDetails(JSONObject document, NodeObservation.NodeObservationBuilder builder) {
        JSONObject details = JsonUtil.getObject(document, "node_details");
        builder.description(unescapeHtml(JsonUtil.getText(details, "description", "")))
                .firmwareVersion(JsonUtil.getText(details, "firmware_version", ""))
                .firmwareManufacturer(JsonUtil.getText(details, "firmware_mfg", ""))
                .model(JsonUtil.getText(details, "model", ""))
                .boardId(JsonUtil.getText(details, "board_id", ""));
    }

    @Override
    protected int parseTunnelCount(JSONObject document) {
        Integer count = JsonUtil.getInteger(JsonUtil.getObject(document, "tunnels"), "active_tunnel_count");
        return count != null ? count : 0;
    }
}
