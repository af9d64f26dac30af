package com.wangbin.meshinfo.core.processor.sysinfo;

import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.wangbin.meshinfo.common.domain.entity.NodeObservation;
import com.wangbin.meshinfo.common.domain.enums.PollingError;
import com.wangbin.meshinfo.common.utils.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 状态文档归一化入口
 *
 * 先校验 API 版本，再交给第一个支持该文档的解析器。
 * 不认识的主版本直接判为解析错误，不做猜测。
 */
@Slf4j
@Component
public class SysinfoNormalizer {

    /** 支持的 API 主版本 */
    static final int SUPPORTED_MAJOR = 1;

    private static final Pattern VERSION_PATTERN = Pattern.compile("^\\d+(\\.\\d+)+$");

    private final List<SchemaParser> parsers;

    public SysinfoNormalizer(List<SchemaParser> parsers) {
        this.parsers = List.copyOf(parsers);
    }

    /**
     * @param connectionAddress 轮询地址
     * @param body              响应正文
     * @throws SchemaParseException 正文不是JSON（INVALID_RESPONSE）或格式不受支持（PARSE_ERROR）
     */
    public NodeObservation normalize(String connectionAddress, String body) throws SchemaParseException {
        JSONObject document;
        try {
            document = JsonUtil.parseObject(body);
        } catch (JSONException e) {
            throw new SchemaParseException(PollingError.INVALID_RESPONSE, "响应不是有效的JSON对象", e);
        }
        return normalize(connectionAddress, document);
    }

    public NodeObservation normalize(String connectionAddress, JSONObject document) throws SchemaParseException {
        String apiVersion = JsonUtil.getText(document, "api_version", "").trim();
        checkVersion(apiVersion);

        for (SchemaParser parser : parsers) {
            if (parser.supports(document)) {
                log.debug("使用 {} 格式解析 {}, API版本 {}", parser.getGeneration(), connectionAddress, apiVersion);
                return parser.parse(connectionAddress, document);
            }
        }
        throw new SchemaParseException(PollingError.PARSE_ERROR, "没有适用的解析器, API版本 " + apiVersion);
    }

    static void checkVersion(String apiVersion) throws SchemaParseException {
        if (!VERSION_PATTERN.matcher(apiVersion).matches()) {
            throw new SchemaParseException(PollingError.PARSE_ERROR, "无法识别的API版本: '" + apiVersion + "'");
        }
        int major;
        try {
            major = Integer.parseInt(apiVersion.substring(0, apiVersion.indexOf('.')));
        } catch (NumberFormatException e) {
            throw new SchemaParseException(PollingError.PARSE_ERROR, "无法识别的API版本: '" + apiVersion + "'", e);
        }
        if (major != SUPPORTED_MAJOR) {
            throw new SchemaParseException(PollingError.PARSE_ERROR, "不支持的API版本: " + apiVersion);
        }
    }
}
