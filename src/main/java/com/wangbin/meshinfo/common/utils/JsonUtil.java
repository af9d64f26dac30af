package com.wangbin.meshinfo.common.utils;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import lombok.extern.slf4j.Slf4j;

/**
 * JSON工具类
 *
 * 节点上报的JSON类型并不稳定（数字有时是字符串，有时是空串），
 * 这里的读取方法对缺失和格式错误统一返回 null，由调用方决定如何处理未知值。
 */
@Slf4j
public class JsonUtil {

    private JsonUtil() {
        // 工具类，防止实例化
    }

    /**
     * JSON字符串转对象，根节点不是对象时抛出 JSONException
     */
    public static JSONObject parseObject(String json) {
        Object parsed = JSON.parse(json);
        if (parsed instanceof JSONObject object) {
            return object;
        }
        throw new JSONException("JSON根节点不是对象");
    }

    /**
     * 读取字符串，缺失时返回默认值
     */
    public static String getText(JSONObject object, String key, String defaultValue) {
        if (object == null) {
            return defaultValue;
        }
        Object value = object.get(key);
        if (value == null) {
            return defaultValue;
        }
        return value.toString();
    }

    /**
     * 读取浮点数，缺失、空串或格式错误时返回 null
     */
    public static Double getDouble(JSONObject object, String key) {
        if (object == null) {
            return null;
        }
        return toDouble(object.get(key), key);
    }

    /**
     * 读取整数，缺失、空串、格式错误或超出int范围时返回 null
     */
    public static Integer getInteger(JSONObject object, String key) {
        Double value = getDouble(object, key);
        if (value == null || value.isNaN() || value.isInfinite()) {
            return null;
        }
        long rounded = Math.round(value);
        // 超出int范围视为缺失，避免截断成错误的值
        if (rounded < Integer.MIN_VALUE || rounded > Integer.MAX_VALUE) {
            return null;
        }
        return (int) rounded;
    }

    public static JSONObject getObject(JSONObject object, String key) {
        if (object == null) {
            return null;
        }
        Object value = object.get(key);
        return value instanceof JSONObject nested ? nested : null;
    }

    public static JSONArray getArray(JSONObject object, String key) {
        if (object == null) {
            return null;
        }
        Object value = object.get(key);
        return value instanceof JSONArray array ? array : null;
    }

    /**
     * 布尔标志，兼容 true/"true"/1/"1"/"yes"
     */
    public static Boolean getFlag(JSONObject object, String key) {
        if (object == null || !object.containsKey(key) || object.get(key) == null) {
            return null;
        }
        Object value = object.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.intValue() != 0;
        }
        String text = value.toString().trim().toLowerCase();
        if (text.isEmpty()) {
            return null;
        }
        return "true".equals(text) || "1".equals(text) || "yes".equals(text) || "on".equals(text);
    }

    /**
     * 任意值转浮点数，无法转换时返回 null
     */
    public static Double toDouble(Object value, String key) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            log.debug("数值字段格式错误: {}={}", key, text);
            return null;
        }
    }
}
