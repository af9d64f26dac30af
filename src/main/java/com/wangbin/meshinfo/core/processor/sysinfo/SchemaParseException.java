package com.wangbin.meshinfo.core.processor.sysinfo;

import com.wangbin.meshinfo.common.domain.enums.PollingError;
import lombok.Getter;

/**
 * 状态文档无法解析
 */
@Getter
public class SchemaParseException extends Exception {

    private final PollingError error;

    public SchemaParseException(PollingError error, String message) {
        super(message);
        this.error = error;
    }

    public SchemaParseException(PollingError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }
}
