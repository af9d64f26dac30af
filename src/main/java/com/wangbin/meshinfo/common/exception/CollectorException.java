package com.wangbin.meshinfo.common.exception;

import com.wangbin.meshinfo.common.domain.enums.ErrorCategory;
import lombok.Getter;

/**
 * 采集器异常，携带错误分类
 */
@Getter
public class CollectorException extends BusinessException {

    private final ErrorCategory category;

    public CollectorException(ErrorCategory category, String message) {
        super(500 + category.getCode(), message);
        this.category = category;
    }

    public CollectorException(ErrorCategory category, String message, Throwable cause) {
        super(500 + category.getCode(), message, cause);
        this.category = category;
    }
}
