package com.wangbin.meshinfo.common.exception;

import com.wangbin.meshinfo.common.domain.enums.ErrorCategory;

/**
 * 外部持久化层抛出的异常
 */
public class PersistenceException extends CollectorException {

    public PersistenceException(String message) {
        super(ErrorCategory.PERSISTENCE_ERROR, message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(ErrorCategory.PERSISTENCE_ERROR, message, cause);
    }
}
