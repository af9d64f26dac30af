package com.wangbin.meshinfo.common.domain.enums;

/**
 * 轮询单个节点时可能出现的错误
 */
public enum PollingError {

    TIMEOUT_ERROR("Timeout Error", ErrorCategory.FETCH_TIMEOUT),
    CONNECTION_ERROR("Connection Error", ErrorCategory.FETCH_TRANSPORT_ERROR),
    HTTP_ERROR("HTTP Error", ErrorCategory.FETCH_TRANSPORT_ERROR),
    INVALID_RESPONSE("Invalid Response", ErrorCategory.FETCH_PARSE_ERROR),
    PARSE_ERROR("Parse Error", ErrorCategory.FETCH_PARSE_ERROR);

    private final String label;
    private final ErrorCategory category;

    PollingError(String label, ErrorCategory category) {
        this.label = label;
        this.category = category;
    }

    public String getLabel() {
        return label;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    @Override
    public String toString() {
        return label;
    }
}
