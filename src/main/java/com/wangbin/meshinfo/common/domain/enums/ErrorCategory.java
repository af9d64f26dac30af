package com.wangbin.meshinfo.common.domain.enums;

/**
 * 采集运行错误分类
 *
 * 单节点错误（超时/传输/解析）只作为数据记录，不会中断本轮采集；
 * 拓扑不可用会中断本轮采集。
 */
public enum ErrorCategory {

    TOPOLOGY_UNAVAILABLE(10, "拓扑不可用", true),
    FETCH_TIMEOUT(20, "节点超时", false),
    FETCH_TRANSPORT_ERROR(30, "传输错误", false),
    FETCH_PARSE_ERROR(40, "解析错误", false),
    RECONCILIATION_CONFLICT(50, "身份冲突", false),
    PERSISTENCE_ERROR(60, "持久化错误", false);

    private final int code;
    private final String description;
    private final boolean fatal;

    ErrorCategory(int code, String description, boolean fatal) {
        this.code = code;
        this.description = description;
        this.fatal = fatal;
    }

    public int getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 是否导致整轮采集中止
     */
    public boolean isFatal() {
        return fatal;
    }

    // 是否属于单节点抓取错误
    public boolean isFetchError() {
        return this == FETCH_TIMEOUT || this == FETCH_TRANSPORT_ERROR || this == FETCH_PARSE_ERROR;
    }
}
