package com.wangbin.meshinfo.common.domain.entity;

import com.wangbin.meshinfo.common.domain.enums.ErrorCategory;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 单轮采集汇总，记录后不可变
 */
@Data
@Builder
public class PollRun {

    private final Instant startedAt;

    /** 拓扑发现 + 抓取解析耗时 */
    private final Duration pollingDuration;

    /** 含身份核对与持久化交接的总耗时 */
    private final Duration totalDuration;

    private final int nodeCount;

    private final int linkCount;

    private final int errorCount;

    /** 是否使用了本地节点邻居列表作为拓扑（仅一跳） */
    private final boolean partialTopology;

    /** 导致整轮中止的错误分类，正常为 null */
    private final ErrorCategory failureCategory;

    @Builder.Default
    private final List<NodeError> errors = Collections.emptyList();

    @Builder.Default
    private final Map<ErrorCategory, Long> errorCountsByCategory = Collections.emptyMap();

    /** 按 "名称 (地址)" 分组的错误 */
    @Builder.Default
    private final Map<String, List<NodeError>> errorsByHost = Collections.emptyMap();

    @Builder.Default
    private final List<ReconciliationConflict> conflicts = Collections.emptyList();

    @Builder.Default
    private final Map<String, Integer> otherStats = Collections.emptyMap();

    public boolean isAborted() {
        return failureCategory != null && failureCategory.isFatal();
    }
}
