package com.wangbin.meshinfo.core.report;

import com.wangbin.meshinfo.common.domain.entity.Link;
import com.wangbin.meshinfo.common.domain.entity.Node;
import com.wangbin.meshinfo.common.domain.entity.PollRun;
import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 一轮采集的完整结果：汇总、带生命周期状态的节点与链路
 */
@Getter
@Builder
public class RunSnapshot {

    private final PollRun run;

    /** 本轮发现的节点（CURRENT） */
    @Builder.Default
    private final List<Node> nodes = Collections.emptyList();

    @Builder.Default
    private final List<Link> links = Collections.emptyList();

    /** 本轮未发现、重新判定状态的已知节点 */
    @Builder.Default
    private final List<Node> staleNodes = Collections.emptyList();

    @Builder.Default
    private final List<Link> staleLinks = Collections.emptyList();

    /** 是否已成功交给持久化层 */
    private final boolean persisted;

    /** 持久化失败原因 */
    private final String persistenceError;
}
