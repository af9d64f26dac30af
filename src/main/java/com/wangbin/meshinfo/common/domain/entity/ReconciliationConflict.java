package com.wangbin.meshinfo.common.domain.entity;

import java.util.List;

/**
 * 同一轮采集中多个观测解析到同一身份键
 *
 * @param identityKey 冲突的身份键
 * @param addresses   产生冲突观测的轮询地址
 * @param nodeIds     最终分配的节点ID
 */
public record ReconciliationConflict(String identityKey, List<String> addresses, List<Long> nodeIds) {
}
