package com.wangbin.meshinfo.core.reconcile;

import com.wangbin.meshinfo.common.domain.entity.Node;
import com.wangbin.meshinfo.common.domain.entity.NodeObservation;

/**
 * 观测与其对应的节点身份
 */
public record ReconciledNode(NodeObservation observation, Node node) {
}
