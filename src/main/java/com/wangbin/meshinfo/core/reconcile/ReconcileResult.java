package com.wangbin.meshinfo.core.reconcile;

import com.wangbin.meshinfo.common.domain.entity.Node;
import com.wangbin.meshinfo.common.domain.entity.NodeInterface;
import com.wangbin.meshinfo.common.domain.entity.ReconciliationConflict;
import lombok.Getter;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 身份核对结果，按名称和地址索引本轮节点供链路构建使用
 */
@Getter
public class ReconcileResult {

    private final List<ReconciledNode> reconciled;
    private final List<ReconciliationConflict> conflicts;

    private final Map<String, Node> byName = new HashMap<>();
    private final Map<String, Node> byAddress = new HashMap<>();

    public ReconcileResult(List<ReconciledNode> reconciled, List<ReconciliationConflict> conflicts) {
        this.reconciled = List.copyOf(reconciled);
        this.conflicts = List.copyOf(conflicts);
        // 按规范顺序建立索引，重复时保留第一个
        for (ReconciledNode item : this.reconciled) {
            Node node = item.node();
            byName.putIfAbsent(node.getName(), node);
            byAddress.putIfAbsent(node.getIpAddress(), node);
            byAddress.putIfAbsent(item.observation().getConnectionAddress(), node);
            for (NodeInterface iface : item.observation().getInterfaces().values()) {
                if (iface.getIpAddress() != null) {
                    byAddress.putIfAbsent(iface.getIpAddress(), node);
                }
            }
        }
    }

    public List<Node> nodes() {
        return reconciled.stream().map(ReconciledNode::node).toList();
    }

    public Node findByName(String name) {
        return name == null ? null : byName.get(name);
    }

    public Node findByAddress(String address) {
        return address == null ? null : byAddress.get(address);
    }
}
