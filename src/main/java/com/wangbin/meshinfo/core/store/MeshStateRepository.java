package com.wangbin.meshinfo.core.store;

import com.wangbin.meshinfo.common.domain.entity.Link;
import com.wangbin.meshinfo.common.domain.entity.LinkKey;
import com.wangbin.meshinfo.common.domain.entity.Node;

import java.util.List;
import java.util.Optional;

/**
 * 已知节点与链路的只读视图，每轮采集开始时读取一次
 */
public interface MeshStateRepository {

    /**
     * 按身份键查找最近一次持有该身份的节点（可能已失活）
     */
    Optional<Node> lookupNode(String identityKey);

    List<Node> allActiveAndRecentNodes();

    Optional<Link> lookupLink(LinkKey key);

    List<Link> allActiveAndRecentLinks();

    /**
     * 分配新的节点ID，ID不会复用
     */
    long nextNodeId();
}
