package com.wangbin.meshinfo.core.store;

import com.wangbin.meshinfo.common.domain.entity.Link;
import com.wangbin.meshinfo.common.domain.entity.LinkKey;
import com.wangbin.meshinfo.common.domain.entity.Node;
import com.wangbin.meshinfo.common.domain.entity.PollRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存存储，服务独立运行时使用；保存的是副本，调用方后续修改不影响存储内容
 */
@Slf4j
@Component
public class InMemoryMeshStateStore implements MeshStateRepository, MeshStateStore {

    private final Map<Long, Node> nodes = new ConcurrentHashMap<>();
    private final Map<LinkKey, Link> links = new ConcurrentHashMap<>();
    private final List<PollRun> runs = new CopyOnWriteArrayList<>();
    private final AtomicLong nodeSequence = new AtomicLong();

    @Override
    public Optional<Node> lookupNode(String identityKey) {
        if (identityKey == null) {
            return Optional.empty();
        }
        return nodes.values().stream()
                .filter(node -> identityKey.equals(node.getIpAddress()))
                .max(Comparator.comparing(Node::getLastSeen, Comparator.nullsFirst(Comparator.naturalOrder()))
                        .thenComparing(Node::getId))
                .map(node -> node.toBuilder().build());
    }

    @Override
    public List<Node> allActiveAndRecentNodes() {
        return nodes.values().stream()
                .filter(Node::isActive)
                .sorted(Comparator.comparing(Node::getId))
                .map(node -> node.toBuilder().build())
                .toList();
    }

    @Override
    public Optional<Link> lookupLink(LinkKey key) {
        return Optional.ofNullable(links.get(key)).map(link -> link.toBuilder().build());
    }

    @Override
    public List<Link> allActiveAndRecentLinks() {
        return links.values().stream()
                .filter(link -> link.getStatus() != null && link.getStatus().isActive())
                .map(link -> link.toBuilder().build())
                .toList();
    }

    @Override
    public long nextNodeId() {
        return nodeSequence.incrementAndGet();
    }

    @Override
    public void saveNetwork(Collection<Node> nodes, Collection<Link> links) {
        for (Node node : nodes) {
            this.nodes.put(node.getId(), node.toBuilder().build());
            // 外部导入的ID不能被再次分配
            nodeSequence.accumulateAndGet(node.getId(), Math::max);
        }
        for (Link link : links) {
            this.links.put(link.key(), link.toBuilder().build());
        }
        log.debug("已保存 {} 个节点, {} 条链路", nodes.size(), links.size());
    }

    @Override
    public void saveRun(PollRun run) {
        runs.add(run);
    }

    public Optional<Node> findNode(long id) {
        return Optional.ofNullable(nodes.get(id)).map(node -> node.toBuilder().build());
    }

    public List<Node> allNodes() {
        List<Node> result = new ArrayList<>(nodes.values());
        result.sort(Comparator.comparing(Node::getId));
        return result;
    }

    public List<Link> allLinks() {
        return new ArrayList<>(links.values());
    }

    public List<PollRun> getRuns() {
        return Collections.unmodifiableList(runs);
    }
}
