package com.wangbin.meshinfo.core.reconcile;

import com.wangbin.meshinfo.common.domain.entity.Node;
import com.wangbin.meshinfo.common.domain.entity.NodeObservation;
import com.wangbin.meshinfo.common.domain.entity.ReconciliationConflict;
import com.wangbin.meshinfo.common.domain.enums.LifecycleStatus;
import com.wangbin.meshinfo.core.collector.statistics.RunStatistics;
import com.wangbin.meshinfo.core.config.MeshInfoProperties;
import com.wangbin.meshinfo.core.lifecycle.LifecycleClassifier;
import com.wangbin.meshinfo.core.store.MeshStateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 节点身份核对
 *
 * 匹配顺序：无线IP、无线MAC、节点名称，只在活跃（current/recent）节点中匹配。
 * 匹配成功则沿用原ID并更新属性（包括改名）；身份键曾属于已失活节点时分配新ID，旧节点保持不变。
 * 观测先按 (身份键, 名称, 轮询地址) 排序后再处理，结果与到达顺序无关。
 */
@Slf4j
@Component
public class IdentityReconciler {

    private static final Comparator<NodeObservation> CANONICAL_ORDER = Comparator
            .comparing(NodeObservation::identityKey, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(NodeObservation::getName, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(NodeObservation::getConnectionAddress, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final Duration nodeInactive;

    public IdentityReconciler(MeshInfoProperties properties) {
        this.nodeInactive = properties.getCollector().getNodeInactive();
    }

    public ReconcileResult reconcile(List<NodeObservation> observations, MeshStateRepository repository,
                                     Instant runTimestamp, RunStatistics statistics) {
        List<NodeObservation> sorted = new ArrayList<>(observations);
        sorted.sort(CANONICAL_ORDER);

        KnownNodes known = new KnownNodes(repository.allActiveAndRecentNodes(), runTimestamp);

        Map<String, List<NodeObservation>> groups = new LinkedHashMap<>();
        for (NodeObservation observation : sorted) {
            groups.computeIfAbsent(observation.identityKey(), k -> new ArrayList<>()).add(observation);
        }

        // 分三轮匹配：先用IP匹配全部观测，再用MAC、名称匹配剩余观测，强信号优先占用已知节点
        Map<NodeObservation, Node> matches = new IdentityHashMap<>();
        for (List<NodeObservation> group : groups.values()) {
            if (group.size() == 1) {
                NodeObservation observation = group.get(0);
                known.claimIfPresent(matches, observation, known.byIp(observation.identityKey()));
            } else {
                claimForConflict(group, known, matches, statistics);
            }
        }
        for (List<NodeObservation> group : singles(groups)) {
            NodeObservation observation = group.get(0);
            if (!matches.containsKey(observation) && hasText(observation.getMacAddress())) {
                known.claimIfPresent(matches, observation, known.byMac(observation.getMacAddress()));
            }
        }
        for (List<NodeObservation> group : singles(groups)) {
            NodeObservation observation = group.get(0);
            if (!matches.containsKey(observation) && hasText(observation.getName())) {
                known.claimIfPresent(matches, observation, known.byName(observation.getName()));
            }
        }

        // 按规范顺序更新或分配ID
        List<ReconciledNode> reconciled = new ArrayList<>();
        List<ReconciliationConflict> conflicts = new ArrayList<>();
        for (Map.Entry<String, List<NodeObservation>> group : groups.entrySet()) {
            List<ReconciledNode> members = new ArrayList<>();
            for (NodeObservation observation : group.getValue()) {
                Node match = matches.get(observation);
                Node node = match != null
                        ? update(match, observation, runTimestamp, statistics)
                        : mint(observation, repository, runTimestamp, statistics);
                members.add(new ReconciledNode(observation, node));
            }
            reconciled.addAll(members);
            if (members.size() > 1) {
                conflicts.add(new ReconciliationConflict(group.getKey(),
                        members.stream().map(m -> m.observation().getConnectionAddress()).toList(),
                        members.stream().map(m -> m.node().getId()).toList()));
            }
        }

        log.info("身份核对完成: 节点 {} 个, 冲突 {} 组", reconciled.size(), conflicts.size());
        return new ReconcileResult(reconciled, conflicts);
    }

    /**
     * 同一身份键出现多次：只有名称也一致的观测沿用已知节点，其余都作为新节点记录
     */
    private void claimForConflict(List<NodeObservation> group, KnownNodes known,
                                  Map<NodeObservation, Node> matches, RunStatistics statistics) {
        log.warn("多个节点使用同一身份键 {}: {}", group.get(0).identityKey(),
                group.stream().map(NodeObservation::getConnectionAddress).toList());
        statistics.increment(RunStatistics.NODES_CONFLICTS);
        Node candidate = known.byIp(group.get(0).identityKey());
        if (candidate == null) {
            return;
        }
        for (NodeObservation observation : group) {
            if (Objects.equals(candidate.getName(), observation.getName())) {
                known.claimIfPresent(matches, observation, candidate);
                return;
            }
        }
    }

    private static List<List<NodeObservation>> singles(Map<String, List<NodeObservation>> groups) {
        return groups.values().stream().filter(group -> group.size() == 1).toList();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    private Node update(Node known, NodeObservation observation, Instant runTimestamp, RunStatistics statistics) {
        Node node = known.toBuilder().build();
        if (!Objects.equals(known.getName(), observation.getName())) {
            log.info("节点改名: {} -> {} (id={})", known.getName(), observation.getName(), known.getId());
            statistics.increment(RunStatistics.NODES_RENAMED);
        }
        node.applyObservation(observation);
        node.setLastSeen(runTimestamp);
        node.setStatus(LifecycleStatus.CURRENT);
        statistics.increment(RunStatistics.NODES_UPDATED);
        return node;
    }

    private Node mint(NodeObservation observation, MeshStateRepository repository, Instant runTimestamp,
                      RunStatistics statistics) {
        Optional<Node> previous = repository.lookupNode(observation.identityKey());
        Node node = new Node();
        node.setId(repository.nextNodeId());
        node.applyObservation(observation);
        node.setFirstSeen(runTimestamp);
        node.setLastSeen(runTimestamp);
        node.setStatus(LifecycleStatus.CURRENT);

        if (previous.isPresent()
                && LifecycleClassifier.classify(previous.get().getLastSeen(), runTimestamp, nodeInactive)
                == LifecycleStatus.INACTIVE) {
            log.info("失活节点重新出现，分配新ID: {} (旧id={}, 新id={})",
                    observation.label(), previous.get().getId(), node.getId());
            statistics.increment(RunStatistics.NODES_REAPPEARED);
        } else {
            log.info("发现新节点: {} (id={})", observation.label(), node.getId());
            statistics.increment(RunStatistics.NODES_ADDED);
        }
        return node;
    }

    /**
     * 本轮可匹配的已知节点索引
     */
    private final class KnownNodes {

        private final Map<String, Node> byIp = new HashMap<>();
        private final Map<String, Node> byMac = new HashMap<>();
        private final Map<String, Node> byName = new HashMap<>();
        private final Set<Long> claimed = new HashSet<>();

        KnownNodes(List<Node> nodes, Instant runTimestamp) {
            List<Node> active = new ArrayList<>();
            for (Node node : nodes) {
                // 存储中的状态可能已过期，按本轮时间重新判断
                if (LifecycleClassifier.classify(node.getLastSeen(), runTimestamp, nodeInactive).isActive()) {
                    active.add(node);
                }
            }
            // 同一键对应多个节点时取最近发现的
            active.sort(Comparator.comparing(Node::getLastSeen).reversed().thenComparing(Node::getId));
            for (Node node : active) {
                putIfPresent(byIp, node.getIpAddress(), node);
                putIfPresent(byMac, node.getMacAddress(), node);
                putIfPresent(byName, node.getName(), node);
            }
        }

        /** 未被占用的同IP节点 */
        Node byIp(String ip) {
            return ip == null ? null : unclaimed(byIp.get(ip));
        }

        Node byMac(String mac) {
            return unclaimed(byMac.get(mac));
        }

        Node byName(String name) {
            return unclaimed(byName.get(name));
        }

        void claimIfPresent(Map<NodeObservation, Node> matches, NodeObservation observation, Node node) {
            if (node != null) {
                claimed.add(node.getId());
                matches.put(observation, node);
            }
        }

        private Node unclaimed(Node node) {
            return node == null || claimed.contains(node.getId()) ? null : node;
        }

        private void putIfPresent(Map<String, Node> index, String key, Node node) {
            if (key != null && !key.isEmpty()) {
                index.putIfAbsent(key, node);
            }
        }
    }
}
