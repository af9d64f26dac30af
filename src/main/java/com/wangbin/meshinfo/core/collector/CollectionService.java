package com.wangbin.meshinfo.core.collector;

import com.wangbin.meshinfo.common.domain.entity.Link;
import com.wangbin.meshinfo.common.domain.entity.LinkKey;
import com.wangbin.meshinfo.common.domain.entity.Node;
import com.wangbin.meshinfo.common.domain.entity.NodeError;
import com.wangbin.meshinfo.common.domain.entity.NodeObservation;
import com.wangbin.meshinfo.common.domain.entity.PollRun;
import com.wangbin.meshinfo.common.domain.enums.LifecycleStatus;
import com.wangbin.meshinfo.common.exception.PersistenceException;
import com.wangbin.meshinfo.common.exception.TopologyUnavailableException;
import com.wangbin.meshinfo.core.collector.fetch.FetchResult;
import com.wangbin.meshinfo.core.collector.scheduler.PollingScheduler;
import com.wangbin.meshinfo.core.collector.statistics.RunStatistics;
import com.wangbin.meshinfo.core.config.MeshInfoProperties;
import com.wangbin.meshinfo.core.lifecycle.LifecycleClassifier;
import com.wangbin.meshinfo.core.link.LinkBuilder;
import com.wangbin.meshinfo.core.reconcile.IdentityReconciler;
import com.wangbin.meshinfo.core.reconcile.ReconcileResult;
import com.wangbin.meshinfo.core.report.RunAggregator;
import com.wangbin.meshinfo.core.report.RunSnapshot;
import com.wangbin.meshinfo.core.store.MeshStateRepository;
import com.wangbin.meshinfo.core.store.MeshStateStore;
import com.wangbin.meshinfo.core.topology.Topology;
import com.wangbin.meshinfo.core.topology.TopologyService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * 采集流程编排：拓扑发现 -> 并发轮询 -> 身份核对 -> 链路构建 -> 过期判定 -> 持久化
 *
 * 同一时刻只允许一轮采集，上一轮未结束时新的触发直接跳过。
 */
@Slf4j
@Service
public class CollectionService {

    private final MeshInfoProperties properties;
    private final TopologyService topologyService;
    private final PollingScheduler pollingScheduler;
    private final IdentityReconciler reconciler;
    private final LinkBuilder linkBuilder;
    private final RunAggregator aggregator;
    private final MeshStateRepository repository;
    private final MeshStateStore store;
    private final Clock clock;

    private final ReentrantLock runLock = new ReentrantLock();
    private final AtomicInteger consecutiveTopologyFailures = new AtomicInteger();

    public CollectionService(MeshInfoProperties properties, TopologyService topologyService,
                             PollingScheduler pollingScheduler, IdentityReconciler reconciler,
                             LinkBuilder linkBuilder, RunAggregator aggregator,
                             MeshStateRepository repository, MeshStateStore store, Clock clock) {
        this.properties = properties;
        this.topologyService = topologyService;
        this.pollingScheduler = pollingScheduler;
        this.reconciler = reconciler;
        this.linkBuilder = linkBuilder;
        this.aggregator = aggregator;
        this.repository = repository;
        this.store = store;
        this.clock = clock;
    }

    /**
     * 执行一轮采集
     *
     * @return 本轮结果；上一轮仍在进行时返回 empty
     */
    public Optional<RunSnapshot> collect() {
        if (!runLock.tryLock()) {
            log.warn("上一轮采集尚未结束，跳过本次触发");
            return Optional.empty();
        }
        try {
            return Optional.of(doCollect());
        } finally {
            runLock.unlock();
        }
    }

    public int getConsecutiveTopologyFailures() {
        return consecutiveTopologyFailures.get();
    }

    private RunSnapshot doCollect() {
        Instant runStart = clock.instant();
        RunStatistics statistics = new RunStatistics();
        String localNode = properties.getLocalNode();
        MeshInfoProperties.CollectorConfig config = properties.getCollector();

        Topology topology;
        try {
            topology = topologyService.discover(localNode);
            consecutiveTopologyFailures.set(0);
        } catch (TopologyUnavailableException e) {
            int failures = consecutiveTopologyFailures.incrementAndGet();
            log.error("无法获取网络拓扑（连续失败 {} 次）: {}", failures, e.getMessage());
            PollRun run = aggregator.aborted(runStart, Duration.between(runStart, clock.instant()),
                    localNode, e.getMessage(), statistics);
            return persistRun(RunSnapshot.builder().run(run).persisted(true), run);
        }

        List<FetchResult> results = poll(topology.getNodes(), config.getConcurrency(), config.getTimeout());
        List<NodeObservation> observations = results.stream()
                .filter(FetchResult::isSuccess)
                .map(FetchResult::getObservation)
                .toList();
        List<NodeError> errors = aggregator.collectErrors(results);
        Duration pollingDuration = Duration.between(runStart, clock.instant());

        ReconcileResult reconciled = reconciler.reconcile(observations, repository, runStart, statistics);
        List<Node> nodes = reconciled.nodes();
        List<Link> links = linkBuilder.build(reconciled, topology, repository, runStart, statistics);
        List<Node> staleNodes = expireNodes(nodes, runStart, config.getNodeInactive(), statistics);
        List<Link> staleLinks = expireLinks(links, runStart, config.getLinkInactive(), statistics);

        RunSnapshot.RunSnapshotBuilder snapshot = RunSnapshot.builder()
                .nodes(nodes)
                .links(links)
                .staleNodes(staleNodes)
                .staleLinks(staleLinks)
                .persisted(true);

        List<Node> allNodes = new ArrayList<>(nodes);
        allNodes.addAll(staleNodes);
        List<Link> allLinks = new ArrayList<>(links);
        allLinks.addAll(staleLinks);
        try {
            store.saveNetwork(allNodes, allLinks);
        } catch (PersistenceException e) {
            log.error("保存节点与链路失败: {}", e.getMessage(), e);
            snapshot.persisted(false).persistenceError(e.getMessage());
        }

        PollRun run = aggregator.summarize(runStart, pollingDuration, Duration.between(runStart, clock.instant()),
                errors, nodes, links, reconciled.getConflicts(), topology.isPartial(), statistics);
        return persistRun(snapshot.run(run), run);
    }

    private List<FetchResult> poll(Set<String> addresses, int concurrency, Duration timeout) {
        try {
            return pollingScheduler.run(addresses, concurrency, timeout).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("轮询被中断", e);
        } catch (ExecutionException e) {
            // 调度器把所有单节点失败都转换为结果，这里只会是编程错误
            throw new IllegalStateException("轮询调度异常", e.getCause());
        }
    }

    private RunSnapshot persistRun(RunSnapshot.RunSnapshotBuilder snapshot, PollRun run) {
        try {
            store.saveRun(run);
        } catch (PersistenceException e) {
            log.error("保存采集记录失败: {}", e.getMessage(), e);
            snapshot.persisted(false).persistenceError(e.getMessage());
        }
        return snapshot.build();
    }

    /**
     * 本轮未出现的已知节点重新判定状态
     */
    private List<Node> expireNodes(List<Node> current, Instant runTimestamp, Duration threshold,
                                   RunStatistics statistics) {
        Set<Long> seen = current.stream().map(Node::getId).collect(Collectors.toSet());
        List<Node> stale = new ArrayList<>();
        for (Node known : repository.allActiveAndRecentNodes()) {
            if (seen.contains(known.getId())) {
                continue;
            }
            LifecycleStatus status = LifecycleClassifier.classify(known.getLastSeen(), runTimestamp, threshold);
            if (status == LifecycleStatus.INACTIVE) {
                log.info("节点失活: {} (id={})", known, known.getId());
                statistics.increment(RunStatistics.EXPIRED_NODES);
            }
            stale.add(known.toBuilder().status(status).build());
        }
        return stale;
    }

    private List<Link> expireLinks(List<Link> current, Instant runTimestamp, Duration threshold,
                                   RunStatistics statistics) {
        Set<LinkKey> seen = current.stream().map(Link::key).collect(Collectors.toSet());
        List<Link> stale = new ArrayList<>();
        for (Link known : repository.allActiveAndRecentLinks()) {
            if (seen.contains(known.key())) {
                continue;
            }
            LifecycleStatus status = LifecycleClassifier.classify(known.getLastSeen(), runTimestamp, threshold);
            if (status == LifecycleStatus.INACTIVE) {
                log.debug("链路失活: {}", known);
                statistics.increment(RunStatistics.EXPIRED_LINKS);
            }
            stale.add(known.toBuilder().status(status).build());
        }
        return stale;
    }
}
