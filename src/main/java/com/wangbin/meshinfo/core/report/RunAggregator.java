package com.wangbin.meshinfo.core.report;

import com.wangbin.meshinfo.common.domain.entity.Link;
import com.wangbin.meshinfo.common.domain.entity.Node;
import com.wangbin.meshinfo.common.domain.entity.NodeError;
import com.wangbin.meshinfo.common.domain.entity.PollRun;
import com.wangbin.meshinfo.common.domain.entity.ReconciliationConflict;
import com.wangbin.meshinfo.common.domain.enums.ErrorCategory;
import com.wangbin.meshinfo.common.domain.enums.PollingError;
import com.wangbin.meshinfo.core.collector.fetch.FetchResult;
import com.wangbin.meshinfo.core.collector.fetch.HostNameResolver;
import com.wangbin.meshinfo.core.collector.statistics.RunStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 汇总单轮采集结果
 */
@Slf4j
@Component
public class RunAggregator {

    /** 反向DNS整体等待上限，超时的地址记为名称未知 */
    private static final Duration LOOKUP_TIMEOUT = Duration.ofSeconds(3);

    private final HostNameResolver hostNameResolver;
    private final Executor lookupExecutor;
    private final Duration lookupTimeout;

    @Autowired
    public RunAggregator(HostNameResolver hostNameResolver,
                         @Qualifier("pollerExecutor") ExecutorService lookupExecutor) {
        this(hostNameResolver, lookupExecutor, LOOKUP_TIMEOUT);
    }

    public RunAggregator(HostNameResolver hostNameResolver, Executor lookupExecutor, Duration lookupTimeout) {
        this.hostNameResolver = hostNameResolver;
        this.lookupExecutor = lookupExecutor;
        this.lookupTimeout = lookupTimeout;
    }

    /**
     * 失败节点补上反向DNS名称，按地址排序
     *
     * 查询并发执行，共用一个等待上限
     */
    public List<NodeError> collectErrors(List<FetchResult> results) {
        List<NodeError> failures = new ArrayList<>();
        List<CompletableFuture<String>> lookups = new ArrayList<>();
        for (FetchResult result : results) {
            if (result.isSuccess()) {
                continue;
            }
            NodeError error = result.getError();
            failures.add(error);
            lookups.add(lookup(error));
        }

        CompletableFuture.allOf(lookups.toArray(new CompletableFuture[0]))
                .completeOnTimeout(null, lookupTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .join();

        List<NodeError> errors = new ArrayList<>();
        for (int i = 0; i < failures.size(); i++) {
            NodeError error = failures.get(i);
            CompletableFuture<String> lookup = lookups.get(i);
            String dnsName = lookup.getNow("");
            if (!lookup.isDone()) {
                log.debug("反向DNS查询超时: {}", error.getIpAddress());
                lookup.cancel(false);
            }
            errors.add(NodeError.of(error.getIpAddress(), dnsName, error.getError(), error.getDetails()));
        }
        errors.sort(Comparator.comparing(NodeError::getIpAddress));
        return errors;
    }

    private CompletableFuture<String> lookup(NodeError error) {
        String known = error.getDnsName();
        if (known != null && !known.isEmpty()) {
            return CompletableFuture.completedFuture(known);
        }
        return CompletableFuture.supplyAsync(() -> hostNameResolver.resolve(error.getIpAddress()), lookupExecutor)
                .exceptionally(e -> {
                    log.warn("反向DNS查询失败: {}", error.getIpAddress(), e);
                    return "";
                });
    }

    public PollRun summarize(Instant runStart, Duration pollingDuration, Duration totalDuration,
                            List<NodeError> errors, List<Node> nodes, List<Link> links,
                            List<ReconciliationConflict> conflicts, boolean partialTopology,
                            RunStatistics statistics) {
        Map<ErrorCategory, Long> byCategory = new EnumMap<>(ErrorCategory.class);
        Map<String, List<NodeError>> byHost = new LinkedHashMap<>();
        for (NodeError error : errors) {
            byCategory.merge(error.getCategory(), 1L, Long::sum);
            byHost.computeIfAbsent(error.label(), k -> new ArrayList<>()).add(error);
        }
        // 冲突单独计数，不计入 errorCount
        if (!conflicts.isEmpty()) {
            byCategory.put(ErrorCategory.RECONCILIATION_CONFLICT, (long) conflicts.size());
        }

        PollRun run = PollRun.builder()
                .startedAt(runStart)
                .pollingDuration(pollingDuration)
                .totalDuration(totalDuration)
                .nodeCount(nodes.size())
                .linkCount(links.size())
                .errorCount(errors.size())
                .partialTopology(partialTopology)
                .errors(List.copyOf(errors))
                .errorCountsByCategory(Collections.unmodifiableMap(byCategory))
                .errorsByHost(Collections.unmodifiableMap(byHost))
                .conflicts(List.copyOf(conflicts))
                .otherStats(statistics.snapshot())
                .build();

        log.info("采集完成: 节点 {} 个, 链路 {} 条, 错误 {} 个, 轮询耗时 {}s, 总耗时 {}s{}",
                run.getNodeCount(), run.getLinkCount(), run.getErrorCount(),
                pollingDuration.toSeconds(), totalDuration.toSeconds(),
                partialTopology ? "（仅本地邻居）" : "");
        if (!byCategory.isEmpty()) {
            long fetchErrors = byCategory.entrySet().stream()
                    .filter(entry -> entry.getKey().isFetchError())
                    .mapToLong(Map.Entry::getValue)
                    .sum();
            Map<String, Long> described = new LinkedHashMap<>();
            byCategory.forEach((category, count) -> described.put(category.getDescription(), count));
            log.info("错误分类: {}，其中节点抓取错误 {} 个", described, fetchErrors);
        }
        return run;
    }

    /**
     * 拓扑不可用时的零节点记录
     */
    public PollRun aborted(Instant runStart, Duration elapsed, String localNode, String message,
                           RunStatistics statistics) {
        NodeError error = NodeError.builder()
                .ipAddress(localNode)
                .dnsName(localNode)
                .error(PollingError.CONNECTION_ERROR)
                .category(ErrorCategory.TOPOLOGY_UNAVAILABLE)
                .details(message)
                .build();
        log.error("{}，本轮中止: {}", ErrorCategory.TOPOLOGY_UNAVAILABLE.getDescription(), message);
        return PollRun.builder()
                .startedAt(runStart)
                .pollingDuration(elapsed)
                .totalDuration(elapsed)
                .nodeCount(0)
                .linkCount(0)
                .errorCount(1)
                .failureCategory(ErrorCategory.TOPOLOGY_UNAVAILABLE)
                .errors(List.of(error))
                .errorCountsByCategory(Map.of(ErrorCategory.TOPOLOGY_UNAVAILABLE, 1L))
                .errorsByHost(Map.of(error.label(), List.of(error)))
                .otherStats(statistics.snapshot())
                .build();
    }
}
