package com.wangbin.meshinfo.core.collector;

import com.wangbin.meshinfo.common.domain.entity.Link;
import com.wangbin.meshinfo.common.domain.entity.Node;
import com.wangbin.meshinfo.common.domain.entity.PollRun;
import com.wangbin.meshinfo.common.domain.enums.ErrorCategory;
import com.wangbin.meshinfo.common.domain.enums.LifecycleStatus;
import com.wangbin.meshinfo.common.domain.enums.PollingError;
import com.wangbin.meshinfo.common.exception.PersistenceException;
import com.wangbin.meshinfo.core.collector.fetch.FetchResult;
import com.wangbin.meshinfo.core.collector.fetch.NodeFetcher;
import com.wangbin.meshinfo.core.collector.scheduler.PollingScheduler;
import com.wangbin.meshinfo.core.collector.statistics.RunStatistics;
import com.wangbin.meshinfo.core.config.MeshInfoProperties;
import com.wangbin.meshinfo.core.link.LinkBuilder;
import com.wangbin.meshinfo.core.processor.sysinfo.CurrentSchemaParser;
import com.wangbin.meshinfo.core.processor.sysinfo.LegacySchemaParser;
import com.wangbin.meshinfo.core.processor.sysinfo.SchemaParseException;
import com.wangbin.meshinfo.core.processor.sysinfo.SysinfoNormalizer;
import com.wangbin.meshinfo.core.reconcile.IdentityReconciler;
import com.wangbin.meshinfo.core.report.RunAggregator;
import com.wangbin.meshinfo.core.report.RunSnapshot;
import com.wangbin.meshinfo.core.store.InMemoryMeshStateStore;
import com.wangbin.meshinfo.core.topology.Topology;
import com.wangbin.meshinfo.core.topology.TopologyService;
import com.wangbin.meshinfo.core.topology.TopologySource;
import com.wangbin.meshinfo.core.topology.TopologySourceException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CollectionServiceTest {

    private static final Instant RUN = Instant.parse("2024-05-01T12:00:00Z");

    private MeshInfoProperties properties;
    private ScheduledExecutorService timeoutScheduler;
    private InMemoryMeshStateStore store;
    private SysinfoNormalizer normalizer;

    /** 地址 -> 抓取行为 */
    private final Map<String, CompletableFuture<FetchResult>> responses = new HashMap<>();

    @BeforeEach
    void setUp() {
        properties = new MeshInfoProperties();
        properties.setLocalNode("localnode");
        properties.getCollector().setTimeout(Duration.ofMillis(300));
        timeoutScheduler = Executors.newSingleThreadScheduledExecutor();
        store = new InMemoryMeshStateStore();
        normalizer = new SysinfoNormalizer(List.of(new CurrentSchemaParser(), new LegacySchemaParser()));
    }

    @AfterEach
    void tearDown() {
        timeoutScheduler.shutdownNow();
    }

    private static String document(String name, String ip, String neighborIp, String neighborName) {
        String linkInfo = neighborIp == null ? "{}" : "{\"" + neighborIp + "\": {\"linkType\": \"RF\","
                + "\"olsrInterface\": \"wlan0\", \"hostname\": \"" + neighborName + ".local.mesh\","
                + "\"linkQuality\": 0.9, \"neighborLinkQuality\": 0.8, \"signal\": -70, \"noise\": -95,"
                + "\"tx_rate\": 13, \"rx_rate\": 26, \"linkCost\": 1.2}}";
        return "{\"api_version\": \"1.11\", \"node\": \"" + name + "\","
                + "\"lat\": \"39.0\", \"lon\": \"-105.0\","
                + "\"meshrf\": {\"status\": \"on\", \"ssid\": \"AREDN\", \"channel\": \"177\", \"chanbw\": \"10\"},"
                + "\"node_details\": {\"model\": \"m\", \"board_id\": \"0x1\", \"firmware_mfg\": \"AREDN\","
                + "\"firmware_version\": \"3.23.4.0\"},"
                + "\"tunnels\": {\"active_tunnel_count\": 0},"
                + "\"interfaces\": [{\"name\": \"wlan0\", \"mac\": \"00:00:00:00:00:0" + ip.charAt(ip.length() - 1)
                + "\", \"ip\": \"" + ip + "\"}],"
                + "\"link_info\": " + linkInfo + "}";
    }

    private void respond(String address, String body) {
        try {
            responses.put(address, CompletableFuture.completedFuture(
                    FetchResult.success(address, normalizer.normalize(address, body))));
        } catch (SchemaParseException e) {
            responses.put(address, CompletableFuture.completedFuture(
                    FetchResult.failure(address, e.getError(), e.getMessage())));
        }
    }

    private void stall(String address) {
        responses.put(address, new CompletableFuture<>());
    }

    private static TopologySource source(String name, Topology topology) {
        return new TopologySource() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public Topology load(String localNode) throws TopologySourceException {
                if (topology == null) {
                    throw new TopologySourceException(name + " unreachable");
                }
                return topology;
            }
        };
    }

    private static Topology topology(boolean partial, String... addresses) {
        Topology topology = new Topology(partial ? "sysinfo" : "olsr", partial);
        for (String address : addresses) {
            topology.addNode(address);
        }
        return topology;
    }

    private CollectionService service(List<TopologySource> sources, NodeFetcher fetcher, InMemoryMeshStateStore target) {
        return new CollectionService(properties,
                new TopologyService(sources),
                new PollingScheduler(fetcher, timeoutScheduler),
                new IdentityReconciler(properties),
                new LinkBuilder(),
                new RunAggregator(address -> "dns-" + address, Runnable::run, Duration.ofSeconds(1)),
                target, target,
                Clock.fixed(RUN, ZoneOffset.UTC));
    }

    private CollectionService service(List<TopologySource> sources) {
        NodeFetcher fetcher = (address, timeout) -> responses.getOrDefault(address, new CompletableFuture<>());
        return service(sources, fetcher, store);
    }

    @Test
    void twoRespondOneTimesOut() {
        respond("10.0.0.1", document("Alpha", "10.0.0.1", "10.0.0.2", "Bravo"));
        respond("10.0.0.2", document("Bravo", "10.0.0.2", "10.0.0.1", "Alpha"));
        stall("10.0.0.3");

        RunSnapshot snapshot = service(List.of(source("olsr", topology(false, "10.0.0.1", "10.0.0.2", "10.0.0.3"))))
                .collect().orElseThrow();
        PollRun run = snapshot.getRun();

        assertEquals(2, run.getNodeCount());
        assertEquals(1, run.getErrorCount());
        assertEquals(Map.of(ErrorCategory.FETCH_TIMEOUT, 1L), run.getErrorCountsByCategory());
        assertEquals(PollingError.TIMEOUT_ERROR, run.getErrors().get(0).getError());
        assertEquals("dns-10.0.0.3", run.getErrors().get(0).getDnsName());
        assertTrue(run.getErrorsByHost().containsKey("dns-10.0.0.3 (10.0.0.3)"));
        assertEquals(2, run.getLinkCount());
        assertFalse(run.isPartialTopology());
        assertFalse(run.isAborted());
        assertEquals(RUN, run.getStartedAt());

        assertTrue(snapshot.isPersisted());
        assertEquals(List.of(run), store.getRuns());
        assertEquals(2, store.allNodes().size());
        assertEquals(2, store.allLinks().size());
        assertTrue(snapshot.getNodes().stream().allMatch(n -> n.getStatus() == LifecycleStatus.CURRENT));
    }

    @Test
    void inactiveNodeReappearsWithNewId() {
        Instant tenDaysAgo = RUN.minus(Duration.ofDays(10));
        store.saveNetwork(List.of(Node.builder()
                .id(7L).name("alpha").ipAddress("10.0.0.1").macAddress("000000000001")
                .firstSeen(tenDaysAgo.minus(Duration.ofDays(30))).lastSeen(tenDaysAgo)
                .status(LifecycleStatus.INACTIVE).build()), List.of());
        respond("10.0.0.1", document("Alpha", "10.0.0.1", null, null));

        RunSnapshot snapshot = service(List.of(source("olsr", topology(false, "10.0.0.1"))))
                .collect().orElseThrow();

        Node reappeared = snapshot.getNodes().get(0);
        assertNotEquals(7L, reappeared.getId());
        assertEquals(RUN, reappeared.getFirstSeen());
        assertEquals(1, snapshot.getRun().getOtherStats().get(RunStatistics.NODES_REAPPEARED));

        Node old = store.findNode(7).orElseThrow();
        assertEquals(LifecycleStatus.INACTIVE, old.getStatus());
        assertEquals(tenDaysAgo, old.getLastSeen());
    }

    @Test
    void routingTableFailureFallsBackToNeighbors() {
        respond("10.0.0.2", document("Bravo", "10.0.0.2", null, null));
        respond("10.0.0.3", document("Charlie", "10.0.0.3", null, null));

        RunSnapshot snapshot = service(List.of(
                source("olsr", null),
                source("sysinfo", topology(true, "10.0.0.2", "10.0.0.3")))).collect().orElseThrow();

        assertEquals(2, snapshot.getRun().getNodeCount());
        assertTrue(snapshot.getRun().isPartialTopology());
        assertEquals(0, snapshot.getRun().getErrorCount());
    }

    @Test
    void topologyUnavailableRecordsZeroNodeRun() {
        CollectionService service = service(List.of(source("olsr", null), source("sysinfo", null)));

        RunSnapshot snapshot = service.collect().orElseThrow();

        PollRun run = snapshot.getRun();
        assertTrue(run.isAborted());
        assertEquals(ErrorCategory.TOPOLOGY_UNAVAILABLE, run.getFailureCategory());
        assertEquals(0, run.getNodeCount());
        assertEquals(1, store.getRuns().size(), "outages are still recorded");
        assertEquals(1, service.getConsecutiveTopologyFailures());

        service.collect();
        assertEquals(2, service.getConsecutiveTopologyFailures());
    }

    @Test
    void persistenceFailureKeepsComputedRun() {
        InMemoryMeshStateStore failing = new InMemoryMeshStateStore() {
            @Override
            public void saveNetwork(Collection<Node> nodes, Collection<Link> links) {
                throw new PersistenceException("database is locked");
            }
        };
        respond("10.0.0.1", document("Alpha", "10.0.0.1", null, null));
        NodeFetcher fetcher = (address, timeout) -> responses.get(address);

        RunSnapshot snapshot = service(List.of(source("olsr", topology(false, "10.0.0.1"))), fetcher, failing)
                .collect().orElseThrow();

        assertFalse(snapshot.isPersisted());
        assertEquals("database is locked", snapshot.getPersistenceError());
        assertEquals(1, snapshot.getRun().getNodeCount());
        assertEquals(1, snapshot.getNodes().size());
        assertEquals(1, failing.getRuns().size(), "the run summary is still handed over");
    }

    @Test
    void nodesNotSeenAreExpired() {
        store.saveNetwork(List.of(
                Node.builder().id(3L).name("old").ipAddress("10.0.0.9")
                        .lastSeen(RUN.minus(Duration.ofDays(8))).status(LifecycleStatus.RECENT).build(),
                Node.builder().id(4L).name("quiet").ipAddress("10.0.0.8")
                        .lastSeen(RUN.minus(Duration.ofDays(2))).status(LifecycleStatus.CURRENT).build()),
                List.of());
        respond("10.0.0.1", document("Alpha", "10.0.0.1", null, null));

        RunSnapshot snapshot = service(List.of(source("olsr", topology(false, "10.0.0.1")))).collect().orElseThrow();

        assertEquals(1, snapshot.getRun().getOtherStats().get(RunStatistics.EXPIRED_NODES));
        assertEquals(LifecycleStatus.INACTIVE, store.findNode(3).orElseThrow().getStatus());
        assertEquals(LifecycleStatus.RECENT, store.findNode(4).orElseThrow().getStatus());
        assertEquals(2, snapshot.getStaleNodes().size());
    }

    @Test
    void overlappingRunIsSkipped() throws Exception {
        CountDownLatch fetchStarted = new CountDownLatch(1);
        CompletableFuture<FetchResult> slow = new CompletableFuture<>();
        NodeFetcher fetcher = (address, timeout) -> {
            fetchStarted.countDown();
            return slow;
        };
        properties.getCollector().setTimeout(Duration.ofSeconds(30));
        CollectionService service = service(List.of(source("olsr", topology(false, "10.0.0.1"))), fetcher, store);

        CompletableFuture<Optional<RunSnapshot>> first = CompletableFuture.supplyAsync(service::collect);
        assertTrue(fetchStarted.await(5, TimeUnit.SECONDS));

        assertTrue(service.collect().isEmpty(), "second trigger is skipped while the first is in flight");

        slow.complete(FetchResult.failure("10.0.0.1", PollingError.CONNECTION_ERROR, "refused"));
        Optional<RunSnapshot> result = first.get(5, TimeUnit.SECONDS);
        assertTrue(result.isPresent());
        assertEquals(1, result.get().getRun().getErrorCount());
    }
}
