package com.wangbin.meshinfo.core.link;

import com.wangbin.meshinfo.common.domain.entity.Link;
import com.wangbin.meshinfo.common.domain.entity.LinkKey;
import com.wangbin.meshinfo.common.domain.entity.LinkObservation;
import com.wangbin.meshinfo.common.domain.entity.Node;
import com.wangbin.meshinfo.common.domain.entity.NodeInterface;
import com.wangbin.meshinfo.common.domain.entity.NodeObservation;
import com.wangbin.meshinfo.common.domain.enums.LifecycleStatus;
import com.wangbin.meshinfo.common.domain.enums.LinkType;
import com.wangbin.meshinfo.core.collector.statistics.RunStatistics;
import com.wangbin.meshinfo.core.reconcile.ReconcileResult;
import com.wangbin.meshinfo.core.reconcile.ReconciledNode;
import com.wangbin.meshinfo.core.store.InMemoryMeshStateStore;
import com.wangbin.meshinfo.core.topology.TopoLink;
import com.wangbin.meshinfo.core.topology.Topology;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LinkBuilderTest {

    private static final Instant RUN = Instant.parse("2024-05-01T12:00:00Z");

    private InMemoryMeshStateStore store;
    private RunStatistics statistics;
    private Topology topology;

    @BeforeEach
    void setUp() {
        store = new InMemoryMeshStateStore();
        statistics = new RunStatistics();
        topology = new Topology("olsr", false);
        topology.addLink(new TopoLink("10.0.0.2", "10.0.0.1", 2.5));
        topology.addLink(new TopoLink("10.0.0.3", "10.0.0.1", 1.5));
    }

    private static LinkObservation link(String source, String destination, String destinationIp, LinkType type,
                                        double cost) {
        return LinkObservation.builder()
                .source(source)
                .destination(destination)
                .destinationIp(destinationIp)
                .type(type)
                .quality(90.0)
                .cost(cost)
                .build();
    }

    private static ReconciledNode node(long id, String name, String ip, String apiVersion, Double lat, Double lon,
                                       boolean linkInfo, List<LinkObservation> links,
                                       Map<String, NodeInterface> interfaces) {
        NodeObservation observation = NodeObservation.builder()
                .connectionAddress(ip)
                .name(name)
                .ipAddress(ip)
                .apiVersion(apiVersion)
                .latitude(lat)
                .longitude(lon)
                .linkInfoReported(linkInfo)
                .links(links)
                .interfaces(interfaces)
                .build();
        Node node = Node.builder().id(id).name(name).ipAddress(ip).latitude(lat).longitude(lon)
                .lastSeen(RUN).status(LifecycleStatus.CURRENT).build();
        return new ReconciledNode(observation, node);
    }

    private ReconcileResult network() {
        ReconciledNode a = node(1, "a", "10.0.0.1", "1.11", 0.0, 0.0, true, List.of(
                link("a", "b", "10.0.0.2", LinkType.RADIO, 1.0),
                link("a", "dtdlink.b", "10.0.1.2", LinkType.DTD, 0.1),
                link("a", "ghost", "10.9.9.9", LinkType.RADIO, 3.0)), Map.of());
        ReconciledNode b = node(2, "b", "10.0.0.2", "1.8", 0.0, 1.0, true, List.of(
                link("b", "a", "10.0.0.1", LinkType.RADIO, 5.0)),
                Map.of("br-dtdlink", new NodeInterface("br-dtdlink", "", "10.0.1.2")));
        ReconciledNode c = node(3, "c", "10.0.0.3", "1.6", null, null, false, List.of(), Map.of());
        return new ReconcileResult(List.of(a, b, c), List.of());
    }

    private Map<LinkKey, Link> build() {
        return new LinkBuilder().build(network(), topology, store, RUN, statistics).stream()
                .collect(Collectors.toMap(Link::key, Function.identity()));
    }

    @Test
    void buildsLinksKeyedBySourceDestinationAndMedium() {
        Map<LinkKey, Link> links = build();

        assertEquals(4, links.size());
        Link radio = links.get(new LinkKey(1, 2, LinkType.RADIO));
        assertEquals("a", radio.getSourceName());
        assertEquals("b", radio.getDestinationName());
        assertEquals(1.0, radio.getCost(), 1e-9);
        assertEquals(RUN, radio.getFirstSeen());
        assertEquals(LifecycleStatus.CURRENT, radio.getStatus());

        assertNotNull(links.get(new LinkKey(1, 2, LinkType.DTD)), "destination resolved by interface address");
        assertEquals(1, statistics.get(RunStatistics.LINKS_ERRORS), "unknown destination is counted");
    }

    @Test
    void geometryRequiresBothLocations() {
        Map<LinkKey, Link> links = build();

        Link radio = links.get(new LinkKey(1, 2, LinkType.RADIO));
        assertEquals(111.195, radio.getDistance(), 0.001);
        assertEquals(90.0, radio.getBearing(), 1e-9);
        assertEquals(270.0, links.get(new LinkKey(2, 1, LinkType.RADIO)).getBearing(), 1e-9);

        Link fromC = links.get(new LinkKey(3, 1, LinkType.UNKNOWN));
        assertNull(fromC.getDistance());
        assertNull(fromC.getBearing());
        assertEquals(1, statistics.get(RunStatistics.LINKS_MISSING_LOCATION));
    }

    @Test
    void olderApiVersionsUseRoutingTable() {
        Map<LinkKey, Link> links = build();

        assertEquals(2.5, links.get(new LinkKey(2, 1, LinkType.RADIO)).getCost(), 1e-9, "cost from routing table before 1.9");
        Link fromC = links.get(new LinkKey(3, 1, LinkType.UNKNOWN));
        assertEquals(1.5, fromC.getCost(), 1e-9, "links from routing table before 1.7");
        assertEquals(1, statistics.get(RunStatistics.ROUTING_TABLE_LINKS));
        assertEquals(1, statistics.get(RunStatistics.ROUTING_TABLE_COST));
    }

    @Test
    void existingLinkKeepsFirstSeen() {
        Instant earlier = RUN.minus(Duration.ofDays(3));
        store.saveNetwork(List.of(), List.of(Link.builder()
                .sourceId(1).destinationId(2).type(LinkType.RADIO)
                .firstSeen(earlier).lastSeen(RUN.minus(Duration.ofHours(1)))
                .status(LifecycleStatus.RECENT).build()));

        Map<LinkKey, Link> links = build();

        Link radio = links.get(new LinkKey(1, 2, LinkType.RADIO));
        assertEquals(earlier, radio.getFirstSeen());
        assertEquals(RUN, radio.getLastSeen());
        assertEquals(1, statistics.get(RunStatistics.LINKS_UPDATED));
        assertEquals(3, statistics.get(RunStatistics.LINKS_NEW));
    }
}
