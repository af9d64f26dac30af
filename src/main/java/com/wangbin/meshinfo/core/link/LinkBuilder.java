package com.wangbin.meshinfo.core.link;

import com.wangbin.meshinfo.common.domain.entity.Link;
import com.wangbin.meshinfo.common.domain.entity.LinkKey;
import com.wangbin.meshinfo.common.domain.entity.LinkObservation;
import com.wangbin.meshinfo.common.domain.entity.Node;
import com.wangbin.meshinfo.common.domain.entity.NodeObservation;
import com.wangbin.meshinfo.common.domain.enums.LifecycleStatus;
import com.wangbin.meshinfo.common.domain.enums.LinkType;
import com.wangbin.meshinfo.common.utils.GeoUtil;
import com.wangbin.meshinfo.core.collector.statistics.RunStatistics;
import com.wangbin.meshinfo.core.reconcile.ReconcileResult;
import com.wangbin.meshinfo.core.reconcile.ReconciledNode;
import com.wangbin.meshinfo.core.store.MeshStateRepository;
import com.wangbin.meshinfo.core.topology.Topology;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 由本轮节点上报的链路表构建持久化链路
 *
 * API 1.7 之前的节点没有链路表，改用路由表中的边；API 1.9 之前的节点不上报成本，取路由表中的成本。
 */
@Slf4j
@Component
public class LinkBuilder {

    public List<Link> build(ReconcileResult reconciled, Topology topology, MeshStateRepository repository,
                            Instant runTimestamp, RunStatistics statistics) {
        Map<LinkKey, Link> links = new LinkedHashMap<>();
        for (ReconciledNode item : reconciled.getReconciled()) {
            Node source = item.node();
            for (LinkObservation observation : linkObservations(item.observation(), reconciled, topology, statistics)) {
                Node destination = resolve(observation, reconciled);
                if (destination == null) {
                    log.warn("链路目的节点不在本轮结果中: {} -> {} ({})",
                            source.getName(), observation.getDestination(), observation.getDestinationIp());
                    statistics.increment(RunStatistics.LINKS_ERRORS);
                    continue;
                }
                LinkKey key = new LinkKey(source.getId(), destination.getId(), observation.getType());
                if (links.containsKey(key)) {
                    // 同一介质的多个接口（如多个DTD口）只记录一条
                    statistics.increment(RunStatistics.LINKS_DUPLICATE);
                    continue;
                }
                links.put(key, toLink(key, source, destination, observation, repository, runTimestamp, statistics));
            }
        }
        return new ArrayList<>(links.values());
    }

    private List<LinkObservation> linkObservations(NodeObservation node, ReconcileResult reconciled,
                                                   Topology topology, RunStatistics statistics) {
        if (!node.apiVersionAtLeast(1, 7) || !node.isLinkInfoReported()) {
            statistics.increment(RunStatistics.ROUTING_TABLE_LINKS);
            return fromRoutingTable(node, reconciled, topology);
        }
        if (node.apiVersionAtLeast(1, 9)) {
            return node.getLinks();
        }
        Map<String, Double> costs = topologyCosts(node, topology);
        if (costs.isEmpty()) {
            return node.getLinks();
        }
        statistics.increment(RunStatistics.ROUTING_TABLE_COST);
        List<LinkObservation> result = new ArrayList<>();
        for (LinkObservation link : node.getLinks()) {
            Double cost = costs.get(link.getDestinationIp());
            result.add(cost == null ? link : link.toBuilder().cost(cost).build());
        }
        return result;
    }

    private List<LinkObservation> fromRoutingTable(NodeObservation node, ReconcileResult reconciled,
                                                   Topology topology) {
        List<LinkObservation> result = new ArrayList<>();
        topologyCosts(node, topology).forEach((destinationIp, cost) -> {
            Node destination = reconciled.findByAddress(destinationIp);
            result.add(LinkObservation.builder()
                    .source(node.getName())
                    .destination(destination != null ? destination.getName() : "")
                    .destinationIp(destinationIp)
                    .type(LinkType.UNKNOWN)
                    .cost(cost)
                    .build());
        });
        return result;
    }

    private Map<String, Double> topologyCosts(NodeObservation node, Topology topology) {
        Map<String, Double> costs = topology.costsFrom(node.getIpAddress());
        if (costs.isEmpty() && !node.getIpAddress().equals(node.getConnectionAddress())) {
            costs = topology.costsFrom(node.getConnectionAddress());
        }
        return costs;
    }

    private Node resolve(LinkObservation observation, ReconcileResult reconciled) {
        Node destination = reconciled.findByName(observation.getDestination());
        if (destination == null) {
            destination = reconciled.findByAddress(observation.getDestinationIp());
        }
        return destination;
    }

    private Link toLink(LinkKey key, Node source, Node destination, LinkObservation observation,
                        MeshStateRepository repository, Instant runTimestamp, RunStatistics statistics) {
        Optional<Link> existing = repository.lookupLink(key);
        if (existing.isPresent()) {
            statistics.increment(RunStatistics.LINKS_UPDATED);
        } else {
            statistics.increment(RunStatistics.LINKS_NEW);
        }

        Link link = Link.builder()
                .sourceId(key.sourceId())
                .destinationId(key.destinationId())
                .type(key.type())
                .sourceName(source.getName())
                .destinationName(destination.getName())
                .signal(observation.getSignal())
                .noise(observation.getNoise())
                .txRate(observation.getTxRate())
                .rxRate(observation.getRxRate())
                .quality(observation.getQuality())
                .neighborQuality(observation.getNeighborQuality())
                .cost(observation.getCost())
                .firstSeen(existing.map(Link::getFirstSeen).orElse(runTimestamp))
                .lastSeen(runTimestamp)
                .status(LifecycleStatus.CURRENT)
                .build();

        if (source.hasLocation() && destination.hasLocation()) {
            link.setDistance(GeoUtil.distance(source.getLatitude(), source.getLongitude(),
                    destination.getLatitude(), destination.getLongitude()));
            link.setBearing(GeoUtil.bearing(source.getLatitude(), source.getLongitude(),
                    destination.getLatitude(), destination.getLongitude()));
        } else {
            statistics.increment(RunStatistics.LINKS_MISSING_LOCATION);
        }
        return link;
    }
}
