package com.wangbin.meshinfo.core.topology;

import com.wangbin.meshinfo.common.domain.enums.ErrorCategory;
import com.wangbin.meshinfo.common.exception.TopologyUnavailableException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TopologyServiceTest {

    /**
     * 固定结果的拓扑来源
     */
    static class StaticTopologySource implements TopologySource {
        private final String name;
        private final Topology topology;
        int calls;

        StaticTopologySource(String name, Topology topology) {
            this.name = name;
            this.topology = topology;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public Topology load(String localNode) throws TopologySourceException {
            calls++;
            if (topology == null) {
                throw new TopologySourceException(name + " unreachable");
            }
            return topology;
        }
    }

    static Topology topology(String source, boolean partial, String... addresses) {
        Topology topology = new Topology(source, partial);
        for (String address : addresses) {
            topology.addNode(address);
        }
        return topology;
    }

    @Test
    void routingTableIsPreferred() {
        StaticTopologySource olsr = new StaticTopologySource("olsr", topology("olsr", false, "10.0.0.1", "10.0.0.2", "10.0.0.3"));
        StaticTopologySource fallback = new StaticTopologySource("sysinfo", topology("sysinfo", true, "10.0.0.2"));

        Topology result = new TopologyService(List.of(olsr, fallback)).discover("localnode");

        assertFalse(result.isPartial());
        assertEquals(3, result.getNodes().size());
        assertEquals(0, fallback.calls);
    }

    @Test
    void fallsBackToNeighborListAndFlagsPartial() {
        StaticTopologySource olsr = new StaticTopologySource("olsr", null);
        StaticTopologySource fallback = new StaticTopologySource("sysinfo", topology("sysinfo", true, "10.0.0.2", "10.0.0.3"));

        Topology result = new TopologyService(List.of(olsr, fallback)).discover("localnode");

        assertTrue(result.isPartial());
        assertEquals("sysinfo", result.getSource());
        assertEquals(Set.of("10.0.0.2", "10.0.0.3"), result.getNodes());
    }

    @Test
    void failsWhenNoSourceAnswers() {
        TopologyService service = new TopologyService(List.of(
                new StaticTopologySource("olsr", null), new StaticTopologySource("sysinfo", null)));

        TopologyUnavailableException e = assertThrows(TopologyUnavailableException.class,
                () -> service.discover("localnode"));
        assertEquals("localnode", e.getLocalNode());
        assertEquals(ErrorCategory.TOPOLOGY_UNAVAILABLE, e.getCategory());
        assertTrue(e.getCause() instanceof TopologySourceException);
    }
}
