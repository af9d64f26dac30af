package com.wangbin.meshinfo.core.topology;

import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.StringReader;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OlsrTopologyParserTest {

    private static final String TABLE = String.join("\n",
            "HTTP/1.0 200 OK",
            "Content-type: text/plain",
            "",
            "digraph topology",
            "{",
            "\"10.32.66.190\" -> \"10.80.213.95\"[label=\"1.000\"];",
            "\"10.80.213.95\" -> \"10.32.66.190\"[label=\"1.123\"];",
            "\"10.32.66.190\" -> \"10.44.12.8\"[label=\"INFINITE\"];",
            "\"10.32.66.190\" -> \"10.0.0.0/8\"[label=\"HNA\", shape=solid];",
            "\"10.80.213.95\" -> \"0.0.0.0/0\"[label=\"HNA\"];",
            "\"10.44.12.8\" -> \"10.32.66.190\"[label=\"250.5\"];",
            "}");

    private Topology parse(String text) throws Exception {
        return OlsrTopologyParser.parse(new BufferedReader(new StringReader(text)), "olsr");
    }

    @Test
    void parsesParticipantsAndCosts() throws Exception {
        Topology topology = parse(TABLE);

        assertEquals(Set.of("10.32.66.190", "10.80.213.95", "10.44.12.8"), topology.getNodes());
        assertEquals(4, topology.linkCount(), "HNA lines are not links");
        assertFalse(topology.isPartial());

        Map<String, Double> costs = topology.costsFrom("10.32.66.190");
        assertEquals(1.0, costs.get("10.80.213.95"), 1e-9);
        assertEquals(99.99, costs.get("10.44.12.8"), 1e-9, "INFINITE is the maximum cost");
        assertEquals(99.99, topology.costsFrom("10.44.12.8").get("10.32.66.190"), 1e-9);
    }

    @Test
    void garbageYieldsEmptyTopology() throws Exception {
        Topology topology = parse("<html>not olsr</html>\n\n");
        assertTrue(topology.isEmpty());
        assertEquals(0, topology.linkCount());
    }
}
