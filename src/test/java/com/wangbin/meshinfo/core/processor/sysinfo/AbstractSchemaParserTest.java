package com.wangbin.meshinfo.core.processor.sysinfo;

import com.wangbin.meshinfo.common.domain.entity.NodeObservation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AbstractSchemaParserTest {

    @Test
    void upTimeIsConvertedToSeconds() {
        assertEquals(90_061L, AbstractSchemaParser.parseUpTime("1 day, 1:01:01"));
        assertEquals(273_906L, AbstractSchemaParser.parseUpTime("3 days, 4:05:06"));
        assertNull(AbstractSchemaParser.parseUpTime("garbage"));
        assertNull(AbstractSchemaParser.parseUpTime(""));
    }

    @Test
    void oversizedUpTimeBecomesUnknown() {
        assertNull(AbstractSchemaParser.parseUpTime("99999999999999999999 days, 1:00:00"));
        assertNull(AbstractSchemaParser.parseUpTime("999999999999999 days, 1:00:00"));
    }

    @Test
    void oversizedUpTimeDoesNotFailTheDocument() throws Exception {
        SysinfoNormalizer normalizer = new SysinfoNormalizer(List.of(new CurrentSchemaParser(), new LegacySchemaParser()));
        String document = "{\"api_version\":\"1.5\",\"node\":\"Alpha\",\"interfaces\":[],"
                + "\"sysinfo\":{\"uptime\":\"99999999999999999999 days, 1:00:00\",\"loads\":[0.5]}}";

        NodeObservation node = normalizer.normalize("10.0.0.1", document);

        assertEquals("alpha", node.getName());
        assertNull(node.getUpTimeSeconds());
        assertEquals(List.of(0.5), node.getLoadAverages());
    }

    @Test
    void htmlEntitiesAreUnescaped() {
        assertEquals("Tower 45° café ©", AbstractSchemaParser.unescapeHtml("Tower 45&deg; caf&eacute; &copy;"));
        assertEquals("Hilltop & tower #2", AbstractSchemaParser.unescapeHtml("Hilltop &amp; tower &#35;2"));
        assertEquals("°", AbstractSchemaParser.unescapeHtml("&#xB0;"));
        assertEquals("plain text", AbstractSchemaParser.unescapeHtml("plain text"));
        assertEquals("", AbstractSchemaParser.unescapeHtml(""));
    }
}
