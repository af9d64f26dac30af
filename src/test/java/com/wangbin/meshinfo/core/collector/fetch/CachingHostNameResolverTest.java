package com.wangbin.meshinfo.core.collector.fetch;

import com.wangbin.meshinfo.core.config.MeshInfoProperties;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CachingHostNameResolverTest {

    @Test
    void lookupResultsAreCached() {
        AtomicInteger lookups = new AtomicInteger();
        CachingHostNameResolver resolver = new CachingHostNameResolver(new MeshInfoProperties(), address -> {
            lookups.incrementAndGet();
            return "node-" + address;
        });

        assertEquals("node-10.0.0.1", resolver.resolve("10.0.0.1"));
        assertEquals("node-10.0.0.1", resolver.resolve("10.0.0.1"));
        assertEquals(1, lookups.get());
    }

    @Test
    void failedLookupsAreCachedToo() {
        AtomicInteger lookups = new AtomicInteger();
        CachingHostNameResolver resolver = new CachingHostNameResolver(new MeshInfoProperties(), address -> {
            lookups.incrementAndGet();
            return "";
        });

        assertEquals("", resolver.resolve("10.0.0.2"));
        assertEquals("", resolver.resolve("10.0.0.2"));
        assertEquals(1, lookups.get());
    }

    @Test
    void blankAddressIsNotLookedUp() {
        CachingHostNameResolver resolver = new CachingHostNameResolver(new MeshInfoProperties(), address -> {
            throw new AssertionError("unexpected lookup");
        });

        assertEquals("", resolver.resolve(""));
        assertEquals("", resolver.resolve(null));
    }

    @Test
    void meshSuffixIsStripped() {
        assertEquals("kg6abc-hap", CachingHostNameResolver.normalize("KG6ABC-hAP.local.mesh"));
        assertEquals("router.example.org", CachingHostNameResolver.normalize("router.example.org"));
    }
}
