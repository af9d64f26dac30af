package com.wangbin.meshinfo.core.collector.fetch;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.wangbin.meshinfo.core.config.MeshInfoProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.function.Function;

/**
 * 基于系统解析器的反向DNS，结果（包括失败）按配置的有效期缓存
 */
@Slf4j
@Component
public class CachingHostNameResolver implements HostNameResolver {

    private static final String MESH_DOMAIN = ".local.mesh";

    private final Cache<String, String> cache;
    private final Function<String, String> lookup;

    @Autowired
    public CachingHostNameResolver(MeshInfoProperties properties) {
        this(properties, CachingHostNameResolver::reverseLookup);
    }

    CachingHostNameResolver(MeshInfoProperties properties, Function<String, String> lookup) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(properties.getDns().getCacheTtl())
                .maximumSize(properties.getDns().getCacheSize())
                .build();
        this.lookup = lookup;
    }

    @Override
    public String resolve(String address) {
        if (address == null || address.isEmpty()) {
            return "";
        }
        return cache.get(address, lookup);
    }

    static String reverseLookup(String address) {
        try {
            String hostName = InetAddress.getByName(address).getCanonicalHostName();
            // 解析失败时 getCanonicalHostName 原样返回地址
            if (hostName.equals(address)) {
                return "";
            }
            return normalize(hostName);
        } catch (UnknownHostException e) {
            log.debug("反向DNS解析失败: {}", address);
            return "";
        }
    }

    static String normalize(String hostName) {
        String name = hostName.toLowerCase();
        if (name.endsWith(MESH_DOMAIN)) {
            name = name.substring(0, name.length() - MESH_DOMAIN.length());
        }
        return name;
    }
}
