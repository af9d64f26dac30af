package com.wangbin.meshinfo.core.topology;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OLSR 路由表文本解析
 *
 * 只关心如下格式的行：
 * <pre>"10.32.66.190" -> "10.80.213.95"[label="1.000"];</pre>
 * 目的地址为 CIDR、标签为 HNA 的行不匹配链路正则。
 */
@Slf4j
public final class OlsrTopologyParser {

    private static final Pattern NODE_PATTERN =
            Pattern.compile("^\"(\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3})\" -> \"\\d+");

    private static final Pattern LINK_PATTERN = Pattern.compile(
            "^\"(10\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3})\" -> "
                    + "\"(10\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3})\"\\[label=\"(.+?)\"];");

    private OlsrTopologyParser() {
    }

    public static Topology parse(BufferedReader reader, String sourceName) throws IOException {
        Topology topology = new Topology(sourceName, false);
        String line;
        while ((line = reader.readLine()) != null) {
            parseLine(line.stripTrailing(), topology);
        }
        return topology;
    }

    static void parseLine(String line, Topology topology) {
        Matcher nodeMatcher = NODE_PATTERN.matcher(line);
        if (nodeMatcher.find()) {
            topology.addNode(nodeMatcher.group(1));
        }
        Matcher linkMatcher = LINK_PATTERN.matcher(line);
        if (linkMatcher.find()) {
            try {
                topology.addLink(TopoLink.fromStrings(
                        linkMatcher.group(1), linkMatcher.group(2), linkMatcher.group(3)));
            } catch (NumberFormatException e) {
                // 非数字标签（如 HNA）不是链路成本
                log.trace("忽略非成本标签: {}", line);
            }
        }
    }
}
