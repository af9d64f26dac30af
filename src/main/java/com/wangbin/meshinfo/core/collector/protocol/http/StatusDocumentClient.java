package com.wangbin.meshinfo.core.collector.protocol.http;

import com.wangbin.meshinfo.core.config.MeshInfoProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 节点状态文档（sysinfo.json）HTTP客户端（使用Java 11+ HttpClient）
 *
 * 请求为异步发送，单个请求的连接与读取共用一个总超时。
 */
@Slf4j
@Component
public class StatusDocumentClient {

    private static final String PATH = "/cgi-bin/sysinfo.json";

    private final HttpClient httpClient;
    private final int port;

    public StatusDocumentClient(MeshInfoProperties properties,
                                @Qualifier("pollerExecutor") ExecutorService executorService) {
        this.port = properties.getTopology().getStatusPort();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getCollector().getTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .executor(executorService)
                .build();
    }

    /**
     * 异步获取状态文档
     *
     * @param address 节点地址
     * @param params  查询参数
     * @param timeout 总超时，超时后返回的 future 以 TimeoutException 失败
     * @return 可取消，取消后底层请求随之中止
     */
    public CompletableFuture<StatusResponse> fetch(String address, Map<String, String> params, Duration timeout) {
        URI uri = buildUri(address, params);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        log.debug("请求状态文档: {}", uri);
        CompletableFuture<HttpResponse<byte[]>> exchange = httpClient
                .sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        CompletableFuture<StatusResponse> response = exchange.thenApply(raw -> new StatusResponse(
                uri.toString(), raw.statusCode(), decode(raw.body())));
        // 调用方取消时中止底层请求
        response.whenComplete((r, throwable) -> {
            if (response.isCancelled()) {
                exchange.cancel(true);
            }
        });
        return response;
    }

    URI buildUri(String address, Map<String, String> params) {
        String query = new TreeMap<>(params).entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
        String url = String.format("http://%s:%d%s", address, port, PATH);
        return URI.create(query.isEmpty() ? url : url + "?" + query);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * UTF-8 解码，非法字节替换为 U+FFFD
     */
    static String decode(byte[] body) {
        if (body == null) {
            return "";
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPLACE)
                    .onUnmappableCharacter(CodingErrorAction.REPLACE)
                    .decode(ByteBuffer.wrap(body))
                    .toString();
        } catch (CharacterCodingException e) {
            // REPLACE 模式下不会发生
            return new String(body, StandardCharsets.UTF_8);
        }
    }
}
