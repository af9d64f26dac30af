package com.wangbin.meshinfo.core.collector.protocol.http;

import com.wangbin.meshinfo.common.domain.entity.NodeObservation;
import com.wangbin.meshinfo.common.domain.enums.PollingError;
import com.wangbin.meshinfo.core.collector.fetch.FetchResult;
import com.wangbin.meshinfo.core.collector.fetch.NodeFetcher;
import com.wangbin.meshinfo.core.processor.sysinfo.SchemaParseException;
import com.wangbin.meshinfo.core.processor.sysinfo.SysinfoNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * 通过HTTP获取 sysinfo.json 并归一化
 */
@Slf4j
@Component
public class HttpNodeFetcher implements NodeFetcher {

    private static final Map<String, String> PARAMS = Map.of("services_local", "1", "link_info", "1");

    /** 错误详情中保留的响应长度 */
    private static final int MAX_DETAIL_LENGTH = 1000;

    private final StatusDocumentClient client;
    private final SysinfoNormalizer normalizer;

    public HttpNodeFetcher(StatusDocumentClient client, SysinfoNormalizer normalizer) {
        this.client = client;
        this.normalizer = normalizer;
    }

    @Override
    public CompletableFuture<FetchResult> fetch(String address, Duration timeout) {
        CompletableFuture<StatusResponse> request = client.fetch(address, PARAMS, timeout);
        CompletableFuture<FetchResult> result = request.handle((response, throwable) -> {
            if (throwable != null) {
                return transportFailure(address, throwable);
            }
            return parse(address, response);
        });
        result.whenComplete((r, throwable) -> {
            if (result.isCancelled()) {
                request.cancel(true);
            }
        });
        return result;
    }

    FetchResult parse(String address, StatusResponse response) {
        if (!response.isOk()) {
            log.warn("节点返回HTTP错误: {} -> {}", address, response.statusCode());
            return FetchResult.failure(address, PollingError.HTTP_ERROR,
                    "HTTP " + response.statusCode() + " " + response.uri());
        }
        try {
            NodeObservation observation = normalizer.normalize(address, response.body());
            log.debug("节点解析成功: {}", observation.label());
            return FetchResult.success(address, observation);
        } catch (SchemaParseException e) {
            log.warn("节点响应解析失败: {} - {}", address, e.getMessage());
            return FetchResult.failure(address, e.getError(),
                    e.getMessage() + "\n" + truncate(response.body()));
        } catch (RuntimeException e) {
            log.error("节点响应解析异常: {}", address, e);
            return FetchResult.failure(address, PollingError.PARSE_ERROR,
                    e + "\n" + truncate(response.body()));
        }
    }

    static FetchResult transportFailure(String address, Throwable throwable) {
        Throwable cause = unwrap(throwable);
        if (cause instanceof TimeoutException || cause instanceof HttpTimeoutException) {
            log.warn("节点请求超时: {}", address);
            return FetchResult.failure(address, PollingError.TIMEOUT_ERROR, "no response within timeout");
        }
        if (cause instanceof IOException) {
            log.warn("节点连接失败: {} - {}", address, cause.toString());
            return FetchResult.failure(address, PollingError.CONNECTION_ERROR, cause.toString());
        }
        log.error("节点请求异常: {}", address, cause);
        return FetchResult.failure(address, PollingError.CONNECTION_ERROR, String.valueOf(cause));
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_DETAIL_LENGTH ? body : body.substring(0, MAX_DETAIL_LENGTH) + "...";
    }
}
