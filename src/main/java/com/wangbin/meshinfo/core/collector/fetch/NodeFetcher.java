package com.wangbin.meshinfo.core.collector.fetch;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * 节点抓取器
 *
 * 返回的 future 不以异常结束：所有失败都表示为 {@link FetchResult#failure}。
 * 调用方超时后会取消返回的 future，实现应随之释放底层连接。
 */
public interface NodeFetcher {

    /**
     * 抓取并解析一个节点的状态文档
     *
     * @param address 节点地址
     * @param timeout 连接与读取共用的总超时
     */
    CompletableFuture<FetchResult> fetch(String address, Duration timeout);
}
