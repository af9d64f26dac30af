package com.wangbin.meshinfo.core.collector.scheduler;

import com.wangbin.meshinfo.common.domain.enums.PollingError;
import com.wangbin.meshinfo.core.collector.fetch.FetchResult;
import com.wangbin.meshinfo.core.collector.fetch.NodeFetcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 轮询调度器
 *
 * 同时进行中的抓取不超过并发上限；每个抓取完成（成功、失败或超时）后释放一个名额并放行下一个地址。
 * 调度本身不阻塞任何线程，超时由独立的计时线程池触发。
 */
@Slf4j
@Component
public class PollingScheduler {

    private final NodeFetcher fetcher;
    private final ScheduledExecutorService timeoutScheduler;

    public PollingScheduler(NodeFetcher fetcher,
                            @Qualifier("timeoutScheduler") ScheduledExecutorService timeoutScheduler) {
        this.fetcher = fetcher;
        this.timeoutScheduler = timeoutScheduler;
    }

    /**
     * 轮询一批地址
     *
     * @param addresses        待轮询地址
     * @param concurrencyLimit 并发上限
     * @param perItemTimeout   单节点超时
     * @return 所有地址都有结果后完成，结果顺序不确定
     */
    public CompletableFuture<List<FetchResult>> run(Collection<String> addresses, int concurrencyLimit,
                                                    Duration perItemTimeout) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("并发上限必须大于0: " + concurrencyLimit);
        }
        Batch batch = new Batch(addresses, concurrencyLimit, perItemTimeout);
        log.info("开始轮询 {} 个节点, 并发上限 {}, 单节点超时 {}s",
                addresses.size(), concurrencyLimit, perItemTimeout.toSeconds());
        batch.drain();
        return batch.done;
    }

    /**
     * 单轮轮询状态
     */
    private final class Batch {

        private final Queue<String> pending;
        private final Queue<FetchResult> results = new ConcurrentLinkedQueue<>();
        private final int total;
        private final int limit;
        private final Duration timeout;
        private final CompletableFuture<List<FetchResult>> done = new CompletableFuture<>();

        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger finished = new AtomicInteger();
        /** 放行循环的重入计数，保证同一时刻只有一个线程在放行 */
        private final AtomicInteger drainRequests = new AtomicInteger();

        Batch(Collection<String> addresses, int limit, Duration timeout) {
            this.pending = new ConcurrentLinkedQueue<>(addresses);
            this.total = addresses.size();
            this.limit = limit;
            this.timeout = timeout;
            if (total == 0) {
                done.complete(List.of());
            }
        }

        void drain() {
            if (drainRequests.getAndIncrement() != 0) {
                return;
            }
            int missed = 1;
            while (true) {
                while (inFlight.get() < limit) {
                    String address = pending.poll();
                    if (address == null) {
                        break;
                    }
                    inFlight.incrementAndGet();
                    launch(address);
                }
                missed = drainRequests.addAndGet(-missed);
                if (missed == 0) {
                    return;
                }
            }
        }

        private void launch(String address) {
            CompletableFuture<FetchResult> guarded = new CompletableFuture<>();
            guarded.whenComplete((result, throwable) -> complete(result));

            CompletableFuture<FetchResult> future;
            try {
                future = fetcher.fetch(address, timeout);
            } catch (RuntimeException e) {
                log.error("节点抓取启动失败: {}", address, e);
                guarded.complete(FetchResult.failure(address, PollingError.CONNECTION_ERROR, e.toString()));
                return;
            }
            if (future.isDone()) {
                guarded.complete(settle(address, future));
                return;
            }

            // 超时先取消底层请求，名额在请求结束后才释放
            ScheduledFuture<?> timer = timeoutScheduler.schedule(() -> {
                if (future.cancel(true)) {
                    log.warn("节点轮询超时: {}", address);
                }
                guarded.complete(timedOut(address));
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);
            future.whenComplete((result, throwable) -> {
                timer.cancel(false);
                guarded.complete(throwable != null ? fromThrowable(address, throwable) : result);
            });
        }

        private FetchResult settle(String address, CompletableFuture<FetchResult> future) {
            try {
                return future.join();
            } catch (CancellationException | CompletionException e) {
                return fromThrowable(address, e);
            }
        }

        private FetchResult timedOut(String address) {
            return FetchResult.failure(address, PollingError.TIMEOUT_ERROR,
                    "no response within " + timeout.toMillis() + "ms");
        }

        private FetchResult fromThrowable(String address, Throwable throwable) {
            Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                    ? throwable.getCause() : throwable;
            if (cause instanceof TimeoutException || cause instanceof CancellationException) {
                return timedOut(address);
            }
            return FetchResult.failure(address, PollingError.CONNECTION_ERROR, cause.toString());
        }

        private void complete(FetchResult result) {
            results.add(result);
            inFlight.decrementAndGet();
            if (finished.incrementAndGet() == total) {
                done.complete(new ArrayList<>(results));
            } else {
                drain();
            }
        }
    }
}
