package com.wangbin.meshinfo.common.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class ThreadPoolConfig {

    private final int cpuCores = Runtime.getRuntime().availableProcessors();

    private ThreadFactory buildNamedThreadFactory(String prefix, boolean daemon) {
        return new ThreadFactoryBuilder()
                .setNameFormat(prefix + "-%d")
                .setDaemon(daemon)
                .setPriority(Thread.NORM_PRIORITY)
                .build();
    }

    /**
     * HTTP客户端线程池（IO密集型），并发上限由调度器的信号量控制
     */
    @Bean(name = "pollerExecutor", destroyMethod = "shutdown")
    public ExecutorService pollerExecutor() {
        return new ThreadPoolExecutor(
                cpuCores * 2,
                cpuCores * 8,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(10000),
                buildNamedThreadFactory("mesh-poller", true),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    /**
     * 超时计时线程池，负责触发单节点超时
     */
    @Bean(name = "timeoutScheduler", destroyMethod = "shutdown")
    public ScheduledExecutorService timeoutScheduler() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
                Math.max(2, cpuCores / 4),
                buildNamedThreadFactory("poll-timeout", true)
        );
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
