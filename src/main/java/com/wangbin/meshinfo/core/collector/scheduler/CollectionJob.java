package com.wangbin.meshinfo.core.collector.scheduler;

import com.wangbin.meshinfo.core.collector.CollectionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 周期采集任务
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "mesh-info.collector", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CollectionJob {

    private final CollectionService collectionService;

    @Scheduled(fixedDelayString = "${mesh-info.collector.period:PT5M}", initialDelayString = "${mesh-info.collector.initial-delay:PT10S}")
    public void run() {
        try {
            collectionService.collect().ifPresent(snapshot -> {
                if (snapshot.getRun().isAborted()) {
                    log.warn("本轮采集中止: {}, 连续拓扑失败 {} 次", snapshot.getRun().getFailureCategory(),
                            collectionService.getConsecutiveTopologyFailures());
                }
            });
        } catch (RuntimeException e) {
            // 保持调度继续，下一周期重试
            log.error("采集任务执行异常", e);
        }
    }
}
