package com.wangbin.meshinfo.core.lifecycle;

import com.wangbin.meshinfo.common.domain.enums.LifecycleStatus;

import java.time.Duration;
import java.time.Instant;

/**
 * 按最后发现时间划分生命周期状态，节点与链路使用同一规则、不同阈值
 */
public final class LifecycleClassifier {

    private LifecycleClassifier() {
    }

    /**
     * @param lastSeen     最后发现时间
     * @param runTimestamp 本轮采集时间
     * @param threshold    失活阈值
     */
    public static LifecycleStatus classify(Instant lastSeen, Instant runTimestamp, Duration threshold) {
        if (lastSeen == null) {
            return LifecycleStatus.INACTIVE;
        }
        if (lastSeen.equals(runTimestamp)) {
            return LifecycleStatus.CURRENT;
        }
        Duration age = Duration.between(lastSeen, runTimestamp);
        return age.compareTo(threshold) <= 0 ? LifecycleStatus.RECENT : LifecycleStatus.INACTIVE;
    }
}
