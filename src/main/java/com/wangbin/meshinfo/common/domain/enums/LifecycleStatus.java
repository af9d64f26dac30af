package com.wangbin.meshinfo.common.domain.enums;

/**
 * 节点/链路生命周期状态，CURRENT 与 RECENT 统称为活跃
 */
public enum LifecycleStatus {

    CURRENT("Current"),
    RECENT("Recent"),
    INACTIVE("Inactive");

    private final String label;

    LifecycleStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isActive() {
        return this != INACTIVE;
    }

    @Override
    public String toString() {
        return label;
    }
}
