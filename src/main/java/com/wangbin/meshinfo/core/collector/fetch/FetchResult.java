package com.wangbin.meshinfo.core.collector.fetch;

import com.wangbin.meshinfo.common.domain.entity.NodeError;
import com.wangbin.meshinfo.common.domain.entity.NodeObservation;
import com.wangbin.meshinfo.common.domain.enums.PollingError;

/**
 * 单个节点的抓取结果：成功时携带观测，失败时携带错误，二者恰有其一
 */
public final class FetchResult {

    private final String address;
    private final NodeObservation observation;
    private final NodeError error;

    private FetchResult(String address, NodeObservation observation, NodeError error) {
        this.address = address;
        this.observation = observation;
        this.error = error;
    }

    public static FetchResult success(String address, NodeObservation observation) {
        return new FetchResult(address, observation, null);
    }

    public static FetchResult failure(String address, PollingError error, String details) {
        return new FetchResult(address, null, NodeError.of(address, null, error, details));
    }

    public static FetchResult failure(NodeError error) {
        return new FetchResult(error.getIpAddress(), null, error);
    }

    public String getAddress() {
        return address;
    }

    public NodeObservation getObservation() {
        return observation;
    }

    public NodeError getError() {
        return error;
    }

    public boolean isSuccess() {
        return observation != null;
    }

    @Override
    public String toString() {
        return isSuccess() ? "OK " + observation.label() : error.getError() + " " + address;
    }
}
