package com.wangbin.meshinfo.common.domain.entity;

import com.wangbin.meshinfo.common.domain.enums.ErrorCategory;
import com.wangbin.meshinfo.common.domain.enums.PollingError;
import lombok.Builder;
import lombok.Data;

/**
 * 单节点采集错误
 */
@Data
@Builder
public class NodeError {

    private final String ipAddress;

    /** 反向DNS解析得到的名称，可能为空 */
    private final String dnsName;

    private final PollingError error;

    private final ErrorCategory category;

    /** 诊断信息，可能包含原始响应 */
    private final String details;

    public static NodeError of(String ipAddress, String dnsName, PollingError error, String details) {
        return NodeError.builder()
                .ipAddress(ipAddress)
                .dnsName(dnsName)
                .error(error)
                .category(error.getCategory())
                .details(details)
                .build();
    }

    public String label() {
        String name = dnsName == null || dnsName.isBlank() ? "name unknown" : dnsName;
        return name + " (" + ipAddress + ")";
    }
}
