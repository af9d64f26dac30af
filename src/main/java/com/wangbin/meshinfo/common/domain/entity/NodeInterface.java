package com.wangbin.meshinfo.common.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 节点网络接口
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NodeInterface {

    /** 接口名称，如 wlan0、br-dtdlink */
    private String name;

    /** MAC地址，部分隧道接口没有 */
    private String macAddress;

    /** IP地址，上报为 none 时为 null */
    private String ipAddress;
}
