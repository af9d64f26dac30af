package com.wangbin.meshinfo.common.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 节点发布的本地服务
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NodeService {

    private String name;

    private String protocol;

    private String link;
}
