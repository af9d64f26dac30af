package com.wangbin.meshinfo.common.domain.entity;

import com.wangbin.meshinfo.common.domain.enums.LinkType;

/**
 * 链路唯一标识：同一对节点之间不同介质是不同的链路
 */
public record LinkKey(long sourceId, long destinationId, LinkType type) {
}
