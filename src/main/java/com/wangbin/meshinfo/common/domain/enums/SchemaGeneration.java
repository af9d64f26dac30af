package com.wangbin.meshinfo.common.domain.enums;

/**
 * sysinfo.json 文档结构代际
 */
public enum SchemaGeneration {

    /** 扁平结构，隧道信息为 tunnel_installed 标志 */
    LEGACY,

    /** 嵌套结构（node_details / meshrf / tunnels） */
    CURRENT
}
