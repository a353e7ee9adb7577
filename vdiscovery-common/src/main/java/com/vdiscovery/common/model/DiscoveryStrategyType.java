/**
 * 服务发现策略类型
 *
 * @author zhenglin
 * @date 2025/09/03
 */
package com.vdiscovery.common.model;

/**
 * 服务发现策略枚举
 */
public enum DiscoveryStrategyType {

    /**
     * 查询本地服务注册表
     */
    REGISTRY,

    /**
     * DNS解析回退
     */
    DNS,

    /**
     * 探测本机的约定端口
     */
    DEFAULT_PORT
}
