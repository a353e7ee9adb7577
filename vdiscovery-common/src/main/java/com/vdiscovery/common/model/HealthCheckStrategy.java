/**
 * 健康检查策略
 *
 * @author zhenglin
 * @date 2025/09/04
 */
package com.vdiscovery.common.model;

/**
 * 健康检查策略枚举
 */
public enum HealthCheckStrategy {

    /**
     * TCP建连后立即关闭
     */
    TCP,

    /**
     * HTTP GET健康检查路径，2xx视为健康
     */
    HTTP,

    /**
     * 调用方注册的自定义检查函数
     */
    CUSTOM
}
