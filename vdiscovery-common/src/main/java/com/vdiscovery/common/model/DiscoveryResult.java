/**
 * 服务发现结果
 *
 * @author zhenglin
 * @date 2025/09/03
 */
package com.vdiscovery.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * 一次发现调用的结果，不做持久化
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveryResult {

    /**
     * 解析到的服务记录
     */
    private ServiceRecord record;

    /**
     * 命中的发现策略
     */
    private DiscoveryStrategyType strategy;

    /**
     * 解析耗时
     */
    private Duration latency;
}
