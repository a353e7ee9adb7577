/**
 * 健康检查结果
 *
 * @author zhenglin
 * @date 2025/09/04
 */
package com.vdiscovery.common.model;

import com.vdiscovery.common.exception.ProbeFailedException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * 单次探测结果
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class HealthCheckResult {

    private String serviceName;

    private boolean healthy;

    /**
     * 探测失败原因，成功时为null
     */
    private ProbeFailedException error;

    /**
     * 实际使用的探测策略
     */
    private HealthCheckStrategy strategy;

    private Instant timestamp;

    private Duration latency;
}
