/**
 * 健康探针接口
 *
 * @author zhenglin
 * @date 2025/09/04
 */
package com.vdiscovery.common.service;

import com.vdiscovery.common.model.HealthCheckStrategy;
import com.vdiscovery.common.model.ServiceRecord;

import java.time.Duration;

/**
 * 一种可达性探测方式
 */
public interface HealthProbe {

    HealthCheckStrategy strategy();

    /**
     * 探测服务
     *
     * @param record 服务记录
     * @param timeout 探测超时
     * @throws com.vdiscovery.common.exception.ProbeFailedException 探测失败
     */
    void probe(ServiceRecord record, Duration timeout);
}
