/**
 * 服务不存在异常
 *
 * @author zhenglin
 * @date 2025/09/02
 */
package com.vdiscovery.common.exception;

import com.vdiscovery.common.model.DiscoveryStrategyType;

import java.util.Collections;
import java.util.List;

/**
 * 服务不存在、已过期，或所有发现策略均未命中时抛出
 */
public class ServiceNotFoundException extends DiscoveryException {

    private static final long serialVersionUID = 1L;

    private final String serviceName;

    /**
     * 已尝试的发现策略，注册表直接查询时为空
     */
    private final List<DiscoveryStrategyType> attemptedStrategies;

    public ServiceNotFoundException(String serviceName) {
        this(serviceName, "service not found: " + serviceName);
    }

    public ServiceNotFoundException(String serviceName, String message) {
        super(message);
        this.serviceName = serviceName;
        this.attemptedStrategies = Collections.emptyList();
    }

    public ServiceNotFoundException(String serviceName, List<DiscoveryStrategyType> attemptedStrategies) {
        super("service not found: " + serviceName + " (attempted: " + attemptedStrategies + ")");
        this.serviceName = serviceName;
        this.attemptedStrategies = List.copyOf(attemptedStrategies);
    }

    public String getServiceName() {
        return serviceName;
    }

    public List<DiscoveryStrategyType> getAttemptedStrategies() {
        return attemptedStrategies;
    }
}
