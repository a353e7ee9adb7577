/**
 * 服务发现超时异常
 *
 * @author zhenglin
 * @date 2025/09/03
 */
package com.vdiscovery.common.exception;

import java.time.Duration;

/**
 * 在给定时限内未能发现服务时抛出
 */
public class DiscoveryTimeoutException extends DiscoveryException {

    private static final long serialVersionUID = 1L;

    private final String serviceName;

    private final Duration timeout;

    public DiscoveryTimeoutException(String serviceName, Duration timeout) {
        super("timeout waiting for service " + serviceName + " after " + timeout.toMillis() + "ms");
        this.serviceName = serviceName;
        this.timeout = timeout;
    }

    public String getServiceName() {
        return serviceName;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
