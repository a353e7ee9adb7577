/**
 * 健康监控重复启动异常
 *
 * @author zhenglin
 * @date 2025/09/04
 */
package com.vdiscovery.common.exception;

/**
 * 对运行中的健康监控再次调用start时抛出
 */
public class HealthMonitorAlreadyRunningException extends DiscoveryException {

    private static final long serialVersionUID = 1L;

    public HealthMonitorAlreadyRunningException() {
        super("health monitor already running");
    }
}
