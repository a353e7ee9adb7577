/**
 * 健康监控未运行异常
 *
 * @author zhenglin
 * @date 2025/09/04
 */
package com.vdiscovery.common.exception;

/**
 * 对未运行的健康监控调用stop时抛出
 */
public class HealthMonitorNotRunningException extends DiscoveryException {

    private static final long serialVersionUID = 1L;

    public HealthMonitorNotRunningException() {
        super("health monitor not running");
    }
}
