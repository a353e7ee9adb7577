/**
 * 健康探测失败异常
 *
 * @author zhenglin
 * @date 2025/09/04
 */
package com.vdiscovery.common.exception;

/**
 * 单次健康探测失败，包装底层连接或HTTP错误
 *
 * 探测失败不是致命错误，只作为HealthCheckResult的失败原因记录
 */
public class ProbeFailedException extends DiscoveryException {

    private static final long serialVersionUID = 1L;

    public ProbeFailedException(String message) {
        super(message);
    }

    public ProbeFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
