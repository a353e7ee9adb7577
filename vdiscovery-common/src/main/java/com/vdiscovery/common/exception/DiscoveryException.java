/**
 * 服务发现异常基类
 *
 * @author zhenglin
 * @date 2025/09/02
 */
package com.vdiscovery.common.exception;

/**
 * 服务发现子系统异常基类
 *
 * 所有注册、分配、发现、健康检查相关的可恢复错误均继承此类
 */
public class DiscoveryException extends RuntimeException {

    /**
     * 序列化版本号
     */
    private static final long serialVersionUID = 1L;

    /**
     * 创建服务发现异常
     *
     * @param message 异常消息
     */
    public DiscoveryException(String message) {
        super(message);
    }

    /**
     * 创建服务发现异常
     *
     * @param message 异常消息
     * @param cause 原因异常
     */
    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
