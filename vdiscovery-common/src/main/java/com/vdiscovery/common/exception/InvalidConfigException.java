/**
 * 配置非法异常
 *
 * @author zhenglin
 * @date 2025/09/05
 */
package com.vdiscovery.common.exception;

/**
 * 服务发现配置校验失败时抛出
 */
public class InvalidConfigException extends DiscoveryException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigException(String message) {
        super("invalid configuration: " + message);
    }
}
