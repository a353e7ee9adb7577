/**
 * 服务信息非法异常
 *
 * @author zhenglin
 * @date 2025/09/02
 */
package com.vdiscovery.common.exception;

/**
 * 注册的服务信息缺少必填字段或端口越界时抛出
 */
public class InvalidServiceException extends DiscoveryException {

    private static final long serialVersionUID = 1L;

    public InvalidServiceException(String message) {
        super("invalid service information: " + message);
    }
}
