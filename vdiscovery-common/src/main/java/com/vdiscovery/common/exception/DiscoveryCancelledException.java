/**
 * 操作被取消异常
 *
 * @author zhenglin
 * @date 2025/09/03
 */
package com.vdiscovery.common.exception;

/**
 * 阻塞操作因线程中断而提前返回时抛出，调用线程的中断标记会被保留
 */
public class DiscoveryCancelledException extends DiscoveryException {

    private static final long serialVersionUID = 1L;

    public DiscoveryCancelledException(String message) {
        super(message);
    }

    public DiscoveryCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
