/**
 * DNS解析接口
 *
 * @author zhenglin
 * @date 2025/09/03
 */
package com.vdiscovery.common.service;

import java.net.InetSocketAddress;
import java.util.Optional;

/**
 * 外部DNS解析能力，可替换
 */
@FunctionalInterface
public interface DnsResolver {

    /**
     * 解析服务名
     *
     * @param serviceName 服务名称
     * @return 未解析的主机和端口，解析失败返回空
     */
    Optional<InetSocketAddress> resolve(String serviceName);
}
