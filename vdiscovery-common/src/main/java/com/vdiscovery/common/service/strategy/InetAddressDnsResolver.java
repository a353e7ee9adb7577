/**
 * 基于JDK InetAddress的DNS解析
 *
 * @author zhenglin
 * @date 2025/09/03
 */
package com.vdiscovery.common.service.strategy;

import com.vdiscovery.common.service.DnsResolver;
import com.vdiscovery.common.util.ServiceTypeResolver;
import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 解析服务名为主机地址，端口取该服务的约定端口，没有约定时使用80
 */
@Slf4j
public class InetAddressDnsResolver implements DnsResolver {

    static final int FALLBACK_PORT = 80;

    private final Map<String, Integer> defaultPorts;

    public InetAddressDnsResolver(Map<String, Integer> defaultPorts) {
        this.defaultPorts = defaultPorts == null ? new HashMap<>() : new HashMap<>(defaultPorts);
    }

    @Override
    public Optional<InetSocketAddress> resolve(String serviceName) {
        try {
            InetAddress address = InetAddress.getByName(serviceName);
            int port = ServiceTypeResolver.defaultPort(serviceName, defaultPorts).orElse(FALLBACK_PORT);
            return Optional.of(InetSocketAddress.createUnresolved(address.getHostAddress(), port));
        } catch (UnknownHostException e) {
            log.debug("DNS lookup failed: name={}, reason={}", serviceName, e.getMessage());
            return Optional.empty();
        }
    }
}
