/**
 * 约定端口发现策略
 *
 * @author zhenglin
 * @date 2025/09/03
 */
package com.vdiscovery.common.service.strategy;

import com.vdiscovery.common.exception.ServiceNotFoundException;
import com.vdiscovery.common.model.DiscoveryStrategyType;
import com.vdiscovery.common.model.ServiceRecord;
import com.vdiscovery.common.service.DiscoveryStrategy;
import com.vdiscovery.common.util.ServiceTypeResolver;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * 按服务类型的约定端口尝试连接本机，适用于本地开发环境中未注册的基础设施服务
 */
@Slf4j
public class DefaultPortDiscoveryStrategy implements DiscoveryStrategy {

    static final Duration CONNECT_TIMEOUT = Duration.ofMillis(100);

    private final Map<String, Integer> defaultPorts;
    private final String host;

    public DefaultPortDiscoveryStrategy(Map<String, Integer> defaultPorts) {
        this(defaultPorts, "localhost");
    }

    public DefaultPortDiscoveryStrategy(Map<String, Integer> defaultPorts, String host) {
        this.defaultPorts = defaultPorts == null ? new HashMap<>() : new HashMap<>(defaultPorts);
        this.host = host;
    }

    @Override
    public DiscoveryStrategyType type() {
        return DiscoveryStrategyType.DEFAULT_PORT;
    }

    @Override
    public ServiceRecord resolve(String serviceName) {
        int port = ServiceTypeResolver.defaultPort(serviceName, defaultPorts)
            .orElseThrow(() -> new ServiceNotFoundException(serviceName, "no default port for " + serviceName));

        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) CONNECT_TIMEOUT.toMillis());
        } catch (IOException e) {
            log.debug("Default port not reachable: service={}, addr={}:{}", serviceName, host, port);
            throw new ServiceNotFoundException(serviceName, "default port not reachable: " + host + ":" + port);
        }

        Map<String, String> metadata = new HashMap<>();
        metadata.put(DnsDiscoveryStrategy.SOURCE_KEY, "default_port");
        return ServiceRecord.builder()
            .name(serviceName)
            .host(host)
            .port(port)
            .metadata(metadata)
            .build();
    }
}
