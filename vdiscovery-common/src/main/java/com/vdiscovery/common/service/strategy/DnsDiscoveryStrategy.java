/**
 * DNS发现策略
 *
 * @author zhenglin
 * @date 2025/09/03
 */
package com.vdiscovery.common.service.strategy;

import com.vdiscovery.common.exception.ServiceNotFoundException;
import com.vdiscovery.common.model.DiscoveryStrategyType;
import com.vdiscovery.common.model.ServiceRecord;
import com.vdiscovery.common.service.DiscoveryStrategy;
import com.vdiscovery.common.service.DnsResolver;
import lombok.RequiredArgsConstructor;

import java.net.InetSocketAddress;
import java.util.HashMap;
import java.util.Map;

/**
 * 通过可替换的DnsResolver解析服务名
 */
@RequiredArgsConstructor
public class DnsDiscoveryStrategy implements DiscoveryStrategy {

    public static final String SOURCE_KEY = "discovered_by";

    private final DnsResolver resolver;

    @Override
    public DiscoveryStrategyType type() {
        return DiscoveryStrategyType.DNS;
    }

    @Override
    public ServiceRecord resolve(String serviceName) {
        InetSocketAddress address = resolver.resolve(serviceName)
            .orElseThrow(() -> new ServiceNotFoundException(serviceName, "dns lookup failed: " + serviceName));

        Map<String, String> metadata = new HashMap<>();
        metadata.put(SOURCE_KEY, "dns");
        return ServiceRecord.builder()
            .name(serviceName)
            .host(address.getHostString())
            .port(address.getPort())
            .metadata(metadata)
            .build();
    }
}
