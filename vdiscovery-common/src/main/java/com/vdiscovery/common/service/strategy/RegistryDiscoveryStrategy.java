/**
 * 注册表发现策略
 *
 * @author zhenglin
 * @date 2025/09/03
 */
package com.vdiscovery.common.service.strategy;

import com.vdiscovery.common.exception.ServiceNotFoundException;
import com.vdiscovery.common.model.DiscoveryStrategyType;
import com.vdiscovery.common.model.ServiceRecord;
import com.vdiscovery.common.service.DiscoveryStrategy;
import com.vdiscovery.common.service.ServiceRegistry;
import lombok.RequiredArgsConstructor;

/**
 * 从本地注册表查找，只返回健康且未过期的记录
 */
@RequiredArgsConstructor
public class RegistryDiscoveryStrategy implements DiscoveryStrategy {

    private final ServiceRegistry registry;

    @Override
    public DiscoveryStrategyType type() {
        return DiscoveryStrategyType.REGISTRY;
    }

    @Override
    public ServiceRecord resolve(String serviceName) {
        ServiceRecord record = registry.get(serviceName);
        if (!record.isHealthy()) {
            throw new ServiceNotFoundException(serviceName, "service unhealthy: " + serviceName);
        }
        return record;
    }

    @Override
    public boolean isLocal() {
        return true;
    }
}
