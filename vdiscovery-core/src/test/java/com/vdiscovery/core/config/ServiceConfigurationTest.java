/**
 * 服务配置类测试
 *
 * @author zhenglin
 * @date 2025/09/08
 */
package com.vdiscovery.core.config;

import com.vdiscovery.common.exception.InvalidConfigException;
import com.vdiscovery.common.model.PortRange;
import com.vdiscovery.common.model.ServiceRecord;
import com.vdiscovery.common.service.DiscoveryClient;
import com.vdiscovery.common.service.HealthMonitor;
import com.vdiscovery.common.service.PortAllocator;
import com.vdiscovery.common.service.ServiceRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ServiceConfigurationTest {

    @Test
    void testBeansAreWiredTogether() {
        DiscoveryProperties properties = new DiscoveryProperties();
        ServiceConfiguration configuration = new ServiceConfiguration(properties);
        configuration.init();

        ServiceRegistry registry = configuration.serviceRegistry();
        PortAllocator allocator = configuration.portAllocator();
        HealthMonitor monitor = configuration.healthMonitor(registry, allocator);
        DiscoveryClient client = configuration.discoveryClient(registry, allocator,
            configuration.dnsResolver(), monitor);
        try {
            ServiceRecord stored = client.register(ServiceRecord.builder().name("api").host("localhost").port(0).build());

            assertEquals(8081, stored.getPort());
            assertEquals("localhost:8081", client.getServiceAddress("api"));
            assertEquals(1, monitor.getHealthyServices().size());
        } finally {
            client.close();
            monitor.close();
        }
    }

    @Test
    void testAllocatorAcceptsRuntimeRangeUpdate() {
        ServiceConfiguration configuration = new ServiceConfiguration(new DiscoveryProperties());
        PortAllocator allocator = configuration.portAllocator();

        allocator.setPortRange("search", PortRange.of(9200, 9209));
        allocator.addReservedPort(9200);

        assertEquals(9201, allocator.allocate("elastic", "search"));
    }

    @Test
    void testInvalidConfigurationFailsFast() {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.getHealth().setRemovalThreshold(1);

        assertThrows(InvalidConfigException.class, () -> new ServiceConfiguration(properties).init());
    }
}
