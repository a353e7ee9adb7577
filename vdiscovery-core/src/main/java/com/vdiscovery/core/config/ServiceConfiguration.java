/**
 * 服务配置类
 *
 * @author zhenglin
 * @date 2025/09/05
 */
package com.vdiscovery.core.config;

import com.vdiscovery.common.model.PortRange;
import com.vdiscovery.common.model.ServiceRecord;
import com.vdiscovery.common.service.DiscoveryClient;
import com.vdiscovery.common.service.DnsResolver;
import com.vdiscovery.common.service.HealthMonitor;
import com.vdiscovery.common.service.PortAllocator;
import com.vdiscovery.common.service.ServiceRegistry;
import com.vdiscovery.common.service.impl.DiscoveryClientImpl;
import com.vdiscovery.common.service.impl.HealthMonitorImpl;
import com.vdiscovery.common.service.impl.InMemoryServiceRegistry;
import com.vdiscovery.common.service.impl.PortAllocatorImpl;
import com.vdiscovery.common.service.strategy.InetAddressDnsResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.annotation.PostConstruct;
import java.util.Set;

/**
 * 服务发现核心配置类
 * 注册服务注册表、端口分配器、健康监控和发现客户端
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ServiceConfiguration {

    private final DiscoveryProperties properties;

    /**
     * 初始化回调，配置非法时阻止容器启动
     */
    @PostConstruct
    public void init() {
        properties.validate();
        log.info("服务发现配置校验通过: defaultTtl={}, checkInterval={}, strategies={}",
            properties.getRegistry().getDefaultTtl(), properties.getHealth().getCheckInterval(),
            properties.getClient().getPreferredStrategies());
    }

    /**
     * 内存服务注册表Bean（无外部中间件）
     */
    @Bean
    public ServiceRegistry serviceRegistry() {
        log.info("创建内存服务注册表Bean");
        InMemoryServiceRegistry registry = new InMemoryServiceRegistry(properties.getRegistry());

        // 添加注册表事件监听器进行日志记录
        registry.addRegistryListener(new RegistryEventLogger());

        return registry;
    }

    /**
     * 端口分配器Bean
     */
    @Bean
    public PortAllocator portAllocator() {
        log.info("创建端口分配器Bean: ranges={}", properties.getAllocator().getRanges().keySet());
        PortAllocatorImpl allocator = new PortAllocatorImpl(properties.getAllocator());
        allocator.addConfigListener(new AllocatorConfigLogger());
        return allocator;
    }

    @Bean
    public DnsResolver dnsResolver() {
        return new InetAddressDnsResolver(properties.getClient().getDefaultPorts());
    }

    /**
     * 健康监控Bean，启动由DiscoveryLifecycleManager负责
     */
    @Bean
    public HealthMonitor healthMonitor(ServiceRegistry serviceRegistry, PortAllocator portAllocator) {
        log.info("创建健康监控Bean");
        return new HealthMonitorImpl(properties.getHealth(), serviceRegistry, portAllocator);
    }

    /**
     * 服务发现客户端Bean
     */
    @Bean
    public DiscoveryClient discoveryClient(ServiceRegistry serviceRegistry, PortAllocator portAllocator,
                                           DnsResolver dnsResolver, HealthMonitor healthMonitor) {
        log.info("创建服务发现客户端Bean");
        return new DiscoveryClientImpl(properties.getClient(), serviceRegistry, portAllocator,
            dnsResolver, healthMonitor);
    }

    /**
     * 端口分配器运行时配置变更日志记录器
     */
    static class AllocatorConfigLogger implements PortAllocator.AllocatorConfigListener {

        @Override
        public void onPortRangeChanged(String rangeName, PortRange oldRange, PortRange newRange) {
            log.info("端口范围变更事件: range={}, old={}, new={}", rangeName, oldRange, newRange);
        }

        @Override
        public void onReservedPortsChanged(Set<Integer> reservedPorts) {
            log.info("保留端口变更事件: reserved={}", reservedPorts);
        }
    }

    /**
     * 注册表事件日志记录器
     */
    static class RegistryEventLogger implements ServiceRegistry.RegistryEventListener {

        @Override
        public void onServiceRegistered(ServiceRecord record, boolean renewal) {
            log.debug("服务注册事件: name={}, addr={}, renewal={}", record.getName(), record.getAddress(), renewal);
        }

        @Override
        public void onServiceDeregistered(ServiceRecord record) {
            log.debug("服务注销事件: name={}, addr={}", record.getName(), record.getAddress());
        }

        @Override
        public void onServiceExpired(ServiceRecord record) {
            log.warn("服务过期事件: name={}, addr={}, lastHeartbeat={}",
                record.getName(), record.getAddress(), record.getLastHeartbeat());
        }

        @Override
        public void onHealthChanged(String serviceName, boolean healthy) {
            log.debug("健康状态变化事件: name={}, healthy={}", serviceName, healthy);
        }
    }
}
