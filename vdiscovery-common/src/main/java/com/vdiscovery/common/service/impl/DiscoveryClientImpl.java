/**
 * 服务发现客户端实现
 *
 * @author zhenglin
 * @date 2025/09/03
 */
package com.vdiscovery.common.service.impl;

import com.vdiscovery.common.config.DiscoveryConfig;
import com.vdiscovery.common.exception.DiscoveryCancelledException;
import com.vdiscovery.common.exception.DiscoveryException;
import com.vdiscovery.common.exception.DiscoveryTimeoutException;
import com.vdiscovery.common.exception.InvalidServiceException;
import com.vdiscovery.common.exception.ServiceNotFoundException;
import com.vdiscovery.common.model.DiscoveryResult;
import com.vdiscovery.common.model.DiscoveryStrategyType;
import com.vdiscovery.common.model.HealthCheckResult;
import com.vdiscovery.common.model.PortAssignment;
import com.vdiscovery.common.model.ServiceRecord;
import com.vdiscovery.common.service.DiscoveryClient;
import com.vdiscovery.common.service.DiscoveryStrategy;
import com.vdiscovery.common.service.DnsResolver;
import com.vdiscovery.common.service.HealthMonitor;
import com.vdiscovery.common.service.PortAllocator;
import com.vdiscovery.common.service.ServiceRegistry;
import com.vdiscovery.common.service.strategy.DefaultPortDiscoveryStrategy;
import com.vdiscovery.common.service.strategy.DnsDiscoveryStrategy;
import com.vdiscovery.common.service.strategy.RegistryDiscoveryStrategy;
import com.vdiscovery.common.util.ServiceTypeResolver;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 服务发现客户端
 * 注册时按需分配端口；发现时按配置顺序依次尝试各策略，整体受discoveryTimeout约束，
 * 注册表查找在调用线程上直接执行，其余策略提交到解析线程池并按剩余时间等待
 */
@Slf4j
public class DiscoveryClientImpl implements DiscoveryClient {

    private final DiscoveryConfig.Client config;
    private final ServiceRegistry registry;
    private final PortAllocator portAllocator;
    private final HealthMonitor healthMonitor;
    private final List<DiscoveryStrategy> strategies = new CopyOnWriteArrayList<>();
    private final ExecutorService resolverPool;
    private volatile boolean closed;

    public DiscoveryClientImpl(DiscoveryConfig.Client config, ServiceRegistry registry, PortAllocator portAllocator) {
        this(config, registry, portAllocator, null, null);
    }

    /**
     * @param config 客户端配置
     * @param registry 服务注册表
     * @param portAllocator 端口分配器
     * @param dnsResolver DNS解析器，为null时跳过DNS策略
     * @param healthMonitor 健康监控，可为null
     */
    public DiscoveryClientImpl(DiscoveryConfig.Client config, ServiceRegistry registry, PortAllocator portAllocator,
                               DnsResolver dnsResolver, HealthMonitor healthMonitor) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.portAllocator = Objects.requireNonNull(portAllocator, "portAllocator");
        this.healthMonitor = healthMonitor;

        for (DiscoveryStrategyType type : config.getPreferredStrategies()) {
            DiscoveryStrategy strategy = createStrategy(type, dnsResolver);
            if (strategy != null) {
                strategies.add(strategy);
            } else {
                log.info("Discovery strategy disabled: type={}", type);
            }
        }

        // TTL清理掉的服务不会再注销，由这里归还其端口
        registry.addRegistryListener(new ServiceRegistry.RegistryEventListener() {
            @Override
            public void onServiceExpired(ServiceRecord record) {
                releaseIfUnused(record.getName(), record.getPort());
            }
        });

        AtomicInteger threadIndex = new AtomicInteger();
        this.resolverPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "discovery-resolver-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private DiscoveryStrategy createStrategy(DiscoveryStrategyType type, DnsResolver dnsResolver) {
        switch (type) {
            case REGISTRY:
                return new RegistryDiscoveryStrategy(registry);
            case DNS:
                return config.isEnableDns() && dnsResolver != null ? new DnsDiscoveryStrategy(dnsResolver) : null;
            case DEFAULT_PORT:
                return new DefaultPortDiscoveryStrategy(config.getDefaultPorts());
            default:
                return null;
        }
    }

    @Override
    public ServiceRecord register(ServiceRecord record) {
        return register(record, null);
    }

    @Override
    public ServiceRecord register(ServiceRecord record, String rangeHint) {
        if (record == null || record.getName() == null || record.getName().isBlank()) {
            throw new InvalidServiceException("name is required");
        }
        ensureOpen();
        String name = record.getName();
        ServiceRecord entry = record.copy();

        int allocatedPort = 0;
        if (entry.getPort() == 0) {
            String range = rangeHint == null || rangeHint.isBlank() ? ServiceTypeResolver.resolve(name) : rangeHint;
            PortAssignment assignment = portAllocator.assign(name, range);
            entry.setPort(assignment.getPort());
            if (assignment.isFresh()) {
                allocatedPort = assignment.getPort();
            }
        }

        try {
            if (Thread.currentThread().isInterrupted()) {
                throw new DiscoveryCancelledException("registration cancelled: " + name);
            }
            return registry.register(entry);
        } catch (RuntimeException e) {
            if (allocatedPort > 0 && releaseIfUnused(name, allocatedPort)) {
                log.debug("Released port after failed registration: service={}, port={}", name, allocatedPort);
            }
            throw e;
        }
    }

    @Override
    public DiscoveryResult discover(String serviceName) {
        requireName(serviceName);
        ensureOpen();
        Duration timeout = config.getDiscoveryTimeout();
        return discoverUntil(serviceName, System.nanoTime() + timeout.toNanos(), timeout);
    }

    @Override
    public DiscoveryResult waitForService(String serviceName, Duration timeout) {
        requireName(serviceName);
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        ensureOpen();

        long pollNanos = config.getWaitPollInterval().toNanos();
        long deadline = System.nanoTime() + timeout.toNanos();
        int attempts = 0;
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            attempts++;
            long pollDeadline = System.nanoTime() + Math.min(remaining, config.getDiscoveryTimeout().toNanos());
            try {
                DiscoveryResult result = discoverUntil(serviceName, pollDeadline, timeout);
                log.debug("Service became available: name={}, attempts={}", serviceName, attempts);
                return result;
            } catch (ServiceNotFoundException | DiscoveryTimeoutException e) {
                log.trace("Service not yet available: name={}, attempt={}", serviceName, attempts);
            }

            remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            try {
                TimeUnit.NANOSECONDS.sleep(Math.min(pollNanos, remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DiscoveryCancelledException("wait for service interrupted: " + serviceName, e);
            }
        }
        log.debug("Timed out waiting for service: name={}, timeout={}, attempts={}", serviceName, timeout, attempts);
        throw new DiscoveryTimeoutException(serviceName, timeout);
    }

    @Override
    public void heartbeat(String serviceName) {
        registry.heartbeat(serviceName);
    }

    @Override
    public void deregister(String serviceName) {
        try {
            registry.deregister(serviceName);
        } finally {
            // 注册表中的记录可能已被清理，端口仍需释放
            portAllocator.releaseServicePort(serviceName);
        }
    }

    @Override
    public List<ServiceRecord> listServices() {
        return registry.list(false);
    }

    @Override
    public List<ServiceRecord> listHealthyServices() {
        return registry.list(true);
    }

    @Override
    public String getServiceAddress(String serviceName) {
        return discover(serviceName).getRecord().getAddress();
    }

    @Override
    public Optional<HealthCheckResult> getLastHealthResult(String serviceName) {
        return healthMonitor == null ? Optional.empty() : healthMonitor.getLastResult(serviceName);
    }

    @Override
    public void addStrategy(DiscoveryStrategy strategy) {
        strategies.add(Objects.requireNonNull(strategy, "strategy"));
        log.info("Discovery strategy added: type={}, class={}", strategy.type(), strategy.getClass().getSimpleName());
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        resolverPool.shutdownNow();
        log.info("Discovery client closed");
    }

    List<DiscoveryStrategy> getStrategies() {
        return new ArrayList<>(strategies);
    }

    private DiscoveryResult discoverUntil(String serviceName, long deadline, Duration timeout) {
        long start = System.nanoTime();
        List<DiscoveryStrategyType> attempted = new ArrayList<>();

        for (DiscoveryStrategy strategy : strategies) {
            if (Thread.currentThread().isInterrupted()) {
                throw new DiscoveryCancelledException("discovery cancelled: " + serviceName);
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new DiscoveryTimeoutException(serviceName, timeout);
            }

            attempted.add(strategy.type());
            try {
                ServiceRecord record = strategy.isLocal()
                    ? strategy.resolve(serviceName)
                    : resolveAsync(strategy, serviceName, remaining, timeout);
                Duration latency = Duration.ofNanos(System.nanoTime() - start);
                log.debug("Service discovered: name={}, strategy={}, addr={}, latency={}ms",
                    serviceName, strategy.type(), record.getAddress(), latency.toMillis());
                return DiscoveryResult.builder()
                    .record(record)
                    .strategy(strategy.type())
                    .latency(latency)
                    .build();
            } catch (DiscoveryTimeoutException | DiscoveryCancelledException e) {
                throw e;
            } catch (ServiceNotFoundException e) {
                log.debug("Strategy missed: name={}, strategy={}, reason={}", serviceName, strategy.type(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Strategy failed: name={}, strategy={}", serviceName, strategy.type(), e);
            }
        }
        throw new ServiceNotFoundException(serviceName, attempted);
    }

    private ServiceRecord resolveAsync(DiscoveryStrategy strategy, String serviceName, long remainingNanos,
                                       Duration timeout) {
        Future<ServiceRecord> future;
        try {
            future = resolverPool.submit(() -> strategy.resolve(serviceName));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("discovery client closed", e);
        }

        try {
            return future.get(remainingNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DiscoveryTimeoutException(serviceName, timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new DiscoveryCancelledException("discovery interrupted: " + serviceName, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new DiscoveryException("strategy " + strategy.type() + " failed for " + serviceName, cause);
        }
    }

    /**
     * 端口仍被同名的存活记录使用时保留，否则释放
     *
     * @return 确实释放时返回true
     */
    private boolean releaseIfUnused(String serviceName, int port) {
        if (isServing(serviceName, port)) {
            return false;
        }
        boolean owned = portAllocator.getAllocation(port)
            .filter(allocation -> serviceName.equals(allocation.getServiceName()))
            .isPresent();
        if (owned) {
            portAllocator.release(port);
        }
        return owned;
    }

    private boolean isServing(String serviceName, int port) {
        try {
            return registry.get(serviceName).getPort() == port;
        } catch (ServiceNotFoundException e) {
            return false;
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("discovery client closed");
        }
    }

    private static void requireName(String serviceName) {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName is required");
        }
    }
}
