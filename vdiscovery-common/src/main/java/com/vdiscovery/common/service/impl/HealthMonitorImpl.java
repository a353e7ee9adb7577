package com.vdiscovery.common.service.impl;

import com.vdiscovery.common.config.DiscoveryConfig;
import com.vdiscovery.common.exception.DiscoveryCancelledException;
import com.vdiscovery.common.exception.HealthMonitorAlreadyRunningException;
import com.vdiscovery.common.exception.HealthMonitorNotRunningException;
import com.vdiscovery.common.exception.ProbeFailedException;
import com.vdiscovery.common.exception.ServiceNotFoundException;
import com.vdiscovery.common.model.HealthCheckResult;
import com.vdiscovery.common.model.HealthCheckStrategy;
import com.vdiscovery.common.model.ServiceRecord;
import com.vdiscovery.common.service.HealthMonitor;
import com.vdiscovery.common.service.HealthProbe;
import com.vdiscovery.common.service.PortAllocator;
import com.vdiscovery.common.service.ServiceRegistry;
import com.vdiscovery.common.service.probe.HttpHealthProbe;
import com.vdiscovery.common.service.probe.TcpHealthProbe;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * 主动健康监控
 * 周期性并行探测注册表中的全部服务，按连续失败/成功计数驱动健康状态迁移，
 * 持续失败达到移除阈值时注销服务并释放端口
 *
 * @author zhenglin
 * @date 2025/09/04
 */
@Slf4j
public class HealthMonitorImpl implements HealthMonitor {

    private final DiscoveryConfig.Health config;
    private final ServiceRegistry registry;
    private final PortAllocator portAllocator;
    private final Clock clock;
    private final Map<HealthCheckStrategy, HealthProbe> probes = new EnumMap<>(HealthCheckStrategy.class);

    // 以下状态均由stateLock保护
    private final ReentrantLock stateLock = new ReentrantLock();
    private final Map<String, HealthCheckResult> lastResults = new HashMap<>();
    private final Map<String, Integer> failureCounts = new HashMap<>();
    private final Map<String, Integer> successCounts = new HashMap<>();
    private final Map<String, CustomHealthCheck> customChecks = new HashMap<>();
    private final Map<String, HealthCheckStrategy> serviceStrategies = new HashMap<>();

    private final Object lifecycleLock = new Object();
    private final ExecutorService probeExecutor;
    private ScheduledExecutorService scheduler;
    private volatile boolean running;

    /**
     * @param config 健康监控配置
     * @param registry 服务注册表
     * @param portAllocator 端口分配器，为null时自动移除不释放端口
     */
    public HealthMonitorImpl(DiscoveryConfig.Health config, ServiceRegistry registry, PortAllocator portAllocator) {
        this(config, registry, portAllocator, Clock.systemUTC(),
            Arrays.asList(new TcpHealthProbe(), new HttpHealthProbe(config.getHttpHealthPath())));
    }

    public HealthMonitorImpl(DiscoveryConfig.Health config, ServiceRegistry registry, PortAllocator portAllocator,
                             Clock clock, List<HealthProbe> probes) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.portAllocator = portAllocator;
        this.clock = Objects.requireNonNull(clock, "clock");
        for (HealthProbe probe : probes) {
            this.probes.put(probe.strategy(), probe);
        }
        AtomicInteger threadIndex = new AtomicInteger();
        this.probeExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "health-probe-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                throw new HealthMonitorAlreadyRunningException();
            }
            long intervalMs = config.getCheckInterval().toMillis();
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "health-monitor");
                t.setDaemon(true);
                return t;
            });
            scheduler.scheduleWithFixedDelay(this::runScheduledCycle, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            running = true;
        }
        log.info("Health monitor started: interval={}, timeout={}, thresholds(unhealthy={}, healthy={}, removal={}), autoRemoval={}",
            config.getCheckInterval(), config.getCheckTimeout(), config.getUnhealthyThreshold(),
            config.getHealthyThreshold(), config.getRemovalThreshold(), config.isEnableAutoRemoval());
    }

    @Override
    public void stop() {
        ScheduledExecutorService current;
        synchronized (lifecycleLock) {
            if (!running) {
                throw new HealthMonitorNotRunningException();
            }
            running = false;
            current = scheduler;
            scheduler = null;
        }
        current.shutdownNow();
        try {
            if (!current.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Health monitor thread did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Health monitor stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        if (running) {
            try {
                stop();
            } catch (HealthMonitorNotRunningException e) {
                log.debug("Health monitor already stopped");
            }
        }
        if (!probeExecutor.isShutdown()) {
            probeExecutor.shutdownNow();
            log.info("Health probe executor shut down");
        }
    }

    @Override
    public HealthCheckResult checkServiceHealth(String serviceName) {
        ServiceRecord record = registry.get(serviceName);
        ProbeTask task = submitProbe(record);
        long deadline = System.nanoTime() + config.getCheckTimeout().toNanos();
        try {
            return awaitProbe(task, deadline);
        } catch (InterruptedException e) {
            task.future.cancel(true);
            Thread.currentThread().interrupt();
            throw new DiscoveryCancelledException("health check interrupted: " + serviceName, e);
        }
    }

    @Override
    public void runCheckCycle() {
        List<ServiceRecord> services = registry.list(false);
        if (services.isEmpty()) {
            return;
        }

        // 所有探测同时开始，共享同一个截止时间，单个挂起的探测不会拖慢其它服务
        long deadline = System.nanoTime() + config.getCheckTimeout().toNanos();
        List<ProbeTask> tasks = new ArrayList<>(services.size());
        for (ServiceRecord record : services) {
            tasks.add(submitProbe(record));
        }

        List<HealthCheckResult> results = new ArrayList<>(tasks.size());
        try {
            for (ProbeTask task : tasks) {
                results.add(awaitProbe(task, deadline));
            }
        } catch (InterruptedException e) {
            tasks.forEach(task -> task.future.cancel(true));
            Thread.currentThread().interrupt();
            log.debug("Health check cycle interrupted: completed={}/{}", results.size(), tasks.size());
            return;
        }

        for (HealthCheckResult result : results) {
            recordResult(result);
        }
        log.debug("Health check cycle finished: services={}, unhealthyResults={}", results.size(),
            results.stream().filter(r -> !r.isHealthy()).count());
    }

    @Override
    public void recordResult(HealthCheckResult result) {
        String name = result.getServiceName();
        boolean markHealthy = false;
        boolean markUnhealthy = false;
        boolean remove = false;
        int failures;

        stateLock.lock();
        try {
            lastResults.put(name, result);
            if (result.isHealthy()) {
                int successes = successCounts.merge(name, 1, Integer::sum);
                failureCounts.put(name, 0);
                failures = 0;
                markHealthy = successes >= config.getHealthyThreshold();
            } else {
                failures = failureCounts.merge(name, 1, Integer::sum);
                successCounts.put(name, 0);
                markUnhealthy = failures >= config.getUnhealthyThreshold();
                if (config.isEnableAutoRemoval() && failures >= config.getRemovalThreshold()) {
                    remove = true;
                    forget(name);
                }
            }
        } finally {
            stateLock.unlock();
        }

        if (!result.isHealthy()) {
            log.debug("Health check failed: service={}, failures={}, reason={}", name, failures,
                result.getError() == null ? null : result.getError().getMessage());
        }

        // 注册表写入在监控锁之外进行
        try {
            if (remove) {
                evict(name, failures);
            } else if (markUnhealthy) {
                if (registry.updateHealth(name, false)) {
                    log.warn("Service marked unhealthy: service={}, consecutiveFailures={}", name, failures);
                }
            } else if (markHealthy) {
                if (registry.updateHealth(name, true)) {
                    log.info("Service recovered: service={}", name);
                }
            }
        } catch (ServiceNotFoundException e) {
            // 探测期间服务被TTL清理或被注销，属于正常竞争
            log.debug("Service vanished during health check: service={}", name);
            stateLock.lock();
            try {
                forget(name);
            } finally {
                stateLock.unlock();
            }
        }
    }

    @Override
    public void registerCustomCheck(String serviceName, CustomHealthCheck check) {
        Objects.requireNonNull(check, "check");
        stateLock.lock();
        try {
            customChecks.put(serviceName, check);
        } finally {
            stateLock.unlock();
        }
        log.debug("Custom health check registered: service={}", serviceName);
    }

    @Override
    public void removeCustomCheck(String serviceName) {
        stateLock.lock();
        try {
            customChecks.remove(serviceName);
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public void setServiceStrategy(String serviceName, HealthCheckStrategy strategy) {
        Objects.requireNonNull(strategy, "strategy");
        stateLock.lock();
        try {
            serviceStrategies.put(serviceName, strategy);
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public Optional<HealthCheckResult> getLastResult(String serviceName) {
        stateLock.lock();
        try {
            return Optional.ofNullable(lastResults.get(serviceName));
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public Map<String, HealthCheckResult> getAllResults() {
        stateLock.lock();
        try {
            return new HashMap<>(lastResults);
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public int getFailureCount(String serviceName) {
        stateLock.lock();
        try {
            return failureCounts.getOrDefault(serviceName, 0);
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public int getSuccessCount(String serviceName) {
        stateLock.lock();
        try {
            return successCounts.getOrDefault(serviceName, 0);
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public void resetCounts(String serviceName) {
        stateLock.lock();
        try {
            failureCounts.remove(serviceName);
            successCounts.remove(serviceName);
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public List<ServiceRecord> getHealthyServices() {
        return registry.list(true);
    }

    @Override
    public List<ServiceRecord> getUnhealthyServices() {
        return registry.list(false).stream()
            .filter(record -> !record.isHealthy())
            .collect(Collectors.toList());
    }

    private void runScheduledCycle() {
        try {
            runCheckCycle();
        } catch (Exception e) {
            log.error("Health check cycle failed", e);
        }
    }

    private void evict(String name, int failures) {
        try {
            registry.deregister(name);
        } finally {
            if (portAllocator != null) {
                portAllocator.releaseServicePort(name);
            }
        }
        log.warn("Service removed after sustained failures: service={}, consecutiveFailures={}", name, failures);
    }

    /**
     * 调用方需持有stateLock
     */
    private void forget(String name) {
        failureCounts.remove(name);
        successCounts.remove(name);
        lastResults.remove(name);
    }

    private ProbeTask submitProbe(ServiceRecord record) {
        CustomHealthCheck custom;
        HealthCheckStrategy strategy;
        stateLock.lock();
        try {
            custom = customChecks.get(record.getName());
            strategy = serviceStrategies.getOrDefault(record.getName(), config.getDefaultStrategy());
        } finally {
            stateLock.unlock();
        }

        Callable<Void> check;
        if (custom != null) {
            // 自定义检查优先于任何探测策略
            strategy = HealthCheckStrategy.CUSTOM;
            check = () -> {
                custom.check(record);
                return null;
            };
        } else {
            HealthProbe probe = probes.get(strategy);
            HealthCheckStrategy missing = strategy;
            check = () -> {
                if (probe == null) {
                    throw new ProbeFailedException("no probe available for strategy " + missing);
                }
                probe.probe(record, config.getCheckTimeout());
                return null;
            };
        }

        long startNanos = System.nanoTime();
        Future<Void> future;
        try {
            future = probeExecutor.submit(check);
        } catch (RejectedExecutionException e) {
            log.warn("Health probe rejected: service={}", record.getName());
            CompletableFuture<Void> failed = new CompletableFuture<>();
            failed.completeExceptionally(new ProbeFailedException("probe rejected", e));
            future = failed;
        }
        return new ProbeTask(record.getName(), strategy, future, startNanos);
    }

    private HealthCheckResult awaitProbe(ProbeTask task, long deadlineNanos) throws InterruptedException {
        ProbeFailedException error = null;
        try {
            task.future.get(Math.max(0, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            task.future.cancel(true);
            error = new ProbeFailedException("health check timed out after " + config.getCheckTimeout().toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            error = cause instanceof ProbeFailedException
                ? (ProbeFailedException) cause
                : new ProbeFailedException("health check failed: " + cause.getMessage(), cause);
        }

        return HealthCheckResult.builder()
            .serviceName(task.serviceName)
            .healthy(error == null)
            .error(error)
            .strategy(task.strategy)
            .timestamp(clock.instant())
            .latency(Duration.ofNanos(System.nanoTime() - task.startNanos))
            .build();
    }

    private static final class ProbeTask {
        private final String serviceName;
        private final HealthCheckStrategy strategy;
        private final Future<Void> future;
        private final long startNanos;

        private ProbeTask(String serviceName, HealthCheckStrategy strategy, Future<Void> future, long startNanos) {
            this.serviceName = serviceName;
            this.strategy = strategy;
            this.future = future;
            this.startNanos = startNanos;
        }
    }
}
