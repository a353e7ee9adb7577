package com.vdiscovery.common.service.impl;

import com.vdiscovery.common.config.DiscoveryConfig;
import com.vdiscovery.common.exception.InvalidServiceException;
import com.vdiscovery.common.exception.ServiceNotFoundException;
import com.vdiscovery.common.model.PortRange;
import com.vdiscovery.common.model.ServiceRecord;
import com.vdiscovery.common.service.ServiceRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 轻量内存服务注册表（无外部中间件）
 * 读写锁保护一张 name -> record 的表，后台线程按cleanupInterval清理过期记录
 *
 * @author zhenglin
 * @date 2025/09/02
 */
@Slf4j
public class InMemoryServiceRegistry implements ServiceRegistry {

    private static final String DEFAULT_PROTOCOL = "tcp";

    private final DiscoveryConfig.Registry config;
    private final Clock clock;

    // serviceName -> record
    private final Map<String, ServiceRecord> records = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final List<RegistryEventListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ScheduledExecutorService cleanupScheduler;

    public InMemoryServiceRegistry(DiscoveryConfig.Registry config) {
        this(config, Clock.systemUTC());
    }

    public InMemoryServiceRegistry(DiscoveryConfig.Registry config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public ServiceRecord register(ServiceRecord record) {
        ServiceRecord entry = normalize(record);
        Instant now = clock.instant();
        entry.setHealthy(true);
        entry.setLastHeartbeat(now);

        ServiceRecord previous;
        lock.writeLock().lock();
        try {
            previous = records.get(entry.getName());
            entry.setRegisteredAt(previous != null && previous.getRegisteredAt() != null
                ? previous.getRegisteredAt() : now);
            records.put(entry.getName(), entry);
        } finally {
            lock.writeLock().unlock();
        }

        boolean renewal = previous != null;
        ServiceRecord snapshot = entry.copy();
        if (renewal) {
            log.debug("Service renewed: name={}, addr={}", snapshot.getName(), snapshot.getAddress());
        } else {
            log.info("Service registered: name={}, addr={}, protocol={}, ttl={}",
                snapshot.getName(), snapshot.getAddress(), snapshot.getProtocol(), snapshot.getTtl());
        }
        notifyListeners(l -> l.onServiceRegistered(snapshot.copy(), renewal));
        return snapshot;
    }

    @Override
    public ServiceRecord update(String serviceName, ServiceRecord record) {
        ServiceRecord entry = normalize(record);
        if (!entry.getName().equals(serviceName)) {
            throw new InvalidServiceException("name mismatch: " + serviceName + " vs " + entry.getName());
        }
        Instant now = clock.instant();

        lock.writeLock().lock();
        try {
            ServiceRecord existing = records.get(serviceName);
            if (existing == null || existing.isExpired(now)) {
                throw new ServiceNotFoundException(serviceName);
            }
            entry.setRegisteredAt(existing.getRegisteredAt());
            entry.setHealthy(existing.isHealthy());
            entry.setLastHeartbeat(now);
            records.put(serviceName, entry);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Service updated: name={}, addr={}", serviceName, entry.getAddress());
        return entry.copy();
    }

    @Override
    public ServiceRecord get(String serviceName) {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            ServiceRecord record = records.get(serviceName);
            if (record == null || record.isExpired(now)) {
                throw new ServiceNotFoundException(serviceName);
            }
            return record.copy();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void heartbeat(String serviceName) {
        Instant now = clock.instant();
        ServiceRecord expired = null;
        lock.writeLock().lock();
        try {
            ServiceRecord record = records.get(serviceName);
            if (record == null) {
                throw new ServiceNotFoundException(serviceName);
            }
            if (record.isExpired(now)) {
                records.remove(serviceName);
                expired = record;
            } else {
                record.setLastHeartbeat(now);
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (expired != null) {
            ServiceRecord snapshot = expired.copy();
            log.info("Service expired before heartbeat: name={}", serviceName);
            notifyListeners(l -> l.onServiceExpired(snapshot));
            throw new ServiceNotFoundException(serviceName, "service expired: " + serviceName);
        }
        log.trace("Heartbeat received: name={}", serviceName);
    }

    @Override
    public boolean updateHealth(String serviceName, boolean healthy) {
        Instant now = clock.instant();
        boolean changed;
        lock.writeLock().lock();
        try {
            ServiceRecord record = records.get(serviceName);
            if (record == null || record.isExpired(now)) {
                throw new ServiceNotFoundException(serviceName);
            }
            changed = record.isHealthy() != healthy;
            record.setHealthy(healthy);
        } finally {
            lock.writeLock().unlock();
        }

        if (changed) {
            log.info("Service health changed: name={}, healthy={}", serviceName, healthy);
            notifyListeners(l -> l.onHealthChanged(serviceName, healthy));
        }
        return changed;
    }

    @Override
    public ServiceRecord deregister(String serviceName) {
        ServiceRecord removed;
        lock.writeLock().lock();
        try {
            removed = records.remove(serviceName);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed == null) {
            throw new ServiceNotFoundException(serviceName);
        }

        ServiceRecord snapshot = removed.copy();
        log.info("Service deregistered: name={}, addr={}", serviceName, snapshot.getAddress());
        notifyListeners(l -> l.onServiceDeregistered(snapshot.copy()));
        return snapshot;
    }

    @Override
    public List<ServiceRecord> list(boolean healthyOnly) {
        return snapshot(record -> !healthyOnly || record.isHealthy());
    }

    @Override
    public List<ServiceRecord> listByProtocol(String protocol) {
        if (protocol == null) {
            return Collections.emptyList();
        }
        return snapshot(record -> protocol.equalsIgnoreCase(record.getProtocol()));
    }

    @Override
    public int cleanupExpired() {
        Instant now = clock.instant();
        List<ServiceRecord> expired = new ArrayList<>();
        lock.writeLock().lock();
        try {
            Iterator<ServiceRecord> it = records.values().iterator();
            while (it.hasNext()) {
                ServiceRecord record = it.next();
                if (record.isExpired(now)) {
                    it.remove();
                    expired.add(record);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (!expired.isEmpty()) {
            log.info("Expired services purged: count={}, names={}", expired.size(),
                expired.stream().map(ServiceRecord::getName).collect(Collectors.toList()));
            for (ServiceRecord record : expired) {
                notifyListeners(l -> l.onServiceExpired(record.copy()));
            }
        }
        return expired.size();
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Registry cleanup already running");
            return;
        }
        long intervalMs = config.getCleanupInterval().toMillis();
        cleanupScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "registry-cleanup");
            t.setDaemon(true);
            return t;
        });
        cleanupScheduler.scheduleWithFixedDelay(this::runCleanup, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Registry cleanup started: interval={}ms, defaultTtl={}", intervalMs, config.getDefaultTtl());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        ScheduledExecutorService scheduler = cleanupScheduler;
        cleanupScheduler = null;
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Registry cleanup thread did not terminate in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Registry cleanup stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void addRegistryListener(RegistryEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    private void runCleanup() {
        try {
            cleanupExpired();
        } catch (Exception e) {
            // 保证定时任务不会因一次异常而终止
            log.error("Registry cleanup failed", e);
        }
    }

    private List<ServiceRecord> snapshot(Predicate<ServiceRecord> filter) {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            return records.values().stream()
                .filter(record -> !record.isExpired(now))
                .filter(filter)
                .sorted(Comparator.comparing(ServiceRecord::getName))
                .map(ServiceRecord::copy)
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 校验并补全服务记录，返回与调用方隔离的副本
     */
    private ServiceRecord normalize(ServiceRecord record) {
        if (record == null) {
            throw new InvalidServiceException("record is null");
        }
        if (record.getName() == null || record.getName().isBlank()) {
            throw new InvalidServiceException("name is required");
        }
        if (record.getHost() == null || record.getHost().isBlank()) {
            throw new InvalidServiceException("host is required for " + record.getName());
        }
        if (record.getPort() < PortRange.MIN_PORT || record.getPort() > PortRange.MAX_PORT) {
            throw new InvalidServiceException("port out of range for " + record.getName() + ": " + record.getPort());
        }
        ServiceRecord entry = record.copy();
        if (entry.getProtocol() == null || entry.getProtocol().isBlank()) {
            entry.setProtocol(DEFAULT_PROTOCOL);
        }
        Duration ttl = entry.getTtl();
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            entry.setTtl(config.getDefaultTtl());
        }
        return entry;
    }

    private void notifyListeners(Consumer<RegistryEventListener> event) {
        for (RegistryEventListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (Exception e) {
                log.warn("Registry listener failed: listener={}", listener.getClass().getName(), e);
            }
        }
    }
}
