/**
 * 端口分配器实现
 *
 * @author zhenglin
 * @date 2025/09/02
 */
package com.vdiscovery.common.service.impl;

import com.vdiscovery.common.config.DiscoveryConfig;
import com.vdiscovery.common.exception.InvalidConfigException;
import com.vdiscovery.common.exception.PortRangeExhaustedException;
import com.vdiscovery.common.model.PortAllocation;
import com.vdiscovery.common.model.PortAssignment;
import com.vdiscovery.common.model.PortRange;
import com.vdiscovery.common.service.PortAllocator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * 基于内存簿记的端口分配器
 * 首次适配：总是返回范围内编号最小的空闲端口，不做随机化，也不探测操作系统绑定状态
 */
@Slf4j
public class PortAllocatorImpl implements PortAllocator {

    static final String CUSTOM_RANGE_NAME = "custom";

    private final String defaultRangeName;
    private final Clock clock;

    // 以下状态均由lock保护
    private final Map<String, PortRange> ranges = new LinkedHashMap<>();
    private final Set<Integer> reservedPorts = new TreeSet<>();
    // port -> allocation，按端口有序
    private final NavigableMap<Integer, PortAllocation> allocations = new TreeMap<>();
    // serviceName -> port
    private final Map<String, Integer> servicePorts = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final List<AllocatorConfigListener> configListeners = new CopyOnWriteArrayList<>();

    public PortAllocatorImpl(DiscoveryConfig.Allocator config) {
        this(config, Clock.systemUTC());
    }

    public PortAllocatorImpl(DiscoveryConfig.Allocator config, Clock clock) {
        Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultRangeName = config.getDefaultRangeName();
        if (config.getRanges() != null) {
            config.getRanges().forEach((name, range) -> ranges.put(name, copyOf(range)));
        }
        ranges.put(defaultRangeName, copyOf(config.getDefaultRange()));
        if (config.getReservedPorts() != null) {
            reservedPorts.addAll(config.getReservedPorts());
        }
    }

    @Override
    public int allocate(String serviceName, String rangeHint) {
        return assign(serviceName, rangeHint).getPort();
    }

    @Override
    public PortAssignment assign(String serviceName, String rangeHint) {
        requireServiceName(serviceName);
        lock.writeLock().lock();
        try {
            String rangeName = defaultRangeName;
            if (rangeHint != null && !rangeHint.isBlank() && !rangeHint.equals(defaultRangeName)) {
                if (ranges.containsKey(rangeHint)) {
                    rangeName = rangeHint;
                } else {
                    log.warn("Unknown port range hint, using default: service={}, hint={}, default={}",
                        serviceName, rangeHint, rangeName);
                }
            }
            return allocateFrom(serviceName, rangeName, ranges.get(rangeName));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int allocateInRange(String serviceName, int low, int high) {
        requireServiceName(serviceName);
        PortRange range = PortRange.of(low, high);
        if (!range.isValid()) {
            throw new IllegalArgumentException("invalid port range: " + range);
        }
        lock.writeLock().lock();
        try {
            return allocateFrom(serviceName, CUSTOM_RANGE_NAME, range).getPort();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void release(int port) {
        PortAllocation removed;
        lock.writeLock().lock();
        try {
            removed = allocations.remove(port);
            if (removed != null) {
                servicePorts.remove(removed.getServiceName(), port);
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed != null) {
            log.info("Port released: port={}, service={}", port, removed.getServiceName());
        }
    }

    @Override
    public boolean releaseServicePort(String serviceName) {
        Integer port;
        lock.writeLock().lock();
        try {
            port = servicePorts.remove(serviceName);
            if (port != null) {
                allocations.remove(port);
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (port == null) {
            return false;
        }
        log.info("Port released: port={}, service={}", port, serviceName);
        return true;
    }

    @Override
    public boolean isPortAvailable(int port) {
        lock.readLock().lock();
        try {
            return isFree(port);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Integer> getPortForService(String serviceName) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(servicePorts.get(serviceName));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<PortAllocation> getAllocation(int port) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(allocations.get(port)).map(PortAllocatorImpl::copyOf);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<PortAllocation> listAllocations() {
        lock.readLock().lock();
        try {
            List<PortAllocation> result = new ArrayList<>(allocations.size());
            for (PortAllocation allocation : allocations.values()) {
                result.add(copyOf(allocation));
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void setPortRange(String rangeName, PortRange range) {
        if (rangeName == null || rangeName.isBlank() || CUSTOM_RANGE_NAME.equals(rangeName)) {
            throw new InvalidConfigException("port range name " + rangeName);
        }
        if (range == null || !range.isValid()) {
            throw new InvalidConfigException("allocator.ranges." + rangeName + " " + range);
        }
        PortRange newRange = copyOf(range);
        PortRange oldRange;
        lock.writeLock().lock();
        try {
            oldRange = ranges.put(rangeName, newRange);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Port range updated: range={}, old={}, new={}", rangeName, oldRange, newRange);
        notifyConfigListeners(l -> l.onPortRangeChanged(rangeName, oldRange, copyOf(newRange)));
    }

    @Override
    public Map<String, PortRange> getPortRanges() {
        lock.readLock().lock();
        try {
            Map<String, PortRange> snapshot = new LinkedHashMap<>();
            ranges.forEach((name, range) -> snapshot.put(name, copyOf(range)));
            return snapshot;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void addReservedPort(int port) {
        requireValidPort(port);
        Set<Integer> snapshot;
        lock.writeLock().lock();
        try {
            if (!reservedPorts.add(port)) {
                return;
            }
            snapshot = new TreeSet<>(reservedPorts);
            PortAllocation holder = allocations.get(port);
            if (holder != null) {
                log.warn("Reserved port is still held: port={}, service={}", port, holder.getServiceName());
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Reserved port added: port={}", port);
        notifyConfigListeners(l -> l.onReservedPortsChanged(snapshot));
    }

    @Override
    public void removeReservedPort(int port) {
        Set<Integer> snapshot;
        lock.writeLock().lock();
        try {
            if (!reservedPorts.remove(port)) {
                return;
            }
            snapshot = new TreeSet<>(reservedPorts);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Reserved port removed: port={}", port);
        notifyConfigListeners(l -> l.onReservedPortsChanged(snapshot));
    }

    @Override
    public Set<Integer> getReservedPorts() {
        lock.readLock().lock();
        try {
            return new TreeSet<>(reservedPorts);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void addConfigListener(AllocatorConfigListener listener) {
        configListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * 调用方需持有写锁
     */
    private PortAssignment allocateFrom(String serviceName, String rangeName, PortRange range) {
        Integer existing = servicePorts.get(serviceName);
        if (existing != null) {
            PortAllocation current = allocations.get(existing);
            if (range.contains(existing) && rangeName.equals(current.getRangeName())) {
                log.debug("Service already owns a port: service={}, port={}", serviceName, existing);
                return new PortAssignment(existing, rangeName, false, 0);
            }
        }

        int port = firstFree(range);
        if (port < 0) {
            log.warn("Port range exhausted: service={}, range={} {}", serviceName, rangeName, range);
            throw new PortRangeExhaustedException(rangeName, range);
        }
        if (existing != null) {
            allocations.remove(existing);
            log.warn("Service moved to another port range: service={}, oldPort={}, newPort={}, range={}",
                serviceName, existing, port, rangeName);
        }
        allocations.put(port, PortAllocation.builder()
            .port(port)
            .serviceName(serviceName)
            .rangeName(rangeName)
            .allocatedAt(clock.instant())
            .build());
        servicePorts.put(serviceName, port);
        log.info("Port allocated: port={}, service={}, range={}", port, serviceName, rangeName);
        return new PortAssignment(port, rangeName, true, existing == null ? 0 : existing);
    }

    /**
     * 调用方需持有锁
     */
    private int firstFree(PortRange range) {
        for (int port = range.getLow(); port <= range.getHigh(); port++) {
            if (isFree(port)) {
                return port;
            }
        }
        return -1;
    }

    /**
     * 调用方需持有锁
     */
    private boolean isFree(int port) {
        return port >= PortRange.MIN_PORT && port <= PortRange.MAX_PORT
            && !reservedPorts.contains(port)
            && !allocations.containsKey(port);
    }

    private void notifyConfigListeners(Consumer<AllocatorConfigListener> event) {
        for (AllocatorConfigListener listener : configListeners) {
            try {
                event.accept(listener);
            } catch (Exception e) {
                log.warn("Allocator config listener failed: listener={}", listener.getClass().getSimpleName(), e);
            }
        }
    }

    private static void requireServiceName(String serviceName) {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName is required");
        }
    }

    private static void requireValidPort(int port) {
        if (port < PortRange.MIN_PORT || port > PortRange.MAX_PORT) {
            throw new InvalidConfigException("reserved port " + port);
        }
    }

    private static PortRange copyOf(PortRange range) {
        return PortRange.of(range.getLow(), range.getHigh());
    }

    private static PortAllocation copyOf(PortAllocation allocation) {
        return new PortAllocation(allocation.getPort(), allocation.getServiceName(),
            allocation.getRangeName(), allocation.getAllocatedAt());
    }
}
