/**
 * 健康监控测试
 *
 * @author zhenglin
 * @date 2025/09/07
 */
package com.vdiscovery.common.service.impl;

import com.vdiscovery.common.config.DiscoveryConfig;
import com.vdiscovery.common.exception.HealthMonitorAlreadyRunningException;
import com.vdiscovery.common.exception.HealthMonitorNotRunningException;
import com.vdiscovery.common.exception.ProbeFailedException;
import com.vdiscovery.common.exception.ServiceNotFoundException;
import com.vdiscovery.common.model.HealthCheckResult;
import com.vdiscovery.common.model.HealthCheckStrategy;
import com.vdiscovery.common.model.ServiceRecord;
import com.vdiscovery.common.service.HealthProbe;
import com.vdiscovery.common.service.ServiceRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * HealthMonitorImpl单元测试
 */
class HealthMonitorImplTest {

    private DiscoveryConfig.Health config;
    private InMemoryServiceRegistry registry;
    private PortAllocatorImpl allocator;
    private ScriptedProbe probe;
    private HealthMonitorImpl monitor;

    @BeforeEach
    void setUp() {
        config = new DiscoveryConfig.Health();
        config.setCheckTimeout(Duration.ofMillis(300));
        config.setCheckInterval(Duration.ofMillis(100));
        registry = new InMemoryServiceRegistry(new DiscoveryConfig.Registry());
        allocator = new PortAllocatorImpl(new DiscoveryConfig.Allocator());
        probe = new ScriptedProbe();
        monitor = newMonitor(registry);
    }

    @AfterEach
    void tearDown() {
        monitor.close();
    }

    private HealthMonitorImpl newMonitor(ServiceRegistry target) {
        return new HealthMonitorImpl(config, target, allocator, Clock.systemUTC(), List.of(probe));
    }

    @Test
    void testUnhealthyAfterThresholdConsecutiveFailures() {
        register("api");

        monitor.recordResult(failure("api"));
        monitor.recordResult(failure("api"));
        // 两次失败不足以翻转状态
        assertTrue(registry.get("api").isHealthy());
        assertEquals(2, monitor.getFailureCount("api"));

        monitor.recordResult(failure("api"));
        assertFalse(registry.get("api").isHealthy());
    }

    @Test
    void testSingleSuccessResetsFailureCounter() {
        register("api");

        monitor.recordResult(failure("api"));
        monitor.recordResult(failure("api"));
        monitor.recordResult(success("api"));
        assertEquals(0, monitor.getFailureCount("api"));
        assertEquals(1, monitor.getSuccessCount("api"));

        monitor.recordResult(failure("api"));
        monitor.recordResult(failure("api"));
        assertTrue(registry.get("api").isHealthy());
    }

    @Test
    void testRecoveryRequiresHealthyThreshold() {
        register("api");
        for (int i = 0; i < 3; i++) {
            monitor.recordResult(failure("api"));
        }
        assertFalse(registry.get("api").isHealthy());

        monitor.recordResult(success("api"));
        assertFalse(registry.get("api").isHealthy());
        assertEquals(0, monitor.getFailureCount("api"));

        monitor.recordResult(success("api"));
        assertTrue(registry.get("api").isHealthy());
    }

    @Test
    void testAutoRemovalDeregistersAndReleasesPort() {
        int port = allocator.allocate("api", "api");
        registry.register(ServiceRecord.builder().name("api").host("localhost").port(port).build());

        for (int i = 0; i < 4; i++) {
            monitor.recordResult(failure("api"));
        }
        assertFalse(registry.get("api").isHealthy());

        monitor.recordResult(failure("api"));

        assertThrows(ServiceNotFoundException.class, () -> registry.get("api"));
        assertTrue(allocator.isPortAvailable(port));
        assertEquals(0, monitor.getFailureCount("api"));
        assertTrue(monitor.getLastResult("api").isEmpty());
    }

    @Test
    void testAutoRemovalDisabledKeepsService() {
        config.setEnableAutoRemoval(false);
        register("api");

        for (int i = 0; i < 10; i++) {
            monitor.recordResult(failure("api"));
        }

        assertFalse(registry.get("api").isHealthy());
        assertEquals(10, monitor.getFailureCount("api"));
    }

    @Test
    void testCheckServiceHealthDoesNotRecord() {
        register("api");
        probe.failing.add("api");

        HealthCheckResult result = monitor.checkServiceHealth("api");

        assertFalse(result.isHealthy());
        assertEquals(HealthCheckStrategy.TCP, result.getStrategy());
        assertNotNull(result.getError());
        assertEquals(0, monitor.getFailureCount("api"));
        assertTrue(monitor.getLastResult("api").isEmpty());
        assertThrows(ServiceNotFoundException.class, () -> monitor.checkServiceHealth("ghost"));
    }

    @Test
    void testRunCheckCycleRecordsResults() {
        register("api");
        register("db");
        probe.failing.add("db");

        monitor.runCheckCycle();

        assertTrue(monitor.getLastResult("api").orElseThrow().isHealthy());
        assertFalse(monitor.getLastResult("db").orElseThrow().isHealthy());
        assertEquals(1, monitor.getFailureCount("db"));
        assertEquals(2, monitor.getAllResults().size());
    }

    @Test
    void testCustomCheckTakesPrecedence() {
        register("api");
        probe.failing.add("api");
        monitor.setServiceStrategy("api", HealthCheckStrategy.HTTP);
        monitor.registerCustomCheck("api", record -> { });

        HealthCheckResult result = monitor.checkServiceHealth("api");

        assertTrue(result.isHealthy());
        assertEquals(HealthCheckStrategy.CUSTOM, result.getStrategy());

        monitor.removeCustomCheck("api");
        // HTTP探针未注册
        HealthCheckResult fallback = monitor.checkServiceHealth("api");
        assertFalse(fallback.isHealthy());
        assertEquals(HealthCheckStrategy.HTTP, fallback.getStrategy());
    }

    @Test
    void testCustomCheckFailureIsWrapped() {
        register("api");
        monitor.registerCustomCheck("api", record -> {
            throw new IllegalStateException("db pool exhausted");
        });

        HealthCheckResult result = monitor.checkServiceHealth("api");

        assertFalse(result.isHealthy());
        assertInstanceOf(ProbeFailedException.class, result.getError());
        assertInstanceOf(IllegalStateException.class, result.getError().getCause());
    }

    @Test
    void testCustomStrategyWithoutCheckFails() {
        register("api");
        monitor.setServiceStrategy("api", HealthCheckStrategy.CUSTOM);

        assertFalse(monitor.checkServiceHealth("api").isHealthy());
    }

    @Test
    void testHungProbeDoesNotStallCycle() {
        register("slow");
        register("fast");
        monitor.registerCustomCheck("slow", record -> Thread.sleep(5000));

        long start = System.nanoTime();
        monitor.runCheckCycle();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        assertTrue(elapsed.toMillis() < 2000, "cycle took " + elapsed);
        HealthCheckResult slow = monitor.getLastResult("slow").orElseThrow();
        assertFalse(slow.isHealthy());
        assertTrue(slow.getError().getMessage().contains("timed out"));
        assertTrue(monitor.getLastResult("fast").orElseThrow().isHealthy());
    }

    @Test
    void testResetCounts() {
        register("api");
        monitor.recordResult(failure("api"));
        monitor.recordResult(failure("api"));

        monitor.resetCounts("api");

        assertEquals(0, monitor.getFailureCount("api"));
        assertEquals(0, monitor.getSuccessCount("api"));
        monitor.recordResult(failure("api"));
        assertTrue(registry.get("api").isHealthy());
    }

    @Test
    void testHealthyAndUnhealthyServices() {
        register("api");
        register("db");
        registry.updateHealth("db", false);

        assertEquals(List.of("api"), names(monitor.getHealthyServices()));
        assertEquals(List.of("db"), names(monitor.getUnhealthyServices()));
    }

    @Test
    void testStartAndStopLifecycle() {
        assertThrows(HealthMonitorNotRunningException.class, () -> monitor.stop());

        monitor.start();
        assertTrue(monitor.isRunning());
        assertThrows(HealthMonitorAlreadyRunningException.class, () -> monitor.start());

        monitor.stop();
        assertFalse(monitor.isRunning());
        assertThrows(HealthMonitorNotRunningException.class, () -> monitor.stop());

        // 可以再次启动
        monitor.start();
        assertTrue(monitor.isRunning());
    }

    @Test
    void testCloseStopsMonitorAndCheckPool() {
        register("api");
        monitor.start();

        monitor.close();

        assertFalse(monitor.isRunning());
        assertDoesNotThrow(() -> monitor.close());
        HealthCheckResult result = monitor.checkServiceHealth("api");
        assertFalse(result.isHealthy());
        assertTrue(result.getError().getMessage().contains("rejected"));
        assertEquals(0, probe.calls.get());
    }

    @Test
    void testScheduledCyclesMarkServiceUnhealthy() throws InterruptedException {
        config.setEnableAutoRemoval(false);
        register("api");
        probe.failing.add("api");

        monitor.start();
        long deadline = System.currentTimeMillis() + 3000;
        while (registry.get("api").isHealthy() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }

        assertFalse(registry.get("api").isHealthy());
    }

    @Test
    void testConcurrentPurgeDuringCycleIsBenign() {
        ServiceRegistry racing = mock(ServiceRegistry.class);
        when(racing.updateHealth(eq("api"), anyBoolean())).thenThrow(new ServiceNotFoundException("api"));
        HealthMonitorImpl racingMonitor = newMonitor(racing);

        for (int i = 0; i < 2; i++) {
            racingMonitor.recordResult(failure("api"));
        }
        assertDoesNotThrow(() -> racingMonitor.recordResult(failure("api")));

        verify(racing).updateHealth("api", false);
        assertEquals(0, racingMonitor.getFailureCount("api"));
        assertTrue(racingMonitor.getLastResult("api").isEmpty());
    }

    private void register(String name) {
        registry.register(ServiceRecord.builder().name(name).host("localhost").port(20000 + name.length()).build());
    }

    private static HealthCheckResult success(String name) {
        return HealthCheckResult.builder()
            .serviceName(name)
            .healthy(true)
            .strategy(HealthCheckStrategy.TCP)
            .timestamp(Instant.now())
            .latency(Duration.ofMillis(1))
            .build();
    }

    private static HealthCheckResult failure(String name) {
        return HealthCheckResult.builder()
            .serviceName(name)
            .healthy(false)
            .error(new ProbeFailedException("connection refused"))
            .strategy(HealthCheckStrategy.TCP)
            .timestamp(Instant.now())
            .latency(Duration.ofMillis(1))
            .build();
    }

    private static List<String> names(List<ServiceRecord> records) {
        return records.stream().map(ServiceRecord::getName).collect(Collectors.toList());
    }

    /**
     * 按名单决定成败的TCP探针
     */
    private static class ScriptedProbe implements HealthProbe {

        private final Set<String> failing = ConcurrentHashMap.newKeySet();
        private final AtomicInteger calls = new AtomicInteger();

        @Override
        public HealthCheckStrategy strategy() {
            return HealthCheckStrategy.TCP;
        }

        @Override
        public void probe(ServiceRecord record, Duration timeout) {
            calls.incrementAndGet();
            if (failing.contains(record.getName())) {
                throw new ProbeFailedException("connection refused: " + record.getAddress());
            }
        }
    }
}
