/**
 * 服务发现客户端测试
 *
 * @author zhenglin
 * @date 2025/09/07
 */
package com.vdiscovery.common.service.impl;

import com.vdiscovery.common.config.DiscoveryConfig;
import com.vdiscovery.common.exception.DiscoveryCancelledException;
import com.vdiscovery.common.exception.DiscoveryTimeoutException;
import com.vdiscovery.common.exception.InvalidServiceException;
import com.vdiscovery.common.exception.ServiceNotFoundException;
import com.vdiscovery.common.model.DiscoveryResult;
import com.vdiscovery.common.model.DiscoveryStrategyType;
import com.vdiscovery.common.model.HealthCheckResult;
import com.vdiscovery.common.model.ServiceRecord;
import com.vdiscovery.common.service.DiscoveryStrategy;
import com.vdiscovery.common.service.DnsResolver;
import com.vdiscovery.common.service.HealthMonitor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * DiscoveryClientImpl单元测试
 */
@ExtendWith(MockitoExtension.class)
class DiscoveryClientImplTest {

    @Mock
    private DnsResolver dnsResolver;

    @Mock
    private HealthMonitor healthMonitor;

    private DiscoveryConfig.Client config;
    private InMemoryServiceRegistry registry;
    private PortAllocatorImpl allocator;
    private DiscoveryClientImpl client;

    @BeforeEach
    void setUp() {
        config = new DiscoveryConfig.Client();
        config.setDiscoveryTimeout(Duration.ofSeconds(1));
        registry = new InMemoryServiceRegistry(new DiscoveryConfig.Registry());
        allocator = new PortAllocatorImpl(new DiscoveryConfig.Allocator());
        client = new DiscoveryClientImpl(config, registry, allocator, dnsResolver, healthMonitor);
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    @Test
    void testRegisterAllocatesPortFromInferredRange() {
        ServiceRecord stored = client.register(service("postgres-main", 0));

        assertEquals(5433, stored.getPort());
        assertEquals(Optional.of(5433), allocator.getPortForService("postgres-main"));
    }

    @Test
    void testRegisterWithExplicitRangeHint() {
        ServiceRecord stored = client.register(service("gateway", 0), "api");

        assertEquals(8081, stored.getPort());
        assertEquals("api", allocator.getAllocation(8081).orElseThrow().getRangeName());
    }

    @Test
    void testRegisterWithFixedPortSkipsAllocator() {
        ServiceRecord stored = client.register(service("gateway", 7000));

        assertEquals(7000, stored.getPort());
        assertTrue(allocator.listAllocations().isEmpty());
    }

    @Test
    void testFailedRegistrationReleasesPort() {
        ServiceRecord noHost = ServiceRecord.builder().name("worker").port(0).build();

        assertThrows(InvalidServiceException.class, () -> client.register(noHost));
        assertTrue(allocator.listAllocations().isEmpty());
        assertThrows(InvalidServiceException.class, () -> client.register(service(" ", 0)));
    }

    @Test
    void testInterruptedRegistrationReleasesPort() {
        Thread.currentThread().interrupt();
        try {
            assertThrows(DiscoveryCancelledException.class, () -> client.register(service("worker", 0)));
        } finally {
            Thread.interrupted();
        }
        assertTrue(allocator.listAllocations().isEmpty());
        assertThrows(ServiceNotFoundException.class, () -> registry.get("worker"));
    }

    @Test
    void testDiscoverFromRegistry() {
        client.register(service("api", 0), "api");

        DiscoveryResult result = client.discover("api");

        assertEquals(DiscoveryStrategyType.REGISTRY, result.getStrategy());
        assertEquals(8081, result.getRecord().getPort());
        assertNotNull(result.getLatency());
        verifyNoInteractions(dnsResolver);
    }

    @Test
    void testFallsBackToDnsWhenAbsentFromRegistry() {
        when(dnsResolver.resolve("search")).thenReturn(Optional.of(InetSocketAddress.createUnresolved("10.0.0.5", 9200)));

        DiscoveryResult result = client.discover("search");

        assertEquals(DiscoveryStrategyType.DNS, result.getStrategy());
        assertEquals("10.0.0.5:9200", result.getRecord().getAddress());
    }

    @Test
    void testUnhealthyRegistryRecordFallsThrough() {
        client.register(service("api", 8081));
        registry.updateHealth("api", false);
        when(dnsResolver.resolve("api")).thenReturn(Optional.empty());

        ServiceNotFoundException e = assertThrows(ServiceNotFoundException.class, () -> client.discover("api"));

        assertEquals("api", e.getServiceName());
        assertEquals(Arrays.asList(DiscoveryStrategyType.REGISTRY, DiscoveryStrategyType.DNS), e.getAttemptedStrategies());
    }

    @Test
    void testDnsDisabledIsSkipped() {
        config.setEnableDns(false);
        DiscoveryClientImpl noDns = new DiscoveryClientImpl(config, registry, allocator, dnsResolver, null);
        try {
            ServiceNotFoundException e = assertThrows(ServiceNotFoundException.class, () -> noDns.discover("search"));
            assertEquals(List.of(DiscoveryStrategyType.REGISTRY), e.getAttemptedStrategies());
            verifyNoInteractions(dnsResolver);
        } finally {
            noDns.close();
        }
    }

    @Test
    void testSlowStrategyBoundedByDiscoveryTimeout() {
        config.setDiscoveryTimeout(Duration.ofMillis(200));
        when(dnsResolver.resolve("slow")).thenAnswer(invocation -> {
            Thread.sleep(5000);
            return Optional.empty();
        });

        long start = System.nanoTime();
        DiscoveryTimeoutException e = assertThrows(DiscoveryTimeoutException.class, () -> client.discover("slow"));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals("slow", e.getServiceName());
        assertTrue(elapsedMs < 1500, "discover took " + elapsedMs + "ms");
    }

    @Test
    void testDiscoverRejectsBlankName() {
        assertThrows(IllegalArgumentException.class, () -> client.discover(""));
        assertThrows(IllegalArgumentException.class, () -> client.waitForService(null, Duration.ofSeconds(1)));
    }

    @Test
    void testWaitForServiceReturnsOnceRegistered() throws Exception {
        when(dnsResolver.resolve("late")).thenReturn(Optional.empty());
        CompletableFuture<Void> registration = CompletableFuture.runAsync(() -> {
            try {
                Thread.sleep(250);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            client.register(service("late", 0));
        });

        DiscoveryResult result = client.waitForService("late", Duration.ofSeconds(3));

        assertEquals("late", result.getRecord().getName());
        assertEquals(DiscoveryStrategyType.REGISTRY, result.getStrategy());
        registration.get(1, TimeUnit.SECONDS);
    }

    @Test
    void testWaitForServiceTimesOut() {
        when(dnsResolver.resolve("ghost")).thenReturn(Optional.empty());

        long start = System.nanoTime();
        DiscoveryTimeoutException e = assertThrows(DiscoveryTimeoutException.class,
            () -> client.waitForService("ghost", Duration.ofMillis(500)));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(Duration.ofMillis(500), e.getTimeout());
        assertTrue(elapsedMs >= 500, "returned early after " + elapsedMs + "ms");
        assertTrue(elapsedMs < 1000, "returned late after " + elapsedMs + "ms");
    }

    @Test
    void testWaitForServiceInterruptedDuringPollSleep() throws Exception {
        config.setWaitPollInterval(Duration.ofSeconds(5));
        CountDownLatch firstPoll = new CountDownLatch(1);
        when(dnsResolver.resolve("late")).thenAnswer(invocation -> {
            firstPoll.countDown();
            return Optional.empty();
        });
        AtomicReference<Throwable> failure = new AtomicReference<>();
        AtomicLong elapsedMs = new AtomicLong();

        Thread waiter = new Thread(() -> {
            long start = System.nanoTime();
            try {
                client.waitForService("late", Duration.ofSeconds(30));
            } catch (Throwable t) {
                failure.set(t);
            }
            elapsedMs.set(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        }, "wait-for-late");
        waiter.start();

        assertTrue(firstPoll.await(2, TimeUnit.SECONDS));
        Thread.sleep(100);
        waiter.interrupt();
        waiter.join(2000);

        assertFalse(waiter.isAlive());
        assertInstanceOf(DiscoveryCancelledException.class, failure.get());
        assertTrue(elapsedMs.get() < 2000, "wait returned after " + elapsedMs.get() + "ms");
    }

    @Test
    void testDiscoverInterruptedDuringSlowDnsLookup() throws Exception {
        config.setDiscoveryTimeout(Duration.ofSeconds(30));
        CountDownLatch lookupStarted = new CountDownLatch(1);
        CountDownLatch lookupInterrupted = new CountDownLatch(1);
        when(dnsResolver.resolve("slow")).thenAnswer(invocation -> {
            lookupStarted.countDown();
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                lookupInterrupted.countDown();
            }
            return Optional.empty();
        });
        AtomicReference<Throwable> failure = new AtomicReference<>();
        AtomicLong elapsedMs = new AtomicLong();

        Thread caller = new Thread(() -> {
            long start = System.nanoTime();
            try {
                client.discover("slow");
            } catch (Throwable t) {
                failure.set(t);
            }
            elapsedMs.set(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        }, "discover-slow");
        caller.start();

        assertTrue(lookupStarted.await(2, TimeUnit.SECONDS));
        caller.interrupt();
        caller.join(2000);

        assertFalse(caller.isAlive());
        assertInstanceOf(DiscoveryCancelledException.class, failure.get());
        assertTrue(elapsedMs.get() < 2000, "discover returned after " + elapsedMs.get() + "ms");
        // 进行中的解析任务随之取消
        assertTrue(lookupInterrupted.await(2, TimeUnit.SECONDS));
    }

    @Test
    void testFailedRenewalKeepsPortOfLiveRecord() {
        ServiceRecord stored = client.register(service("worker", 0));
        ServiceRecord noHost = ServiceRecord.builder().name("worker").port(0).build();

        assertThrows(InvalidServiceException.class, () -> client.register(noHost));

        assertEquals(Optional.of(stored.getPort()), allocator.getPortForService("worker"));
        assertEquals(stored.getPort(), registry.get("worker").getPort());
    }

    @Test
    void testDeregisterReleasesPort() {
        int port = client.register(service("api", 0), "api").getPort();

        client.deregister("api");

        assertThrows(ServiceNotFoundException.class, () -> registry.get("api"));
        assertTrue(allocator.isPortAvailable(port));
    }

    @Test
    void testDeregisterReleasesPortOfPurgedService() {
        int port = allocator.allocate("orphan", "api");

        assertThrows(ServiceNotFoundException.class, () -> client.deregister("orphan"));
        assertTrue(allocator.isPortAvailable(port));
    }

    @Test
    void testHeartbeatAndListing() {
        client.register(service("api", 8081));
        client.register(service("db", 5433));
        registry.updateHealth("db", false);

        assertDoesNotThrow(() -> client.heartbeat("api"));
        assertThrows(ServiceNotFoundException.class, () -> client.heartbeat("ghost"));
        assertEquals(2, client.listServices().size());
        assertEquals(1, client.listHealthyServices().size());
    }

    @Test
    void testGetServiceAddress() {
        client.register(service("api", 8081));

        assertEquals("localhost:8081", client.getServiceAddress("api"));
    }

    @Test
    void testGetLastHealthResultDelegatesToMonitor() {
        HealthCheckResult last = HealthCheckResult.builder().serviceName("api").healthy(true).build();
        when(healthMonitor.getLastResult("api")).thenReturn(Optional.of(last));

        assertEquals(Optional.of(last), client.getLastHealthResult("api"));

        DiscoveryClientImpl unmonitored = new DiscoveryClientImpl(config, registry, allocator);
        try {
            assertTrue(unmonitored.getLastHealthResult("api").isEmpty());
        } finally {
            unmonitored.close();
        }
    }

    @Test
    void testCustomStrategyAppendedAfterConfigured() {
        when(dnsResolver.resolve("legacy")).thenReturn(Optional.empty());
        DiscoveryStrategy fixed = new DiscoveryStrategy() {
            @Override
            public DiscoveryStrategyType type() {
                return DiscoveryStrategyType.DEFAULT_PORT;
            }

            @Override
            public ServiceRecord resolve(String serviceName) {
                return service(serviceName, 4000);
            }
        };

        client.addStrategy(fixed);
        DiscoveryResult result = client.discover("legacy");

        assertEquals(DiscoveryStrategyType.DEFAULT_PORT, result.getStrategy());
        assertEquals(4000, result.getRecord().getPort());
        assertEquals(3, client.getStrategies().size());
    }

    @Test
    void testClosedClientRejectsDiscovery() {
        client.close();

        assertThrows(IllegalStateException.class, () -> client.discover("api"));
    }

    private static ServiceRecord service(String name, int port) {
        return ServiceRecord.builder()
            .name(name)
            .host("localhost")
            .port(port)
            .build();
    }
}
