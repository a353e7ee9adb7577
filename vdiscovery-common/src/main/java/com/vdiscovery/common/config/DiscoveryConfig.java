/**
 * 服务发现配置类
 *
 * @author zhenglin
 * @date 2025/09/05
 */
package com.vdiscovery.common.config;

import com.vdiscovery.common.exception.InvalidConfigException;
import com.vdiscovery.common.model.DiscoveryStrategyType;
import com.vdiscovery.common.model.HealthCheckStrategy;
import com.vdiscovery.common.model.PortRange;
import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 服务发现子系统全局配置
 * 所有配置项均带有默认值，可直接 new DiscoveryConfig() 使用
 */
@Data
public class DiscoveryConfig {

    /**
     * 服务注册表配置
     */
    private Registry registry = new Registry();

    /**
     * 端口分配配置
     */
    private Allocator allocator = new Allocator();

    /**
     * 健康监控配置
     */
    private Health health = new Health();

    /**
     * 发现客户端配置
     */
    private Client client = new Client();

    /**
     * 校验配置
     *
     * @throws InvalidConfigException 任一配置项非法
     */
    public void validate() {
        registry.validate();
        allocator.validate();
        health.validate();
        client.validate();
    }

    /**
     * 服务注册表配置
     */
    @Data
    public static class Registry {
        /**
         * 注册未指定TTL时使用的默认TTL
         */
        private Duration defaultTtl = Duration.ofSeconds(30);

        /**
         * 过期清理周期，与TTL相互独立
         */
        private Duration cleanupInterval = Duration.ofSeconds(10);

        void validate() {
            requirePositive(defaultTtl, "registry.default-ttl");
            requirePositive(cleanupInterval, "registry.cleanup-interval");
        }
    }

    /**
     * 端口分配配置
     */
    @Data
    public static class Allocator {
        /**
         * 按服务类型划分的端口范围
         */
        private Map<String, PortRange> ranges = defaultRanges();

        /**
         * 未指定类型或类型未知时使用的范围名称
         */
        private String defaultRangeName = "general";

        /**
         * 默认端口范围
         */
        private PortRange defaultRange = PortRange.of(10000, 10999);

        /**
         * 永不分配的保留端口
         */
        private List<Integer> reservedPorts = new ArrayList<>(
            Arrays.asList(22, 80, 443, 3306, 5432, 6379, 8080, 9090, 9100));

        private static Map<String, PortRange> defaultRanges() {
            Map<String, PortRange> ranges = new LinkedHashMap<>();
            ranges.put("database", PortRange.of(5433, 5442));
            ranges.put("cache", PortRange.of(6380, 6389));
            ranges.put("api", PortRange.of(8081, 8099));
            ranges.put("rpc", PortRange.of(9091, 9099));
            ranges.put("metrics", PortRange.of(9101, 9109));
            ranges.put("websocket", PortRange.of(8001, 8020));
            return ranges;
        }

        void validate() {
            if (defaultRangeName == null || defaultRangeName.isBlank()) {
                throw new InvalidConfigException("allocator.default-range-name is required");
            }
            if (defaultRange == null || !defaultRange.isValid()) {
                throw new InvalidConfigException("allocator.default-range " + defaultRange);
            }
            for (Map.Entry<String, PortRange> entry : ranges.entrySet()) {
                if (entry.getValue() == null || !entry.getValue().isValid()) {
                    throw new InvalidConfigException("allocator.ranges." + entry.getKey() + " " + entry.getValue());
                }
            }
        }
    }

    /**
     * 健康监控配置
     */
    @Data
    public static class Health {
        /**
         * 是否随应用启动健康监控
         */
        private boolean enabled = true;

        /**
         * 探测周期
         */
        private Duration checkInterval = Duration.ofSeconds(5);

        /**
         * 单次探测超时
         */
        private Duration checkTimeout = Duration.ofSeconds(2);

        /**
         * 连续失败多少次标记为不健康
         */
        private int unhealthyThreshold = 3;

        /**
         * 连续成功多少次恢复为健康
         */
        private int healthyThreshold = 2;

        /**
         * 连续失败达到removalThreshold后是否从注册表移除
         */
        private boolean enableAutoRemoval = true;

        /**
         * 自动移除阈值，不得小于unhealthyThreshold
         */
        private int removalThreshold = 5;

        /**
         * 默认探测策略
         */
        private HealthCheckStrategy defaultStrategy = HealthCheckStrategy.TCP;

        /**
         * HTTP探测路径，服务元数据health_endpoint优先
         */
        private String httpHealthPath = "/health";

        void validate() {
            requirePositive(checkInterval, "health.check-interval");
            requirePositive(checkTimeout, "health.check-timeout");
            if (unhealthyThreshold < 1) {
                throw new InvalidConfigException("health.unhealthy-threshold must be >= 1");
            }
            if (healthyThreshold < 1) {
                throw new InvalidConfigException("health.healthy-threshold must be >= 1");
            }
            if (removalThreshold < unhealthyThreshold) {
                throw new InvalidConfigException("health.removal-threshold must be >= health.unhealthy-threshold");
            }
            if (defaultStrategy == HealthCheckStrategy.CUSTOM) {
                throw new InvalidConfigException("health.default-strategy cannot be CUSTOM");
            }
        }
    }

    /**
     * 发现客户端配置
     */
    @Data
    public static class Client {
        /**
         * 发现策略优先级
         */
        private List<DiscoveryStrategyType> preferredStrategies = new ArrayList<>(
            Arrays.asList(DiscoveryStrategyType.REGISTRY, DiscoveryStrategyType.DNS));

        /**
         * 是否启用DNS回退
         */
        private boolean enableDns = true;

        /**
         * 单次发现的总超时
         */
        private Duration discoveryTimeout = Duration.ofSeconds(5);

        /**
         * waitForService轮询间隔
         */
        private Duration waitPollInterval = Duration.ofMillis(100);

        /**
         * 各服务类型的约定端口，用于DNS和DEFAULT_PORT策略
         */
        private Map<String, Integer> defaultPorts = defaultPorts();

        private static Map<String, Integer> defaultPorts() {
            Map<String, Integer> ports = new LinkedHashMap<>();
            ports.put("database", 5432);
            ports.put("cache", 6379);
            ports.put("api", 8080);
            ports.put("rpc", 9090);
            ports.put("metrics", 9100);
            return ports;
        }

        void validate() {
            requirePositive(discoveryTimeout, "client.discovery-timeout");
            requirePositive(waitPollInterval, "client.wait-poll-interval");
            if (preferredStrategies == null || preferredStrategies.isEmpty()) {
                throw new InvalidConfigException("client.preferred-strategies must not be empty");
            }
        }
    }

    private static void requirePositive(Duration duration, String key) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new InvalidConfigException(key + " must be positive");
        }
    }
}
