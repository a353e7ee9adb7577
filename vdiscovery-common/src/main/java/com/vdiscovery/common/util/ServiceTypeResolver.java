/**
 * 服务类型推断工具
 *
 * @author zhenglin
 * @date 2025/09/03
 */
package com.vdiscovery.common.util;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 根据服务名称推断服务类型，用作端口范围提示和约定端口查询
 */
public final class ServiceTypeResolver {

    public static final String DATABASE = "database";
    public static final String CACHE = "cache";
    public static final String RPC = "rpc";
    public static final String METRICS = "metrics";
    public static final String WEBSOCKET = "websocket";
    public static final String API = "api";

    // 按顺序匹配，先命中者优先
    private static final List<TypeRule> RULES = Arrays.asList(
        new TypeRule(DATABASE, "postgres", "database", "pg", "db", "mysql"),
        new TypeRule(CACHE, "redis", "cache", "memcache"),
        new TypeRule(RPC, "grpc", "rpc"),
        new TypeRule(METRICS, "metrics", "prometheus", "prom"),
        new TypeRule(WEBSOCKET, "websocket", "ws"),
        new TypeRule(API, "api", "http", "rest")
    );

    private ServiceTypeResolver() {
    }

    /**
     * 推断服务类型
     *
     * 名称按非字母数字字符切分，短关键字（pg、db、ws、rest等）只做整词匹配，
     * 长关键字做子串匹配
     *
     * @param serviceName 服务名称
     * @return 服务类型，无法推断时返回null
     */
    public static String resolve(String serviceName) {
        if (serviceName == null || serviceName.isBlank()) {
            return null;
        }
        String lower = serviceName.toLowerCase(Locale.ROOT);
        List<String> tokens = Arrays.asList(lower.split("[^a-z0-9]+"));
        for (TypeRule rule : RULES) {
            for (String keyword : rule.keywords) {
                boolean matched = keyword.length() <= 4 ? tokens.contains(keyword) : lower.contains(keyword);
                if (matched) {
                    return rule.type;
                }
            }
        }
        return null;
    }

    /**
     * 查找服务的约定端口，服务名精确配置优先，其次按推断的类型
     *
     * @param serviceName 服务名称
     * @param defaultPorts 名称或类型 -> 端口
     * @return 约定端口
     */
    public static Optional<Integer> defaultPort(String serviceName, Map<String, Integer> defaultPorts) {
        if (serviceName == null || defaultPorts == null || defaultPorts.isEmpty()) {
            return Optional.empty();
        }
        Integer port = defaultPorts.get(serviceName);
        if (port == null) {
            String type = resolve(serviceName);
            port = type == null ? null : defaultPorts.get(type);
        }
        return Optional.ofNullable(port);
    }

    private static final class TypeRule {
        private final String type;
        private final String[] keywords;

        private TypeRule(String type, String... keywords) {
            this.type = type;
            this.keywords = keywords;
        }
    }
}
