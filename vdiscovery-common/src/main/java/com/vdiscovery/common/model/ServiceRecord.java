/**
 * 服务注册记录
 *
 * @author zhenglin
 * @date 2025/09/02
 */
package com.vdiscovery.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 服务实例模型
 * 注册表中每个服务名对应一条记录，同名重复注册视为续约
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ServiceRecord {

    /**
     * 服务名称（注册表内唯一）
     */
    private String name;

    /**
     * 主机地址
     */
    private String host;

    /**
     * 端口，0表示由端口分配器自动分配
     */
    private int port;

    /**
     * 协议：tcp、udp、http、https、grpc
     */
    @Builder.Default
    private String protocol = "tcp";

    /**
     * 服务版本
     */
    private String version;

    /**
     * 自定义元数据
     */
    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    /**
     * 健康状态，由心跳注册和健康监控维护
     */
    @Builder.Default
    private boolean healthy = true;

    /**
     * 首次注册时间
     */
    private Instant registeredAt;

    /**
     * 最近一次心跳时间
     */
    private Instant lastHeartbeat;

    /**
     * 存活时间，超过该时长没有心跳的记录会被清理
     */
    private Duration ttl;

    /**
     * 获取服务地址
     *
     * @return host:port
     */
    public String getAddress() {
        return host + ":" + port;
    }

    /**
     * 判断记录是否已过期
     *
     * @param now 当前时间
     * @return 超过TTL未心跳返回true
     */
    public boolean isExpired(Instant now) {
        if (ttl == null || lastHeartbeat == null) {
            return false;
        }
        return Duration.between(lastHeartbeat, now).compareTo(ttl) > 0;
    }

    /**
     * 深拷贝，元数据使用独立的Map
     *
     * @return 记录副本
     */
    public ServiceRecord copy() {
        return toBuilder()
            .metadata(metadata == null ? new HashMap<>() : new HashMap<>(metadata))
            .build();
    }
}
