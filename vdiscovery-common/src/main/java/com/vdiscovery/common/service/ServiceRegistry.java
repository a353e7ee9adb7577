/**
 * 服务注册表接口
 *
 * @author zhenglin
 * @date 2025/09/02
 */
package com.vdiscovery.common.service;

import com.vdiscovery.common.model.ServiceRecord;

import java.util.List;

/**
 * 轻量级服务注册表接口（无外部中间件）
 * 维护"什么服务运行在哪里"的唯一事实来源，并通过TTL保证记录新鲜度
 */
public interface ServiceRegistry {

    /**
     * 注册服务，同名记录视为续约并覆盖
     *
     * @param record 服务记录
     * @return 注册表中保存的记录副本
     */
    ServiceRecord register(ServiceRecord record);

    /**
     * 更新已存在服务的信息，保留首次注册时间
     *
     * @param serviceName 服务名称
     * @param record 新的服务记录
     * @return 更新后的记录副本
     */
    ServiceRecord update(String serviceName, ServiceRecord record);

    /**
     * 获取服务记录
     *
     * @param serviceName 服务名称
     * @return 服务记录副本
     */
    ServiceRecord get(String serviceName);

    /**
     * 刷新心跳，延长TTL截止时间
     *
     * @param serviceName 服务名称
     */
    void heartbeat(String serviceName);

    /**
     * 直接设置健康状态
     *
     * @param serviceName 服务名称
     * @param healthy 健康状态
     * @return 状态发生变化返回true
     */
    boolean updateHealth(String serviceName, boolean healthy);

    /**
     * 立即注销服务
     *
     * @param serviceName 服务名称
     * @return 被移除的记录
     */
    ServiceRecord deregister(String serviceName);

    /**
     * 列出未过期的服务
     *
     * @param healthyOnly 是否只返回健康服务
     * @return 按名称排序的记录快照
     */
    List<ServiceRecord> list(boolean healthyOnly);

    /**
     * 按协议列出未过期的服务
     *
     * @param protocol 协议
     * @return 记录快照
     */
    List<ServiceRecord> listByProtocol(String protocol);

    /**
     * 执行一次过期清理
     *
     * @return 清理的记录数
     */
    int cleanupExpired();

    /**
     * 启动后台过期清理
     */
    void start();

    /**
     * 停止后台过期清理
     */
    void stop();

    boolean isRunning();

    /**
     * 添加注册表事件监听器
     *
     * @param listener 事件监听器
     */
    void addRegistryListener(RegistryEventListener listener);

    /**
     * 注册表事件监听器
     */
    interface RegistryEventListener {

        /**
         * 服务注册或续约
         */
        default void onServiceRegistered(ServiceRecord record, boolean renewal) {
        }

        /**
         * 服务被显式注销或被健康监控移除
         */
        default void onServiceDeregistered(ServiceRecord record) {
        }

        /**
         * 服务因TTL过期被清理
         */
        default void onServiceExpired(ServiceRecord record) {
        }

        /**
         * 健康状态变化
         */
        default void onHealthChanged(String serviceName, boolean healthy) {
        }
    }
}
