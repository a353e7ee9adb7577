/**
 * 健康监控接口
 *
 * @author zhenglin
 * @date 2025/09/04
 */
package com.vdiscovery.common.service;

import com.vdiscovery.common.model.HealthCheckResult;
import com.vdiscovery.common.model.HealthCheckStrategy;
import com.vdiscovery.common.model.ServiceRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 主动健康监控接口
 * 周期性探测已注册服务的可达性，通过连续计数实现滞回，避免单次抖动导致状态翻转
 */
public interface HealthMonitor extends AutoCloseable {

    /**
     * 启动周期探测
     */
    void start();

    /**
     * 停止周期探测
     */
    void stop();

    boolean isRunning();

    /**
     * 立即同步探测一个服务，不更新计数和注册表
     *
     * @param serviceName 服务名称
     * @return 探测结果
     */
    HealthCheckResult checkServiceHealth(String serviceName);

    /**
     * 执行一轮探测并记录结果
     */
    void runCheckCycle();

    /**
     * 记录一次探测结果，驱动计数和健康状态迁移
     *
     * @param result 探测结果
     */
    void recordResult(HealthCheckResult result);

    void registerCustomCheck(String serviceName, CustomHealthCheck check);

    void removeCustomCheck(String serviceName);

    void setServiceStrategy(String serviceName, HealthCheckStrategy strategy);

    Optional<HealthCheckResult> getLastResult(String serviceName);

    Map<String, HealthCheckResult> getAllResults();

    int getFailureCount(String serviceName);

    int getSuccessCount(String serviceName);

    void resetCounts(String serviceName);

    List<ServiceRecord> getHealthyServices();

    List<ServiceRecord> getUnhealthyServices();

    /**
     * 停止周期探测并关闭探测线程池，可重复调用
     */
    @Override
    void close();

    /**
     * 自定义健康检查函数，正常返回即视为健康
     */
    @FunctionalInterface
    interface CustomHealthCheck {
        void check(ServiceRecord record) throws Exception;
    }
}
