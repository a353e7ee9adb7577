/**
 * 服务发现客户端接口
 *
 * @author zhenglin
 * @date 2025/09/03
 */
package com.vdiscovery.common.service;

import com.vdiscovery.common.model.DiscoveryResult;
import com.vdiscovery.common.model.HealthCheckResult;
import com.vdiscovery.common.model.ServiceRecord;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 服务发现门面
 * 对调用方屏蔽服务是经由注册表、DNS还是其它解析器找到的，以及端口自动分配细节
 */
public interface DiscoveryClient extends AutoCloseable {

    /**
     * 注册服务，端口为0时按服务名推断的类型自动分配端口
     *
     * @param record 服务记录
     * @return 注册表中保存的记录
     */
    ServiceRecord register(ServiceRecord record);

    /**
     * 注册服务，端口为0时从指定范围分配端口
     *
     * @param record 服务记录
     * @param rangeHint 端口范围名称
     * @return 注册表中保存的记录
     */
    ServiceRecord register(ServiceRecord record, String rangeHint);

    /**
     * 按优先级依次尝试各发现策略
     *
     * @param serviceName 服务名称
     * @return 首个成功的发现结果
     */
    DiscoveryResult discover(String serviceName);

    /**
     * 轮询等待服务可用
     *
     * @param serviceName 服务名称
     * @param timeout 最长等待时间
     * @return 发现结果
     */
    DiscoveryResult waitForService(String serviceName, Duration timeout);

    void heartbeat(String serviceName);

    /**
     * 注销服务并释放其端口
     *
     * @param serviceName 服务名称
     */
    void deregister(String serviceName);

    List<ServiceRecord> listServices();

    List<ServiceRecord> listHealthyServices();

    /**
     * 获取服务地址
     *
     * @param serviceName 服务名称
     * @return host:port
     */
    String getServiceAddress(String serviceName);

    /**
     * 健康监控对该服务的最近一次判定
     *
     * @param serviceName 服务名称
     * @return 未接入健康监控或尚无结果时为空
     */
    Optional<HealthCheckResult> getLastHealthResult(String serviceName);

    /**
     * 追加自定义发现策略，排在配置的策略之后
     *
     * @param strategy 发现策略
     */
    void addStrategy(DiscoveryStrategy strategy);

    @Override
    void close();
}
