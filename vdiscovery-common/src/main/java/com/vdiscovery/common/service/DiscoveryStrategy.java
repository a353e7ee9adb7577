/**
 * 服务发现策略接口
 *
 * @author zhenglin
 * @date 2025/09/03
 */
package com.vdiscovery.common.service;

import com.vdiscovery.common.model.DiscoveryStrategyType;
import com.vdiscovery.common.model.ServiceRecord;

/**
 * 一种把服务名解析为地址的方式
 */
public interface DiscoveryStrategy {

    DiscoveryStrategyType type();

    /**
     * 解析服务
     *
     * @param serviceName 服务名称
     * @return 解析到的服务记录
     * @throws com.vdiscovery.common.exception.ServiceNotFoundException 未能解析
     */
    ServiceRecord resolve(String serviceName);

    /**
     * 是否为纯内存查找，本地策略在调用线程上直接执行
     */
    default boolean isLocal() {
        return false;
    }
}
