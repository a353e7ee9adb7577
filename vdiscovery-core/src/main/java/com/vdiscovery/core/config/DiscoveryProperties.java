/**
 * 服务发现配置属性
 *
 * @author zhenglin
 * @date 2025/09/05
 */
package com.vdiscovery.core.config;

import com.vdiscovery.common.config.DiscoveryConfig;
import lombok.Data;
import lombok.EqualsAndHashCode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 服务发现配置属性 - Spring Boot配置绑定
 * 继承DiscoveryConfig以复用基础配置结构
 */
@Data
@EqualsAndHashCode(callSuper = true)
@Component
@ConfigurationProperties(prefix = "vdiscovery")
public class DiscoveryProperties extends DiscoveryConfig {
    // 仅用于配置绑定，默认值与校验逻辑在父类DiscoveryConfig中
}
