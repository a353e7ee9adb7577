package com.vdiscovery.core.service;

import com.vdiscovery.common.service.HealthMonitor;
import com.vdiscovery.common.service.ServiceRegistry;
import com.vdiscovery.core.config.DiscoveryProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import javax.annotation.PreDestroy;

/**
 * 服务发现生命周期管理器
 * 应用就绪后启动注册表过期清理和健康监控，容器关闭时按相反顺序停止
 *
 * @author zhenglin
 * @date 2025/09/05
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DiscoveryLifecycleManager {

    private final ServiceRegistry serviceRegistry;
    private final HealthMonitor healthMonitor;
    private final DiscoveryProperties properties;

    private volatile LifecycleState state = LifecycleState.INITIALIZING;

    /**
     * 应用启动后启动后台任务
     */
    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (state == LifecycleState.RUNNING) {
            return;
        }
        try {
            log.info("Starting discovery subsystem");
            serviceRegistry.start();

            if (properties.getHealth().isEnabled()) {
                healthMonitor.start();
            } else {
                log.info("Health monitoring is disabled");
            }

            state = LifecycleState.RUNNING;
            log.info("Discovery subsystem started");
        } catch (Exception e) {
            log.error("Failed to start discovery subsystem", e);
            state = LifecycleState.FAILED;
            stop();
            throw new IllegalStateException("Discovery subsystem startup failed", e);
        }
    }

    /**
     * 停止后台任务
     */
    @PreDestroy
    public void stop() {
        if (state == LifecycleState.STOPPED || state == LifecycleState.INITIALIZING) {
            return;
        }
        log.info("Stopping discovery subsystem");
        try {
            if (healthMonitor.isRunning()) {
                healthMonitor.stop();
            }
        } catch (Exception e) {
            log.error("Error stopping health monitor", e);
        }
        try {
            serviceRegistry.stop();
        } catch (Exception e) {
            log.error("Error stopping registry cleanup", e);
        }
        state = LifecycleState.STOPPED;
        log.info("Discovery subsystem stopped");
    }

    public LifecycleState getState() {
        return state;
    }

    /**
     * 生命周期状态
     */
    public enum LifecycleState {
        INITIALIZING,
        RUNNING,
        STOPPED,
        FAILED
    }
}
