/**
 * 服务发现核心应用启动类
 *
 * @author zhenglin
 * @date 2025/09/05
 */
package com.vdiscovery.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.annotation.ComponentScan;

import java.util.concurrent.CountDownLatch;

/**
 * 服务发现核心应用
 * 进程内服务注册、端口分配、服务发现与健康监控
 */
@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = {
    "com.vdiscovery.core.config",
    "com.vdiscovery.core.service"
})
public class VdiscoveryCoreApplication {

    public static void main(String[] args) {
        try {
            log.info("启动服务发现核心...");
            log.info("Java版本: {}", System.getProperty("java.version"));

            SpringApplication app = new SpringApplication(VdiscoveryCoreApplication.class);
            app.setLogStartupInfo(true);

            ConfigurableApplicationContext context = app.run(args);

            // 后台线程均为守护线程，主线程等待容器关闭
            CountDownLatch shutdownLatch = new CountDownLatch(1);
            context.addApplicationListener(event -> {
                if (event instanceof ContextClosedEvent) {
                    shutdownLatch.countDown();
                }
            });
            log.info("服务发现核心启动成功!");
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("服务发现核心启动失败", e);
            System.exit(1);
        }
    }
}
