/**
 * TCP健康探针
 *
 * @author zhenglin
 * @date 2025/09/04
 */
package com.vdiscovery.common.service.probe;

import com.vdiscovery.common.exception.ProbeFailedException;
import com.vdiscovery.common.model.HealthCheckStrategy;
import com.vdiscovery.common.model.ServiceRecord;
import com.vdiscovery.common.service.HealthProbe;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/**
 * 建立连接后立即关闭，连接成功即视为健康
 */
@Slf4j
public class TcpHealthProbe implements HealthProbe {

    @Override
    public HealthCheckStrategy strategy() {
        return HealthCheckStrategy.TCP;
    }

    @Override
    public void probe(ServiceRecord record, Duration timeout) {
        InetSocketAddress address = new InetSocketAddress(record.getHost(), record.getPort());
        try (Socket socket = new Socket()) {
            socket.connect(address, (int) Math.max(1, timeout.toMillis()));
            log.trace("TCP probe succeeded: service={}, addr={}", record.getName(), record.getAddress());
        } catch (IOException e) {
            throw new ProbeFailedException("tcp connect to " + record.getAddress() + " failed: " + e.getMessage(), e);
        }
    }
}
