/**
 * HTTP健康探针
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
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.time.Duration;

/**
 * 对健康检查路径发起GET请求，2xx响应视为健康
 * 路径取服务元数据health_endpoint，缺省时使用配置的默认路径
 */
@Slf4j
public class HttpHealthProbe implements HealthProbe {

    public static final String HEALTH_ENDPOINT_KEY = "health_endpoint";

    private final String defaultPath;

    public HttpHealthProbe(String defaultPath) {
        this.defaultPath = defaultPath == null || defaultPath.isBlank() ? "/health" : defaultPath;
    }

    @Override
    public HealthCheckStrategy strategy() {
        return HealthCheckStrategy.HTTP;
    }

    @Override
    public void probe(ServiceRecord record, Duration timeout) {
        String url = buildUrl(record);
        int timeoutMs = (int) Math.max(1, timeout.toMillis());
        HttpURLConnection connection = null;
        try {
            connection = (HttpURLConnection) new URL(url).openConnection();
            connection.setRequestMethod("GET");
            connection.setConnectTimeout(timeoutMs);
            connection.setReadTimeout(timeoutMs);
            connection.setInstanceFollowRedirects(false);

            int status = connection.getResponseCode();
            drain(connection, status);
            if (status < 200 || status >= 300) {
                throw new ProbeFailedException("http health check " + url + " returned status " + status);
            }
            log.trace("HTTP probe succeeded: service={}, url={}, status={}", record.getName(), url, status);
        } catch (IOException e) {
            throw new ProbeFailedException("http health check " + url + " failed: " + e.getMessage(), e);
        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    String buildUrl(ServiceRecord record) {
        String path = defaultPath;
        if (record.getMetadata() != null) {
            String endpoint = record.getMetadata().get(HEALTH_ENDPOINT_KEY);
            if (endpoint != null && !endpoint.isBlank()) {
                path = endpoint;
            }
        }
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        String scheme = "https".equalsIgnoreCase(record.getProtocol()) ? "https" : "http";
        return scheme + "://" + record.getHost() + ":" + record.getPort() + path;
    }

    private static void drain(HttpURLConnection connection, int status) throws IOException {
        InputStream body = status >= 400 ? connection.getErrorStream() : connection.getInputStream();
        if (body != null) {
            try (InputStream in = body) {
                in.readAllBytes();
            }
        }
    }
}
