package com.call_bridge_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.UUID;

@Configuration
@ConfigurationProperties(prefix = "worker")
@Data
public class WorkerConfig {

    private String id;
    private String address;
    private Duration sessionTtl = Duration.ofMinutes(5);
    private String proxyToken;

    private final String generatedId = "worker-" + UUID.randomUUID();

    /**
     * Configured worker id, or a random one that stays stable for this process.
     */
    public String getWorkerId() {
        return id != null && !id.isBlank() ? id.trim() : generatedId;
    }

    public boolean hasProxyToken() {
        return proxyToken != null && !proxyToken.isBlank();
    }
}
