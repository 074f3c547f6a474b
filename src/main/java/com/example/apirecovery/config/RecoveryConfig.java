package com.example.apirecovery.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "recovery")
@Data
public class RecoveryConfig {
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    private RetryConfig retry = new RetryConfig();
    private QueueConfig queue = new QueueConfig();
    private boolean gracefulDegradation = true; // 是否允许使用降级结果
    private boolean monitoringEnabled = true;   // 是否轮询熔断器状态并发布事件
    private long monitoringIntervalMs = 5000;   // 轮询间隔

    public RecoveryConfig copy() {
        RecoveryConfig copy = new RecoveryConfig();
        copy.setCircuitBreaker(circuitBreaker.copy());
        copy.setRetry(retry.copy());
        copy.setQueue(queue.copy());
        copy.setGracefulDegradation(gracefulDegradation);
        copy.setMonitoringEnabled(monitoringEnabled);
        copy.setMonitoringIntervalMs(monitoringIntervalMs);
        return copy;
    }

    public void validate() {
        circuitBreaker.validate();
        retry.validate();
        queue.validate();
        if (monitoringIntervalMs <= 0) {
            throw new IllegalArgumentException("monitoringIntervalMs must be > 0");
        }
    }
}
