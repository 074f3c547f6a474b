package com.example.apirecovery.recovery;

import com.example.apirecovery.config.CircuitBreakerConfig;
import com.example.apirecovery.config.QueueConfig;
import com.example.apirecovery.config.RecoveryConfig;
import com.example.apirecovery.config.RetryConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * 整套恢复配置的预设。
 */
public enum RecoveryProfile {
    PRODUCTION {
        @Override
        public RecoveryConfig toConfig() {
            return build(new CircuitBreakerConfig(5, 60_000, 3, 120_000, 3),
                    RetryConfig.builder()
                            .maxAttempts(3).baseDelay(1000).maxDelay(30_000).backoffMultiplier(2).jitter(true)
                            .timeout(120_000)
                            .build(),
                    new QueueConfig(5000, 20, 60_000, true, 50, 4000, true),
                    true);
        }
    },
    DEVELOPMENT {
        @Override
        public RecoveryConfig toConfig() {
            return build(new CircuitBreakerConfig(3, 30_000, 2, 60_000, 2),
                    RetryConfig.builder()
                            .maxAttempts(2).baseDelay(500).maxDelay(5000).backoffMultiplier(1.5).jitter(false)
                            .retryableErrors(new ArrayList<>(List.of("ENOTFOUND", "ECONNRESET", "503", "502")))
                            .timeout(30_000)
                            .build(),
                    new QueueConfig(1000, 10, 30_000, false, 20, 800, false),
                    true);
        }
    },
    // 熔断更迟钝，重试更多，队列更大
    HIGH_RESILIENCE {
        @Override
        public RecoveryConfig toConfig() {
            return build(new CircuitBreakerConfig(10, 300_000, 5, 600_000, 5),
                    RetryConfig.builder()
                            .maxAttempts(5).baseDelay(2000).maxDelay(60_000).backoffMultiplier(2.5).jitter(true)
                            .retryableErrors(new ArrayList<>(List.of("ENOTFOUND", "ECONNRESET", "ETIMEDOUT",
                                    "ECONNREFUSED", "Network Error", "500", "502", "503", "504", "429")))
                            .timeout(300_000)
                            .build(),
                    new QueueConfig(10_000, 50, 120_000, true, 100, 8000, true),
                    true);
        }
    };

    public abstract RecoveryConfig toConfig();

    private static RecoveryConfig build(CircuitBreakerConfig circuitBreaker, RetryConfig retry, QueueConfig queue,
                                        boolean gracefulDegradation) {
        RecoveryConfig config = new RecoveryConfig();
        config.setCircuitBreaker(circuitBreaker);
        config.setRetry(retry);
        config.setQueue(queue);
        config.setGracefulDegradation(gracefulDegradation);
        config.setMonitoringEnabled(true);
        return config;
    }
}
