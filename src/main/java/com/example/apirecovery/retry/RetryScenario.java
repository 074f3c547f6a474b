package com.example.apirecovery.retry;

import com.example.apirecovery.config.RetryConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * 常见场景的重试预设。
 */
public enum RetryScenario {
    AGGRESSIVE(5, 500, 10_000, 1.5, true, 60_000,
            List.of("ENOTFOUND", "ECONNRESET", "ETIMEDOUT", "503", "502", "504", "429")),
    CONSERVATIVE(2, 2000, 8000, 2, false, 30_000,
            List.of("ENOTFOUND", "ECONNRESET", "503", "502")),
    NETWORK(4, 1000, 16_000, 2, true, 90_000,
            List.of("ENOTFOUND", "ECONNRESET", "ETIMEDOUT", "ECONNREFUSED", "Network Error")),
    API(3, 1000, 30_000, 2, true, 120_000,
            List.of("503", "502", "504", "429", "timeout")),
    // 限流场景退避更激进
    RATE_LIMIT(5, 1000, 60_000, 2.5, true, 300_000,
            List.of("429", "Rate limit", "Too Many Requests")),
    SERVER_ERROR(4, 2000, 30_000, 2, true, 120_000,
            List.of("500", "502", "503", "504", "Internal Server Error", "Bad Gateway")),
    // 超时场景不加抖动，保证节奏稳定
    TIMEOUT(3, 1500, 15_000, 2.2, false, 90_000,
            List.of("timeout", "ETIMEDOUT", "Request timeout", "TimeoutException"));

    private final int maxAttempts;
    private final long baseDelay;
    private final long maxDelay;
    private final double backoffMultiplier;
    private final boolean jitter;
    private final long timeout;
    private final List<String> retryableErrors;

    RetryScenario(int maxAttempts, long baseDelay, long maxDelay, double backoffMultiplier,
                  boolean jitter, long timeout, List<String> retryableErrors) {
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.backoffMultiplier = backoffMultiplier;
        this.jitter = jitter;
        this.timeout = timeout;
        this.retryableErrors = retryableErrors;
    }

    public RetryConfig toConfig() {
        return RetryConfig.builder()
                .maxAttempts(maxAttempts)
                .baseDelay(baseDelay)
                .maxDelay(maxDelay)
                .backoffMultiplier(backoffMultiplier)
                .jitter(jitter)
                .timeout(timeout)
                .retryableErrors(new ArrayList<>(retryableErrors))
                .build();
    }
}
