package com.example.apirecovery.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RetryConfig {
    public static final List<String> DEFAULT_RETRYABLE_ERRORS = List.of(
            "ENOTFOUND", "ECONNRESET", "ETIMEDOUT", "ECONNREFUSED",
            "Network Error", "timeout", "503", "502", "504", "429");

    @Builder.Default
    private int maxAttempts = 3;
    @Builder.Default
    private long baseDelay = 1000;          // 退避基数（毫秒）
    @Builder.Default
    private long maxDelay = 30_000;         // 单次退避上限
    @Builder.Default
    private double backoffMultiplier = 2;
    @Builder.Default
    private boolean jitter = true;          // ±25% 抖动
    @Builder.Default
    private List<String> retryableErrors = new ArrayList<>(DEFAULT_RETRYABLE_ERRORS);
    @Builder.Default
    private long timeout = 120_000;         // 所有尝试的总超时
    @Builder.Default
    private long attemptTimeout = 0;        // 单次尝试超时，0 表示沿用 timeout

    public long effectiveAttemptTimeout() {
        return attemptTimeout > 0 ? attemptTimeout : timeout;
    }

    public RetryConfig copy() {
        return toBuilder().retryableErrors(new ArrayList<>(retryableErrors)).build();
    }

    public void validate() {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelay < 0 || maxDelay < 0) {
            throw new IllegalArgumentException("baseDelay and maxDelay must be >= 0");
        }
        if (backoffMultiplier < 1) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1");
        }
        if (timeout <= 0 || attemptTimeout < 0) {
            throw new IllegalArgumentException("timeout must be > 0 and attemptTimeout >= 0");
        }
    }
}
