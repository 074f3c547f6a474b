package com.example.apirecovery.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueueConfig {
    @Builder.Default
    private int maxSize = 5000;                 // 队列最大长度
    @Builder.Default
    private int maxConcurrent = 20;             // 最大并发执行数
    @Builder.Default
    private long timeout = 60_000;              // 请求在队列中的最长等待时间（毫秒）
    @Builder.Default
    private boolean priorityEnabled = true;
    @Builder.Default
    private int rateLimitPerSecond = 50;        // 全局出队速率，<=0 不限速
    @Builder.Default
    private int backpressureThreshold = 4000;   // 达到该长度开始背压
    @Builder.Default
    private boolean retryFailedRequests = true; // 失败请求按 maxRetries 重新入队

    public static QueueConfig highThroughput() {
        return QueueConfig.builder()
                .maxSize(10_000).maxConcurrent(50).timeout(30_000).priorityEnabled(false)
                .rateLimitPerSecond(100).backpressureThreshold(8000).retryFailedRequests(true)
                .build();
    }

    public static QueueConfig priority() {
        return QueueConfig.builder()
                .maxSize(5000).maxConcurrent(20).timeout(60_000).priorityEnabled(true)
                .rateLimitPerSecond(50).backpressureThreshold(4000).retryFailedRequests(true)
                .build();
    }

    public static QueueConfig conservative() {
        return QueueConfig.builder()
                .maxSize(1000).maxConcurrent(10).timeout(120_000).priorityEnabled(true)
                .rateLimitPerSecond(20).backpressureThreshold(800).retryFailedRequests(false)
                .build();
    }

    public QueueConfig copy() {
        return toBuilder().build();
    }

    public void validate() {
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize must be >= 0");
        }
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1");
        }
        if (timeout <= 0) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        if (backpressureThreshold < 0) {
            throw new IllegalArgumentException("backpressureThreshold must be >= 0");
        }
    }
}
