package com.example.apirecovery.retry;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class RetryStats {
    private final long totalAttempts;
    private final long successfulRetries;   // 经过重试后成功的操作数
    private final long failedRetries;       // 最终失败的操作数
    private final double averageAttempts;
    private final long totalRetryTime;
    private final Map<String, Long> errorDistribution;
}
