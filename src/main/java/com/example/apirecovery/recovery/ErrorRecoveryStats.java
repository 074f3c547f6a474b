package com.example.apirecovery.recovery;

import com.example.apirecovery.circuitBreaker.CircuitBreaker;
import com.example.apirecovery.queue.QueueStats;
import com.example.apirecovery.retry.RetryStats;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class ErrorRecoveryStats {
    private long totalRequests;
    private long successfulRequests;
    // 包含降级成功的请求
    private long failedRequests;
    private long recoveredRequests;
    private long fallbacksUsed;
    private long uptime;
    private double availability;
    private Map<String, CircuitBreaker.CircuitBreakerMetrics> circuitBreakers;
    private RetryStats retryStats;
    private QueueStats queueStats;
}
