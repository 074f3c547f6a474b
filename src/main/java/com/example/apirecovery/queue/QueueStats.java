package com.example.apirecovery.queue;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class QueueStats {
    private final int queueSize;
    private final int activeRequests;
    private final long completedRequests;
    private final long failedRequests;
    private final long rejectedRequests;   // 容量不足或被背压挤出
    private final long timedOutRequests;   // 在队列中等待超时
    private final double averageWaitTime;
    private final double averageProcessTime;
    private final double throughputPerSecond;
    private final boolean backpressureActive;
    private final Map<RequestPriority, Integer> priorityDistribution;
}
