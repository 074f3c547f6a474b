package com.example.apirecovery.queue;

import lombok.Builder;
import lombok.Getter;

import java.util.Map;

@Getter
@Builder
public class EnqueueOptions {
    @Builder.Default
    private final RequestPriority priority = RequestPriority.NORMAL;
    // 0 表示使用队列配置的 timeout
    private final long timeout;
    // 仅在 retryFailedRequests 开启时生效
    private final int maxRetries;
    private final Map<String, Object> metadata;

    public static EnqueueOptions defaults() {
        return EnqueueOptions.builder().build();
    }

    public static EnqueueOptions withPriority(RequestPriority priority) {
        return EnqueueOptions.builder().priority(priority).build();
    }
}
