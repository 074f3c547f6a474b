package com.example.apirecovery.queue;

import lombok.Getter;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * 队列中的一个待执行请求，可变字段只在队列锁内或单个执行线程内修改。
 */
@Getter
public class QueuedRequest<T> {
    private final String id;
    private final Supplier<CompletableFuture<T>> operation;
    private final RequestPriority priority;
    private final long enqueueTime;
    private final long sequence;
    private final long timeout;
    private final int maxRetries;
    private final Map<String, Object> metadata;
    private final CompletableFuture<T> result;
    private volatile long deadline;
    private volatile int retryCount;

    QueuedRequest(String id, Supplier<CompletableFuture<T>> operation, RequestPriority priority, long enqueueTime,
                  long sequence, long timeout, int maxRetries, Map<String, Object> metadata, CompletableFuture<T> result) {
        this.id = id;
        this.operation = operation;
        this.priority = priority;
        this.enqueueTime = enqueueTime;
        this.sequence = sequence;
        this.timeout = timeout;
        this.maxRetries = maxRetries;
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        this.result = result;
        this.deadline = enqueueTime + timeout;
    }

    boolean isExpired(long now) {
        return now > deadline;
    }

    // 重新入队时重新计算截止时间
    void prepareRequeue(long now) {
        retryCount++;
        deadline = now + timeout;
    }
}
