package com.example.apirecovery.recovery;

import com.example.apirecovery.queue.RequestPriority;
import lombok.Builder;
import lombok.Getter;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

@Getter
@Builder
public class RecoveryOptions<T> {
    @Builder.Default
    private final RequestPriority priority = RequestPriority.NORMAL;
    // 最终失败时的降级操作，可为空
    private final Supplier<CompletableFuture<T>> fallback;
    private final boolean skipCircuitBreaker;
    private final boolean skipRetry;
    private final boolean skipQueue;

    public static <T> RecoveryOptions<T> defaults() {
        return RecoveryOptions.<T>builder().build();
    }

    public static <T> RecoveryOptions<T> withFallback(Supplier<CompletableFuture<T>> fallback) {
        return RecoveryOptions.<T>builder().fallback(fallback).build();
    }
}
