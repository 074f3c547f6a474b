package com.example.apirecovery.utils;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

public final class FutureUtil {

    private FutureUtil() {
    }

    // 调用异步操作，同步抛出的异常和 null 返回值都折算成失败的 future
    public static <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> operation) {
        try {
            CompletableFuture<T> future = operation.get();
            if (future == null) {
                return CompletableFuture.failedFuture(new NullPointerException("operation returned a null future"));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    // 剥掉 CompletableFuture 链路包装的 CompletionException / ExecutionException
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
