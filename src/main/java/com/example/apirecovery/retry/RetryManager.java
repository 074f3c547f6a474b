package com.example.apirecovery.retry;

import cn.hutool.core.thread.NamedThreadFactory;
import com.example.apirecovery.config.RetryConfig;
import com.example.apirecovery.exception.RecoveryException;
import com.example.apirecovery.exception.RetryExhaustedException;
import com.example.apirecovery.exception.RetryTimeoutException;
import com.example.apirecovery.utils.FutureUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * 带指数退避和抖动的重试执行器。
 * <p>
 * 每次尝试都和单次超时赛跑；退避等待交给调度线程，不阻塞调用方。
 * 调度线程只负责计时，第二次及之后的尝试在工作线程池中执行。
 * 不可重试的异常只尝试一次并原样返回，恢复链路自身的 {@link RecoveryException} 一律不可重试。
 */
public class RetryManager {
    private static final Logger logger = LoggerFactory.getLogger(RetryManager.class);

    private final RetryConfig defaultConfig;
    private final ScheduledExecutorService scheduler;
    private final Executor workerPool;
    private final boolean ownsExecutors;

    private final LongAdder totalAttempts = new LongAdder();
    private final LongAdder successfulRetries = new LongAdder();
    private final LongAdder failedRetries = new LongAdder();
    private final LongAdder completedOperations = new LongAdder();
    private final LongAdder totalRetryTime = new LongAdder();
    private final ConcurrentHashMap<String, LongAdder> errorDistribution = new ConcurrentHashMap<>();

    public RetryManager() {
        this(new RetryConfig());
    }

    public RetryManager(RetryConfig defaultConfig) {
        this(defaultConfig, createScheduler(),
                Executors.newCachedThreadPool(new NamedThreadFactory("recovery-retry-worker-", true)), true);
    }

    public RetryManager(RetryConfig defaultConfig, ScheduledExecutorService scheduler, Executor workerPool) {
        this(defaultConfig, scheduler, workerPool, false);
    }

    private RetryManager(RetryConfig defaultConfig, ScheduledExecutorService scheduler, Executor workerPool,
                         boolean ownsExecutors) {
        defaultConfig.validate();
        this.defaultConfig = defaultConfig.copy();
        this.scheduler = scheduler;
        this.workerPool = workerPool;
        this.ownsExecutors = ownsExecutors;
    }

    /**
     * 单线程计时器，取消的超时任务立即出队，避免成功请求的超时任务堆积到过期
     */
    static ScheduledThreadPoolExecutor createScheduler() {
        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(1, new NamedThreadFactory("recovery-retry-", true));
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    public <T> CompletableFuture<T> executeWithRetry(Supplier<CompletableFuture<T>> operation) {
        return executeWithRetry(operation, null);
    }

    public <T> CompletableFuture<T> executeWithRetry(Supplier<CompletableFuture<T>> operation, RetryConfig config) {
        RetryConfig finalConfig = config != null ? config : defaultConfig;
        finalConfig.validate();
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(operation, finalConfig, 1, System.currentTimeMillis(), new ArrayList<>(), result);
        return result;
    }

    private <T> void attempt(Supplier<CompletableFuture<T>> operation, RetryConfig config, int attemptNumber,
                             long startTime, List<RetryAttempt> attempts, CompletableFuture<T> result) {
        executeWithTimeout(operation, config.effectiveAttemptTimeout()).whenComplete((value, error) -> {
            long now = System.currentTimeMillis();
            long elapsed = now - startTime;
            if (error == null) {
                recordOutcome(attemptNumber, elapsed, true);
                result.complete(value);
                return;
            }
            Throwable cause = FutureUtil.unwrap(error);
            errorDistribution.computeIfAbsent(cause.getClass().getSimpleName(), k -> new LongAdder()).increment();

            if (!shouldRetry(cause, config)) {
                attempts.add(new RetryAttempt(attemptNumber, 0, elapsed, cause, now));
                recordOutcome(attemptNumber, elapsed, false);
                result.completeExceptionally(cause);
                return;
            }
            if (attemptNumber >= config.getMaxAttempts()) {
                attempts.add(new RetryAttempt(attemptNumber, 0, elapsed, cause, now));
                recordOutcome(attemptNumber, elapsed, false);
                logger.warn("重试次数耗尽 attempts={} lastError={}", attemptNumber, cause.toString());
                result.completeExceptionally(new RetryExhaustedException(cause, attempts));
                return;
            }

            long delay = calculateDelay(attemptNumber, config);
            attempts.add(new RetryAttempt(attemptNumber, delay, elapsed, cause, now));
            if (elapsed + delay > config.getTimeout()) {
                recordOutcome(attemptNumber, elapsed, false);
                logger.warn("重试总耗时将超过 {}ms，放弃剩余尝试 elapsed={} nextDelay={}", config.getTimeout(), elapsed, delay);
                result.completeExceptionally(new RetryTimeoutException(attempts, config.getTimeout(), cause));
                return;
            }

            logger.debug("第 {} 次尝试失败，{}ms 后重试: {}", attemptNumber, delay, cause.toString());
            scheduleDelay(delay).whenComplete((ignored, delayError) -> {
                if (delayError != null) {
                    result.completeExceptionally(FutureUtil.unwrap(delayError));
                    return;
                }
                try {
                    CompletableFuture.runAsync(
                            () -> attempt(operation, config, attemptNumber + 1, startTime, attempts, result), workerPool);
                } catch (RejectedExecutionException e) {
                    result.completeExceptionally(e);
                }
            });
        });
    }

    private <T> CompletableFuture<T> executeWithTimeout(Supplier<CompletableFuture<T>> operation, long timeout) {
        CompletableFuture<T> attemptFuture = new CompletableFuture<>();
        ScheduledFuture<?> timer;
        try {
            timer = scheduler.schedule(
                    () -> attemptFuture.completeExceptionally(new TimeoutException("Operation timeout after " + timeout + "ms")),
                    timeout, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
        FutureUtil.invoke(operation).whenComplete((value, error) -> {
            timer.cancel(false);
            if (error == null) {
                attemptFuture.complete(value);
            } else {
                attemptFuture.completeExceptionally(FutureUtil.unwrap(error));
            }
        });
        return attemptFuture;
    }

    /**
     * 按消息子串（忽略大小写）或异常简单类名匹配可重试错误
     */
    public boolean shouldRetry(Throwable error, RetryConfig config) {
        if (error instanceof RecoveryException) {
            return false;
        }
        String message = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
        String type = error.getClass().getSimpleName();
        return config.getRetryableErrors().stream()
                .anyMatch(token -> message.contains(token.toLowerCase(Locale.ROOT)) || type.equalsIgnoreCase(token));
    }

    /**
     * delay = min(maxDelay, baseDelay * multiplier^(attempt-1))，开启抖动时再加减最多 25%，向下取整且不小于 0
     */
    public long calculateDelay(int attempt, RetryConfig config) {
        double delay = config.getBaseDelay() * Math.pow(config.getBackoffMultiplier(), attempt - 1);
        delay = Math.min(delay, config.getMaxDelay());
        if (config.isJitter()) {
            double jitterAmount = delay * 0.25;
            delay += (ThreadLocalRandom.current().nextDouble() * 2 - 1) * jitterAmount;
        }
        return Math.max(0, (long) Math.floor(delay));
    }

    protected CompletableFuture<Void> scheduleDelay(long delayMs) {
        CompletableFuture<Void> delayed = new CompletableFuture<>();
        try {
            scheduler.schedule(() -> delayed.complete(null), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            delayed.completeExceptionally(e);
        }
        return delayed;
    }

    private void recordOutcome(int attempts, long elapsed, boolean success) {
        totalAttempts.add(attempts);
        completedOperations.increment();
        if (attempts > 1) {
            totalRetryTime.add(elapsed);
        }
        if (!success) {
            failedRetries.increment();
        } else if (attempts > 1) {
            successfulRetries.increment();
        }
    }

    public RetryStats getStats() {
        long operations = completedOperations.sum();
        long attempts = totalAttempts.sum();
        Map<String, Long> distribution = new TreeMap<>();
        errorDistribution.forEach((type, count) -> distribution.put(type, count.sum()));
        return RetryStats.builder()
                .totalAttempts(attempts)
                .successfulRetries(successfulRetries.sum())
                .failedRetries(failedRetries.sum())
                .averageAttempts(operations > 0 ? (double) attempts / operations : 0)
                .totalRetryTime(totalRetryTime.sum())
                .errorDistribution(distribution)
                .build();
    }

    public void resetStats() {
        totalAttempts.reset();
        successfulRetries.reset();
        failedRetries.reset();
        completedOperations.reset();
        totalRetryTime.reset();
        errorDistribution.clear();
    }

    public RetryConfig getDefaultConfig() {
        return defaultConfig.copy();
    }

    public void shutdown() {
        if (ownsExecutors) {
            scheduler.shutdownNow();
            ((ExecutorService) workerPool).shutdownNow();
        }
    }
}
