package com.example.apirecovery.recovery;

import cn.hutool.core.thread.NamedThreadFactory;
import com.example.apirecovery.circuitBreaker.CircuitBreaker;
import com.example.apirecovery.circuitBreaker.CircuitBreakerManager;
import com.example.apirecovery.config.RecoveryConfig;
import com.example.apirecovery.exception.QueueOverflowException;
import com.example.apirecovery.exception.RateLimitExceededException;
import com.example.apirecovery.exception.RetryExhaustedException;
import com.example.apirecovery.exception.RetryTimeoutException;
import com.example.apirecovery.limit.LimitManager;
import com.example.apirecovery.limit.RateLimitResult;
import com.example.apirecovery.model.HealthLevel;
import com.example.apirecovery.queue.EnqueueOptions;
import com.example.apirecovery.queue.QueueHealth;
import com.example.apirecovery.queue.RequestQueue;
import com.example.apirecovery.retry.RetryManager;
import com.example.apirecovery.utils.FutureUtil;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 组合限流、排队、重试、熔断的统一入口。
 * <p>
 * 调用链由外到内：限流关卡（可选）→ 请求队列 → 重试 → 熔断器 → 实际操作，
 * 队列、重试、熔断都可以按次跳过。最终失败时如果配置了降级且允许优雅降级，用降级结果代替。
 */
public class ErrorRecoveryOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(ErrorRecoveryOrchestrator.class);

    private volatile RecoveryConfig config;
    private final CircuitBreakerManager circuitBreakerManager;
    private final RetryManager retryManager;
    private final RequestQueue requestQueue;
    private final RecoveryEventPublisher eventPublisher = new RecoveryEventPublisher();
    private final LimitManager limitManager;

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong successfulRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicLong recoveredRequests = new AtomicLong();
    private final AtomicLong fallbacksUsed = new AtomicLong();
    private volatile long startTime = System.currentTimeMillis();

    // 熔断状态轮询
    private final ScheduledExecutorService monitor;
    private ScheduledFuture<?> monitorTask;
    private final Map<String, ObservedState> observedStates = new ConcurrentHashMap<>();

    public ErrorRecoveryOrchestrator(RecoveryConfig config) {
        this(config, null);
    }

    public ErrorRecoveryOrchestrator(RecoveryConfig config, LimitManager limitManager) {
        this(config, limitManager, Clock.systemUTC());
    }

    public ErrorRecoveryOrchestrator(RecoveryConfig config, LimitManager limitManager, Clock clock) {
        config.validate();
        this.config = config.copy();
        this.limitManager = limitManager;
        this.circuitBreakerManager = new CircuitBreakerManager(this.config.getCircuitBreaker(), clock);
        this.retryManager = new RetryManager(this.config.getRetry());
        this.requestQueue = new RequestQueue(this.config.getQueue());
        this.monitor = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("recovery-monitor-", true));
        scheduleMonitor();
        logger.info("错误恢复组件已启动 gracefulDegradation={} monitoring={} rateLimit={}",
                this.config.isGracefulDegradation(), this.config.isMonitoringEnabled(), limitManager != null);
    }

    public static ErrorRecoveryOrchestrator create(RecoveryProfile profile) {
        return new ErrorRecoveryOrchestrator(profile.toConfig());
    }

    public <T> CompletableFuture<T> executeWithRecovery(String name, Supplier<CompletableFuture<T>> operation) {
        return executeWithRecovery(name, operation, RecoveryOptions.defaults());
    }

    /**
     * 在完整的恢复链路下执行操作。返回的 future 要么以操作（或降级）的结果完成，
     * 要么以最终的类型化异常失败。
     */
    public <T> CompletableFuture<T> executeWithRecovery(String name, Supplier<CompletableFuture<T>> operation,
                                                        RecoveryOptions<T> callOptions) {
        RecoveryOptions<T> options = callOptions != null ? callOptions : RecoveryOptions.defaults();
        totalRequests.incrementAndGet();
        RecoveryConfig current = config;
        CompletableFuture<T> result = new CompletableFuture<>();

        wrapWithRecovery(name, operation, options, current).whenComplete((value, error) -> {
            if (error == null) {
                successfulRequests.incrementAndGet();
                result.complete(value);
                return;
            }
            Throwable cause = FutureUtil.unwrap(error);
            failedRequests.incrementAndGet();
            publishFailure(name, cause);

            if (options.getFallback() == null || !current.isGracefulDegradation()) {
                result.completeExceptionally(cause);
                return;
            }
            runFallback(name, options, cause, result);
        });
        return result;
    }

    private <T> CompletableFuture<T> wrapWithRecovery(String name, Supplier<CompletableFuture<T>> operation,
                                                      RecoveryOptions<T> options, RecoveryConfig current) {
        if (limitManager != null && limitManager.isEnabled()) {
            RateLimitResult limit = limitManager.checkLimit(name);
            if (!limit.isAllowed()) {
                return CompletableFuture.failedFuture(new RateLimitExceededException(name, limit));
            }
        }

        Supplier<CompletableFuture<T>> wrapped = operation;
        if (!options.isSkipCircuitBreaker()) {
            Supplier<CompletableFuture<T>> inner = wrapped;
            wrapped = () -> circuitBreakerManager.execute(name, inner);
        }
        if (!options.isSkipRetry()) {
            Supplier<CompletableFuture<T>> inner = wrapped;
            wrapped = () -> retryManager.executeWithRetry(inner, current.getRetry());
        }
        if (!options.isSkipQueue()) {
            Supplier<CompletableFuture<T>> inner = wrapped;
            wrapped = () -> requestQueue.enqueue(inner, EnqueueOptions.withPriority(options.getPriority()));
        }
        return FutureUtil.invoke(wrapped);
    }

    private <T> void runFallback(String name, RecoveryOptions<T> options, Throwable cause, CompletableFuture<T> result) {
        fallbacksUsed.incrementAndGet();
        logger.info("{} 执行失败，启用降级: {}", name, cause.toString());
        publish(RecoveryEvent.FALLBACK_TRIGGERED, eventData(name, cause));

        FutureUtil.invoke(options.getFallback()).whenComplete((fallbackValue, fallbackError) -> {
            if (fallbackError != null) {
                Throwable unwrapped = FutureUtil.unwrap(fallbackError);
                logger.warn("{} 降级同样失败: {}", name, unwrapped.toString());
                cause.addSuppressed(unwrapped);
                result.completeExceptionally(cause);
                return;
            }
            recoveredRequests.incrementAndGet();
            publish(RecoveryEvent.RECOVERY_SUCCESSFUL, eventData(name, cause));
            result.complete(fallbackValue);
        });
    }

    private void publishFailure(String name, Throwable cause) {
        if (cause instanceof RetryExhaustedException || cause instanceof RetryTimeoutException) {
            publish(RecoveryEvent.RETRY_EXHAUSTED, eventData(name, cause));
        } else if (cause instanceof QueueOverflowException) {
            publish(RecoveryEvent.QUEUE_OVERFLOW, eventData(name, cause));
        }
    }

    private static Map<String, Object> eventData(String name, Throwable error) {
        Map<String, Object> data = new HashMap<>();
        data.put("operationName", name);
        data.put("error", error);
        return data;
    }

    private void publish(RecoveryEvent event, Map<String, Object> data) {
        eventPublisher.publish(event, data);
    }

    private synchronized void scheduleMonitor() {
        if (monitorTask != null) {
            monitorTask.cancel(false);
            monitorTask = null;
        }
        if (!config.isMonitoringEnabled()) {
            return;
        }
        long interval = config.getMonitoringIntervalMs();
        monitorTask = monitor.scheduleWithFixedDelay(() -> {
            try {
                checkCircuitStates();
            } catch (RuntimeException e) {
                logger.error("熔断状态轮询失败", e);
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
    }

    /**
     * 对比上一次观察到的熔断器状态，每次状态切换只上报一次
     */
    void checkCircuitStates() {
        circuitBreakerManager.getAllStats().forEach((endpoint, stat) -> {
            ObservedState now = new ObservedState(stat.getState(), stat.getStateChanges());
            ObservedState previous = observedStates.put(endpoint, now);
            if (now.equals(previous)) {
                return;
            }
            Map<String, Object> data = new HashMap<>();
            data.put("endpoint", endpoint);
            data.put("stat", stat);
            if (now.getState() == CircuitBreaker.State.OPEN) {
                publish(RecoveryEvent.CIRCUIT_OPENED, data);
            } else if (now.getState() == CircuitBreaker.State.CLOSED && now.getStateChanges() > 0) {
                publish(RecoveryEvent.CIRCUIT_CLOSED, data);
            }
        });
    }

    public ErrorRecoveryStats getStats() {
        long total = totalRequests.get();
        long successful = successfulRequests.get();
        long recovered = recoveredRequests.get();
        double availability = total > 0 ? (successful + recovered) * 100.0 / total : 100.0;
        return ErrorRecoveryStats.builder()
                .totalRequests(total)
                .successfulRequests(successful)
                .failedRequests(failedRequests.get())
                .recoveredRequests(recovered)
                .fallbacksUsed(fallbacksUsed.get())
                .uptime(System.currentTimeMillis() - startTime)
                .availability(availability)
                .circuitBreakers(circuitBreakerManager.getAllStats())
                .retryStats(retryManager.getStats())
                .queueStats(requestQueue.getStats())
                .build();
    }

    public HealthStatus getHealthStatus() {
        ErrorRecoveryStats stats = getStats();
        CircuitBreakerManager.HealthSummary breakerHealth = circuitBreakerManager.getHealthSummary();
        QueueHealth queueHealth = requestQueue.getHealthStatus();

        HealthLevel status = HealthLevel.HEALTHY;
        if (breakerHealth.getOverallAvailability() < 95 || queueHealth.getStatus() == HealthLevel.WARNING) {
            status = HealthLevel.WARNING;
        }
        if (breakerHealth.getOverallAvailability() < 90 || queueHealth.getStatus() == HealthLevel.CRITICAL) {
            status = HealthLevel.CRITICAL;
        }

        List<String> recommendations = new ArrayList<>();
        if (stats.getFailedRequests() > stats.getSuccessfulRequests() * 0.1) {
            recommendations.add("High failure rate detected - check upstream services");
        }
        if (stats.getFallbacksUsed() > stats.getTotalRequests() * 0.2) {
            recommendations.add("Frequent fallback usage - investigate primary service issues");
        }
        recommendations.addAll(queueHealth.getRecommendations());

        Map<String, Object> components = new LinkedHashMap<>();
        components.put("circuitBreakers", breakerHealth);
        components.put("queue", queueHealth);
        components.put("retry", stats.getRetryStats());
        if (limitManager != null) {
            components.put("rateLimit", limitManager.getAnalytics());
        }
        return new HealthStatus(status, components, recommendations);
    }

    public RecoveryReport generateReport() {
        return RecoveryReport.of(getStats(), getHealthStatus());
    }

    /**
     * 清零统计，同时重置所有熔断器和重试统计
     */
    public void resetStats() {
        totalRequests.set(0);
        successfulRequests.set(0);
        failedRequests.set(0);
        recoveredRequests.set(0);
        fallbacksUsed.set(0);
        startTime = System.currentTimeMillis();
        circuitBreakerManager.resetAll();
        retryManager.resetStats();
        observedStates.clear();
        logger.info("错误恢复统计已重置");
    }

    /**
     * 在当前配置的副本上修改并校验，成功后整体替换。
     * 队列配置立即生效，熔断默认配置只影响之后新建的熔断器。
     */
    public synchronized void updateConfig(Consumer<RecoveryConfig> updater) {
        RecoveryConfig previous = config;
        RecoveryConfig updated = previous.copy();
        updater.accept(updated);
        updated.validate();
        requestQueue.updateConfig(updated.getQueue());
        circuitBreakerManager.setDefaultConfig(updated.getCircuitBreaker());
        config = updated;
        if (previous.isMonitoringEnabled() != updated.isMonitoringEnabled()
                || previous.getMonitoringIntervalMs() != updated.getMonitoringIntervalMs()) {
            scheduleMonitor();
        }
        logger.info("错误恢复配置已更新");
    }

    public RecoveryConfig getConfig() {
        return config.copy();
    }

    public void addEventListener(RecoveryEvent event, RecoveryEventListener listener) {
        eventPublisher.register(event, listener);
    }

    public boolean removeEventListener(RecoveryEvent event, RecoveryEventListener listener) {
        return eventPublisher.unregister(event, listener);
    }

    public CircuitBreakerManager getCircuitBreakerManager() {
        return circuitBreakerManager;
    }

    public RequestQueue getRequestQueue() {
        return requestQueue;
    }

    public RetryManager getRetryManager() {
        return retryManager;
    }

    public void shutdown() {
        monitor.shutdownNow();
        requestQueue.shutdown();
        retryManager.shutdown();
        logger.info("错误恢复组件已关闭");
    }

    @Data
    private static final class ObservedState {
        private final CircuitBreaker.State state;
        private final long stateChanges;
    }
}
