package com.example.apirecovery.queue;

import cn.hutool.core.thread.NamedThreadFactory;
import cn.hutool.core.util.IdUtil;
import com.example.apirecovery.config.QueueConfig;
import com.example.apirecovery.exception.QueueOverflowException;
import com.example.apirecovery.exception.QueueTimeoutException;
import com.example.apirecovery.limit.SlidingWindowCounter;
import com.example.apirecovery.limit.TokenBucket;
import com.example.apirecovery.model.HealthLevel;
import com.example.apirecovery.utils.FutureUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 有界优先级请求队列。
 * <p>
 * 待执行集合和 active 计数由同一把锁保护；单个调度线程按优先级（同级 FIFO）出队，
 * 受 maxConcurrent 和令牌桶双重约束，出队后交给工作线程池执行。
 * 等待中的请求只会因截止时间到期被拒绝，已开始执行的操作不会被强制取消。
 */
public class RequestQueue {
    private static final Logger logger = LoggerFactory.getLogger(RequestQueue.class);
    private static final long IDLE_WAIT_MS = 50;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private volatile QueueConfig config;
    private PriorityQueue<QueuedRequest<?>> pending;
    private int active;
    private boolean paused;
    private long sequence;
    private long nextWaitMs = IDLE_WAIT_MS;
    // 全局出队速率，null 表示不限速
    private TokenBucket throughputLimiter;
    private volatile boolean running = true;

    private final LongAdder completedRequests = new LongAdder();
    private final LongAdder failedRequests = new LongAdder();
    private final LongAdder rejectedRequests = new LongAdder();
    private final LongAdder timedOutRequests = new LongAdder();
    private final LongAdder dispatchedRequests = new LongAdder();
    private final LongAdder totalWaitTime = new LongAdder();
    private final LongAdder totalProcessTime = new LongAdder();
    // 最近 1 秒完成数，用于吞吐统计
    private final SlidingWindowCounter recentCompletions = new SlidingWindowCounter(1000, 10);

    private final ExecutorService workerPool;
    private final ScheduledExecutorService retryScheduler;
    private final Thread dispatcher;

    public RequestQueue(QueueConfig config) {
        config.validate();
        this.config = config.copy();
        this.pending = new PriorityQueue<>(comparator(this.config.isPriorityEnabled()));
        this.throughputLimiter = createLimiter(this.config.getRateLimitPerSecond());
        this.workerPool = Executors.newCachedThreadPool(new NamedThreadFactory("recovery-queue-worker-", true));
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("recovery-queue-retry-", true));
        this.dispatcher = new NamedThreadFactory("recovery-queue-dispatcher-", true).newThread(this::dispatchLoop);
        this.dispatcher.start();
    }

    private static Comparator<QueuedRequest<?>> comparator(boolean priorityEnabled) {
        Comparator<QueuedRequest<?>> fifo = Comparator.comparingLong(QueuedRequest::getSequence);
        if (!priorityEnabled) {
            return fifo;
        }
        Comparator<QueuedRequest<?>> byPriority = Comparator.comparing(r -> r.getPriority().ordinal());
        return byPriority.reversed().thenComparing(fifo);
    }

    private static TokenBucket createLimiter(int rateLimitPerSecond) {
        return rateLimitPerSecond > 0 ? new TokenBucket(rateLimitPerSecond, (long) rateLimitPerSecond) : null;
    }

    public <T> CompletableFuture<T> enqueue(Supplier<CompletableFuture<T>> operation) {
        return enqueue(operation, EnqueueOptions.defaults());
    }

    /**
     * 入队。队列已满时立即以 {@link QueueOverflowException} 失败；达到背压阈值时，
     * 若存在优先级更低的等待请求则挤出其中最老的一个，否则拒绝新请求。
     */
    public <T> CompletableFuture<T> enqueue(Supplier<CompletableFuture<T>> operation, EnqueueOptions options) {
        CompletableFuture<T> result = new CompletableFuture<>();
        RuntimeException rejection = null;
        QueuedRequest<?> shed = null;
        QueueConfig cfg = config;
        RequestPriority priority = options.getPriority() != null ? options.getPriority() : RequestPriority.NORMAL;

        lock.lock();
        try {
            if (!running) {
                rejection = new RejectedExecutionException("Request queue is shut down");
            } else if (pending.size() >= cfg.getMaxSize()) {
                rejectedRequests.increment();
                rejection = new QueueOverflowException("Queue is full (" + cfg.getMaxSize() + " items)", cfg.getMaxSize(), false);
            } else {
                if (pending.size() >= cfg.getBackpressureThreshold()) {
                    QueuedRequest<?> victim = findShedCandidate();
                    if (victim == null || victim.getPriority().ordinal() >= priority.ordinal()) {
                        rejectedRequests.increment();
                        rejection = new QueueOverflowException("Queue backpressure active - too many pending requests",
                                cfg.getMaxSize(), false);
                    } else {
                        pending.remove(victim);
                        rejectedRequests.increment();
                        shed = victim;
                    }
                }
                if (rejection == null) {
                    long now = System.currentTimeMillis();
                    long timeout = options.getTimeout() > 0 ? options.getTimeout() : cfg.getTimeout();
                    pending.add(new QueuedRequest<>(IdUtil.fastSimpleUUID(), operation, priority, now, ++sequence,
                            timeout, options.getMaxRetries(), options.getMetadata(), result));
                    changed.signalAll();
                }
            }
        } finally {
            lock.unlock();
        }

        if (shed != null) {
            logger.warn("背压生效，挤出低优先级请求 {} priority={}", shed.getId(), shed.getPriority());
            shed.getResult().completeExceptionally(new QueueOverflowException(
                    "Request " + shed.getId() + " shed by backpressure", cfg.getMaxSize(), true));
        }
        if (rejection != null) {
            logger.warn("请求入队被拒绝: {}", rejection.getMessage());
            return CompletableFuture.failedFuture(rejection);
        }
        return result;
    }

    // 最低优先级中最早入队的一个
    private QueuedRequest<?> findShedCandidate() {
        QueuedRequest<?> candidate = null;
        for (QueuedRequest<?> request : pending) {
            if (candidate == null
                    || request.getPriority().ordinal() < candidate.getPriority().ordinal()
                    || (request.getPriority() == candidate.getPriority() && request.getSequence() < candidate.getSequence())) {
                candidate = request;
            }
        }
        return candidate;
    }

    private void dispatchLoop() {
        while (running) {
            List<QueuedRequest<?>> expired = new ArrayList<>();
            QueuedRequest<?> next;
            lock.lock();
            try {
                next = pollNext(expired);
                if (next == null && expired.isEmpty()) {
                    changed.await(nextWaitMs, TimeUnit.MILLISECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } finally {
                lock.unlock();
            }
            expired.forEach(this::expire);
            if (next != null) {
                start(next);
            }
        }
    }

    // 持锁调用
    private QueuedRequest<?> pollNext(List<QueuedRequest<?>> expired) {
        nextWaitMs = IDLE_WAIT_MS;
        long now = System.currentTimeMillis();
        if (paused) {
            sweepExpired(now, expired);
            return null;
        }
        while (!pending.isEmpty() && pending.peek().isExpired(now)) {
            expired.add(pending.poll());
        }
        if (pending.isEmpty()) {
            return null;
        }
        if (active >= config.getMaxConcurrent()) {
            sweepExpired(now, expired);
            return null;
        }
        if (throughputLimiter != null && !throughputLimiter.tryAcquire(1)) {
            sweepExpired(now, expired);
            nextWaitMs = Math.max(1, throughputLimiter.millisUntilAvailable());
            return null;
        }
        active++;
        return pending.poll();
    }

    private void sweepExpired(long now, List<QueuedRequest<?>> expired) {
        pending.removeIf(request -> {
            if (request.isExpired(now)) {
                expired.add(request);
                return true;
            }
            return false;
        });
    }

    private void expire(QueuedRequest<?> request) {
        long waited = System.currentTimeMillis() - request.getEnqueueTime();
        timedOutRequests.increment();
        logger.warn("请求 {} 在队列中等待 {}ms 超时", request.getId(), waited);
        request.getResult().completeExceptionally(new QueueTimeoutException(request.getId(), waited));
    }

    private <T> void start(QueuedRequest<T> request) {
        long startTime = System.currentTimeMillis();
        dispatchedRequests.increment();
        totalWaitTime.add(startTime - request.getEnqueueTime());
        try {
            workerPool.execute(() -> FutureUtil.invoke(request.getOperation())
                    .whenComplete((value, error) -> finish(request, startTime, value, error)));
        } catch (RejectedExecutionException e) {
            finish(request, startTime, null, e);
        }
    }

    private <T> void finish(QueuedRequest<T> request, long startTime, T value, Throwable error) {
        lock.lock();
        try {
            active--;
            changed.signalAll();
        } finally {
            lock.unlock();
        }

        if (error == null) {
            totalProcessTime.add(System.currentTimeMillis() - startTime);
            completedRequests.increment();
            recentCompletions.record();
            request.getResult().complete(value);
            return;
        }

        Throwable cause = FutureUtil.unwrap(error);
        if (running && config.isRetryFailedRequests() && request.getRetryCount() < request.getMaxRetries()) {
            long backoff = (long) Math.pow(2, request.getRetryCount() + 1) * 1000;
            logger.info("请求 {} 执行失败，{}ms 后重新入队（第 {} 次）", request.getId(), backoff, request.getRetryCount() + 1);
            try {
                retryScheduler.schedule(() -> requeue(request), backoff, TimeUnit.MILLISECONDS);
                return;
            } catch (RejectedExecutionException e) {
                logger.debug("重新入队调度被拒绝 {}", request.getId());
            }
        }
        failedRequests.increment();
        request.getResult().completeExceptionally(cause);
    }

    private void requeue(QueuedRequest<?> request) {
        lock.lock();
        try {
            if (running) {
                request.prepareRequeue(System.currentTimeMillis());
                pending.add(request);
                changed.signalAll();
                return;
            }
        } finally {
            lock.unlock();
        }
        failedRequests.increment();
        request.getResult().completeExceptionally(new CancellationException("Request queue is shut down"));
    }

    public QueueStats getStats() {
        int queueSize;
        int activeRequests;
        Map<RequestPriority, Integer> distribution = new EnumMap<>(RequestPriority.class);
        for (RequestPriority priority : RequestPriority.values()) {
            distribution.put(priority, 0);
        }
        lock.lock();
        try {
            queueSize = pending.size();
            activeRequests = active;
            for (QueuedRequest<?> request : pending) {
                distribution.merge(request.getPriority(), 1, Integer::sum);
            }
        } finally {
            lock.unlock();
        }
        long dispatched = dispatchedRequests.sum();
        long completed = completedRequests.sum();
        return QueueStats.builder()
                .queueSize(queueSize)
                .activeRequests(activeRequests)
                .completedRequests(completed)
                .failedRequests(failedRequests.sum())
                .rejectedRequests(rejectedRequests.sum())
                .timedOutRequests(timedOutRequests.sum())
                .averageWaitTime(dispatched > 0 ? (double) totalWaitTime.sum() / dispatched : 0)
                .averageProcessTime(completed > 0 ? (double) totalProcessTime.sum() / completed : 0)
                .throughputPerSecond(recentCompletions.count())
                .backpressureActive(queueSize >= config.getBackpressureThreshold())
                .priorityDistribution(distribution)
                .build();
    }

    public QueueHealth getHealthStatus() {
        QueueStats stats = getStats();
        QueueConfig cfg = config;
        List<String> issues = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        HealthLevel status = HealthLevel.HEALTHY;

        if (stats.getQueueSize() > cfg.getMaxSize() * 0.8) {
            status = status.worst(HealthLevel.WARNING);
            issues.add("Queue is near capacity");
            recommendations.add("Consider increasing maxSize or reducing request rate");
        }
        if (stats.isBackpressureActive()) {
            status = HealthLevel.CRITICAL;
            issues.add("Backpressure is active");
            recommendations.add("Reduce request rate or increase processing capacity");
        }
        long failures = stats.getFailedRequests() + stats.getTimedOutRequests();
        long finished = stats.getCompletedRequests() + failures;
        if (finished > 0) {
            double failureRate = (double) failures / finished;
            if (failureRate > 0.1) {
                status = status.worst(failureRate > 0.25 ? HealthLevel.CRITICAL : HealthLevel.WARNING);
                issues.add(String.format("High failure rate: %.1f%%", failureRate * 100));
                recommendations.add("Check error handling and retry configuration");
            }
        }
        if (stats.getAverageWaitTime() > cfg.getTimeout() * 0.5) {
            status = status.worst(HealthLevel.WARNING);
            issues.add("High average wait time");
            recommendations.add("Increase concurrent processing or reduce request rate");
        }
        return new QueueHealth(status, issues, recommendations);
    }

    public void pause() {
        lock.lock();
        try {
            paused = true;
        } finally {
            lock.unlock();
        }
    }

    public void resume() {
        lock.lock();
        try {
            paused = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 清空等待中的请求，对应的 future 以 {@link CancellationException} 结束
     */
    public int clearQueue() {
        List<QueuedRequest<?>> drained;
        lock.lock();
        try {
            drained = new ArrayList<>(pending);
            pending.clear();
        } finally {
            lock.unlock();
        }
        drained.forEach(request -> request.getResult().completeExceptionally(new CancellationException("Queue cleared")));
        return drained.size();
    }

    public void updateConfig(QueueConfig newConfig) {
        newConfig.validate();
        lock.lock();
        try {
            QueueConfig previous = config;
            config = newConfig.copy();
            if (previous.isPriorityEnabled() != config.isPriorityEnabled()) {
                PriorityQueue<QueuedRequest<?>> rebuilt = new PriorityQueue<>(comparator(config.isPriorityEnabled()));
                rebuilt.addAll(pending);
                pending = rebuilt;
            }
            if (previous.getRateLimitPerSecond() != config.getRateLimitPerSecond()) {
                throughputLimiter = createLimiter(config.getRateLimitPerSecond());
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        logger.info("队列配置已更新 {}", config);
    }

    public QueueConfig getConfig() {
        return config.copy();
    }

    public void shutdown() {
        running = false;
        dispatcher.interrupt();
        int cleared = clearQueue();
        workerPool.shutdown();
        retryScheduler.shutdownNow();
        logger.info("请求队列已关闭，丢弃 {} 个等待中的请求", cleared);
    }
}
