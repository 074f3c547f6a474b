package com.example.apirecovery.circuitBreaker;

import com.example.apirecovery.config.CircuitBreakerConfig;
import com.example.apirecovery.exception.CircuitOpenException;
import com.example.apirecovery.utils.FutureUtil;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 单个端点的熔断器。
 * <p>
 * 准入判断和状态切换都在同一把锁内完成，被保护的操作在锁外执行。
 * 每次状态切换都会递增版本号，旧版本准入的请求完成时只计数，不再驱动新版本的状态切换。
 */
public class CircuitBreaker {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED, OPEN, HALF_OPEN
    }

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private State state = State.CLOSED;
    private int stamp;
    // 闭合状态下滚动窗口内的失败时间戳
    private final Deque<Long> failureTimes = new ArrayDeque<>();
    private int successCount;
    private int halfOpenCalls;
    private long totalCalls;
    private long totalFailures;
    private long rejectedCalls;
    private long stateChanges;
    private long lastFailureTime;
    private long lastSuccessTime;
    private long lastStateChangeTime;
    private long createdAt;

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        config.validate();
        this.name = name;
        this.config = config.copy();
        this.clock = clock;
        this.createdAt = clock.millis();
        this.lastStateChangeTime = createdAt;
    }

    /**
     * 在熔断保护下执行操作。熔断打开时返回以 {@link CircuitOpenException} 失败的 future，操作不会被调用。
     */
    public <T> CompletableFuture<T> execute(Supplier<CompletableFuture<T>> operation) {
        int admitted;
        lock.lock();
        try {
            admitted = tryAcquirePermission();
            if (admitted < 0) {
                rejectedCalls++;
                return CompletableFuture.failedFuture(new CircuitOpenException(name, state));
            }
            totalCalls++;
        } finally {
            lock.unlock();
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        FutureUtil.invoke(operation).whenComplete((value, error) -> {
            if (error == null) {
                recordSuccess(admitted);
                result.complete(value);
            } else {
                recordFailure(admitted);
                result.completeExceptionally(FutureUtil.unwrap(error));
            }
        });
        return result;
    }

    // 返回准入时的版本号，拒绝时返回 -1
    private int tryAcquirePermission() {
        long now = clock.millis();
        if (state == State.HALF_OPEN && halfOpenCalls >= config.getHalfOpenMaxCalls()
                && now - lastStateChangeTime >= config.getRecoveryTimeout()) {
            // 试探请求超过恢复时间仍未完成，按失败处理，迟到的完成因版本号变化被忽略
            logger.warn("熔断器 {} 半开试探请求 {}ms 内未完成，重新打开", name, config.getRecoveryTimeout());
            transitionTo(State.OPEN, lastStateChangeTime + config.getRecoveryTimeout());
        }
        if (state == State.OPEN) {
            if (now - lastStateChangeTime < config.getRecoveryTimeout()) {
                return -1;
            }
            transitionTo(State.HALF_OPEN, now);
        }
        if (state == State.HALF_OPEN) {
            if (halfOpenCalls >= config.getHalfOpenMaxCalls()) {
                return -1;
            }
            halfOpenCalls++;
        }
        return stamp;
    }

    /**
     * 记录成功请求
     */
    private void recordSuccess(int admitted) {
        lock.lock();
        try {
            long now = clock.millis();
            lastSuccessTime = now;
            if (admitted != stamp || state != State.HALF_OPEN) {
                return;
            }
            halfOpenCalls--;
            successCount++;
            if (successCount >= config.getSuccessThreshold()) {
                transitionTo(State.CLOSED, now);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 记录失败请求
     */
    private void recordFailure(int admitted) {
        lock.lock();
        try {
            long now = clock.millis();
            totalFailures++;
            lastFailureTime = now;
            if (admitted != stamp) {
                return;
            }
            failureTimes.addLast(now);
            if (state == State.HALF_OPEN) {
                transitionTo(State.OPEN, now);
                return;
            }
            if (state == State.CLOSED) {
                pruneFailures(now);
                if (failureTimes.size() >= config.getFailureThreshold()) {
                    transitionTo(State.OPEN, now);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private void pruneFailures(long now) {
        long windowStart = now - config.getMonitoringPeriod();
        while (!failureTimes.isEmpty() && failureTimes.peekFirst() <= windowStart) {
            failureTimes.pollFirst();
        }
    }

    private void transitionTo(State next, long now) {
        State previous = state;
        state = next;
        stamp++;
        stateChanges++;
        lastStateChangeTime = now;
        successCount = 0;
        halfOpenCalls = 0;
        if (next == State.CLOSED) {
            failureTimes.clear();
        }
        if (next == State.OPEN) {
            logger.warn("熔断器 {} 状态切换 {} -> {}，窗口内失败 {} 次", name, previous, next, failureTimes.size());
        } else {
            logger.info("熔断器 {} 状态切换 {} -> {}", name, previous, next);
        }
    }

    /**
     * 强制切换状态，供运维和测试使用
     */
    public void forceState(State next) {
        lock.lock();
        try {
            transitionTo(next, clock.millis());
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        lock.lock();
        try {
            long now = clock.millis();
            state = State.CLOSED;
            stamp++;
            failureTimes.clear();
            successCount = 0;
            halfOpenCalls = 0;
            totalCalls = 0;
            totalFailures = 0;
            rejectedCalls = 0;
            stateChanges = 0;
            lastFailureTime = 0;
            lastSuccessTime = 0;
            lastStateChangeTime = now;
            createdAt = now;
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public State getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerConfig getConfig() {
        return config.copy();
    }

    /**
     * 监控数据获取方法
     */
    public CircuitBreakerMetrics getMetrics() {
        lock.lock();
        try {
            long now = clock.millis();
            if (state == State.CLOSED) {
                pruneFailures(now);
            }
            double availability = totalCalls > 0 ? (totalCalls - totalFailures) * 100.0 / totalCalls : 100.0;
            return new CircuitBreakerMetrics(
                    name,
                    state,
                    failureTimes.size(),
                    successCount,
                    totalCalls,
                    totalFailures,
                    rejectedCalls,
                    stateChanges,
                    lastFailureTime,
                    lastSuccessTime,
                    now - createdAt,
                    availability
            );
        } finally {
            lock.unlock();
        }
    }

    @Data
    public static class CircuitBreakerMetrics {
        private final String name;
        private final State state;
        private final int failureCount;
        private final int successCount;
        private final long totalCalls;
        private final long totalFailures;
        private final long rejectedCalls;
        private final long stateChanges;
        private final long lastFailureTime;
        private final long lastSuccessTime;
        private final long uptime;
        private final double availability;
    }
}
