package com.example.apirecovery.circuitBreaker;

import com.example.apirecovery.config.CircuitBreakerConfig;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 按名称管理熔断器，首次使用时创建，进程内一直存活。
 */
public class CircuitBreakerManager {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreakerManager.class);
    // 熔断器存储
    private final ConcurrentHashMap<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();
    private final Clock clock;
    private volatile CircuitBreakerConfig defaultConfig;

    public CircuitBreakerManager(CircuitBreakerConfig defaultConfig) {
        this(defaultConfig, Clock.systemUTC());
    }

    public CircuitBreakerManager(CircuitBreakerConfig defaultConfig, Clock clock) {
        defaultConfig.validate();
        this.defaultConfig = defaultConfig.copy();
        this.clock = clock;
    }

    public CircuitBreaker getBreaker(String name) {
        return getBreaker(name, null);
    }

    /**
     * 获取或创建熔断器，override 只在首次创建时生效
     */
    public CircuitBreaker getBreaker(String name, CircuitBreakerConfig override) {
        return circuitBreakers.computeIfAbsent(name, k -> {
            CircuitBreakerConfig config = override != null ? override : defaultConfig;
            logger.info("创建熔断器 {} config={}", k, config);
            return new CircuitBreaker(k, config, clock);
        });
    }

    public <T> CompletableFuture<T> execute(String name, Supplier<CompletableFuture<T>> operation) {
        return getBreaker(name).execute(operation);
    }

    public <T> CompletableFuture<T> execute(String name, Supplier<CompletableFuture<T>> operation,
                                            CircuitBreakerConfig override) {
        return getBreaker(name, override).execute(operation);
    }

    public Map<String, CircuitBreaker.CircuitBreakerMetrics> getAllStats() {
        Map<String, CircuitBreaker.CircuitBreakerMetrics> stats = new TreeMap<>();
        circuitBreakers.forEach((name, breaker) -> stats.put(name, breaker.getMetrics()));
        return stats;
    }

    public HealthSummary getHealthSummary() {
        Map<String, CircuitBreaker.CircuitBreakerMetrics> stats = getAllStats();
        int total = stats.size();
        int healthy = (int) stats.values().stream()
                .filter(m -> m.getState() == CircuitBreaker.State.CLOSED)
                .count();
        double overallAvailability = stats.values().stream()
                .mapToDouble(CircuitBreaker.CircuitBreakerMetrics::getAvailability)
                .average()
                .orElse(100.0);
        return new HealthSummary(total, healthy, total - healthy, overallAvailability);
    }

    public boolean reset(String name) {
        CircuitBreaker breaker = circuitBreakers.get(name);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        logger.info("熔断器 {} 已重置", name);
        return true;
    }

    public void resetAll() {
        circuitBreakers.values().forEach(CircuitBreaker::reset);
    }

    public boolean removeBreaker(String name) {
        return circuitBreakers.remove(name) != null;
    }

    public CircuitBreakerConfig getDefaultConfig() {
        return defaultConfig.copy();
    }

    // 只影响之后新建的熔断器
    public void setDefaultConfig(CircuitBreakerConfig config) {
        config.validate();
        this.defaultConfig = config.copy();
    }

    @Data
    public static class HealthSummary {
        private final int totalEndpoints;
        private final int healthyEndpoints;
        private final int unhealthyEndpoints;
        private final double overallAvailability;
    }
}
