package com.example.apirecovery.limit;

import com.example.apirecovery.config.LimitConfig;
import com.example.apirecovery.exception.RateLimitExceededException;
import com.example.apirecovery.limit.SPIFactory.SPIRateLimiterFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.ServiceLoader;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * 可选的限流关卡：全局一个限流器，配置了单独限额的端点各自再有一个。
 */
@Component
public class LimitManager {
    private static final Logger logger = LoggerFactory.getLogger(LimitManager.class);

    private final LimitConfig limitConfig;
    private final SPIRateLimiterFactory factory;
    // 全局限流体系
    private volatile RateLimiter globalLimiter;
    // 端点限流体系
    private final ConcurrentHashMap<String, RateLimiter> endpointLimiterMap = new ConcurrentHashMap<>();

    private final LongAdder totalRequests = new LongAdder();
    private final LongAdder blockedRequests = new LongAdder();
    private final ConcurrentHashMap<String, LongAdder[]> endpointCounters = new ConcurrentHashMap<>();

    public LimitManager(LimitConfig limitConfig) {
        if (limitConfig.getMaxRequests() < 1 || limitConfig.getWindowMs() <= 0) {
            throw new IllegalArgumentException("limit.maxRequests must be >= 1 and limit.windowMs > 0");
        }
        this.limitConfig = limitConfig;
        this.factory = loadFactory(limitConfig.getStrategy());
        this.globalLimiter = factory.create(limitConfig.getMaxRequests(), limitConfig.getWindowMs());
        logger.info("限流策略 {} 已加载 maxRequests={} windowMs={}", factory.getType(), limitConfig.getMaxRequests(), limitConfig.getWindowMs());
    }

    // 使用 ServiceLoader 加载 SPI 实现类，按类型名匹配
    private static SPIRateLimiterFactory loadFactory(String type) {
        ServiceLoader<SPIRateLimiterFactory> loader = ServiceLoader.load(SPIRateLimiterFactory.class);
        for (SPIRateLimiterFactory candidate : loader) {
            if (candidate.getType().equalsIgnoreCase(type)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown rate limiting strategy: " + type);
    }

    public boolean isEnabled() {
        return limitConfig.isEnabled();
    }

    public RateLimitResult checkLimit(String endpoint) {
        totalRequests.increment();
        LongAdder[] counters = endpointCounters.computeIfAbsent(endpoint, k -> new LongAdder[]{new LongAdder(), new LongAdder()});
        counters[0].increment();

        if (limitConfig.getSkipEndpoints().contains(endpoint)) {
            long now = System.currentTimeMillis();
            return new RateLimitResult(true, limitConfig.getMaxRequests(), limitConfig.getMaxRequests(),
                    now + limitConfig.getWindowMs(), 0);
        }

        RateLimitResult result = globalLimiter.tryAcquire();
        if (result.isAllowed()) {
            LimitConfig.EndpointLimit endpointLimit = limitConfig.getEndpointLimits().get(endpoint);
            if (endpointLimit != null) {
                RateLimiter limiter = endpointLimiterMap.computeIfAbsent(endpoint,
                        k -> factory.create(endpointLimit.getMaxRequests(), endpointLimit.getWindowMs()));
                result = limiter.tryAcquire();
            }
        }
        if (!result.isAllowed()) {
            blockedRequests.increment();
            counters[1].increment();
            logger.info("端点 {} 被限流，{}ms 后可重试", endpoint, result.getRetryAfter());
        }
        return result;
    }

    /**
     * 被限流时抛出 {@link RateLimitExceededException}
     */
    public void acquire(String endpoint) {
        RateLimitResult result = checkLimit(endpoint);
        if (!result.isAllowed()) {
            throw new RateLimitExceededException(endpoint, result);
        }
    }

    public RateLimitAnalytics getAnalytics() {
        Map<String, RateLimitAnalytics.EndpointStats> stats = new TreeMap<>();
        endpointCounters.forEach((endpoint, counters) ->
                stats.put(endpoint, new RateLimitAnalytics.EndpointStats(counters[0].sum(), counters[1].sum())));
        return new RateLimitAnalytics(totalRequests.sum(), blockedRequests.sum(), stats);
    }

    public void reset() {
        globalLimiter = factory.create(limitConfig.getMaxRequests(), limitConfig.getWindowMs());
        endpointLimiterMap.clear();
        endpointCounters.clear();
        totalRequests.reset();
        blockedRequests.reset();
    }
}
