package com.example.apirecovery.limit.impl;

import com.example.apirecovery.limit.FixedWindowCounter;
import com.example.apirecovery.limit.RateLimitResult;
import com.example.apirecovery.limit.RateLimiter;

public class FixedWindowRateLimiter implements RateLimiter {
    private final FixedWindowCounter counter;
    private final int maxRequests;

    public FixedWindowRateLimiter(int maxRequests, long windowMs) {
        this.counter = new FixedWindowCounter(windowMs);
        this.maxRequests = maxRequests;
    }

    @Override
    public RateLimitResult tryAcquire() {
        boolean allowed = counter.allowRequest(maxRequests);
        long now = System.currentTimeMillis();
        long resetTime = counter.getResetTime();
        return new RateLimitResult(
                allowed,
                Math.max(0, maxRequests - counter.count()),
                maxRequests,
                resetTime,
                allowed ? 0 : Math.max(0, resetTime - now)
        );
    }
}
