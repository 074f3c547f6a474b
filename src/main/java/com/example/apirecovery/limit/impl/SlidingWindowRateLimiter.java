package com.example.apirecovery.limit.impl;

import com.example.apirecovery.limit.RateLimitResult;
import com.example.apirecovery.limit.RateLimiter;
import com.example.apirecovery.limit.SlidingWindowCounter;

public class SlidingWindowRateLimiter implements RateLimiter {
    private static final int SLICE_COUNT = 10;
    private final SlidingWindowCounter counter;
    private final int maxRequests;

    public SlidingWindowRateLimiter(int maxRequests, long windowMs) {
        this.counter = new SlidingWindowCounter(Math.max(windowMs, SLICE_COUNT), SLICE_COUNT);
        this.maxRequests = maxRequests;
    }

    @Override
    public RateLimitResult tryAcquire() {
        boolean allowed = counter.allowRequest(maxRequests);
        long now = System.currentTimeMillis();
        long resetTime = counter.nextReleaseTime();
        return new RateLimitResult(
                allowed,
                Math.max(0, maxRequests - counter.count()),
                maxRequests,
                resetTime,
                allowed ? 0 : Math.max(0, resetTime - now)
        );
    }
}
