package com.example.apirecovery.limit.impl;

import com.example.apirecovery.limit.RateLimitResult;
import com.example.apirecovery.limit.RateLimiter;
import com.example.apirecovery.limit.TokenBucket;

// 令牌桶：桶容量为 maxRequests，每个窗口补满一次
public class TokenBucketRateLimiter implements RateLimiter {
    private final TokenBucket bucket;
    private final long windowMs;

    public TokenBucketRateLimiter(int maxRequests, long windowMs) {
        this.bucket = new TokenBucket(maxRequests, (double) maxRequests / windowMs);
        this.windowMs = windowMs;
    }

    @Override
    public RateLimitResult tryAcquire() {
        boolean allowed = bucket.tryAcquire(1);
        long now = System.currentTimeMillis();
        return new RateLimitResult(
                allowed,
                (long) Math.floor(bucket.availableTokens()),
                bucket.getCapacity(),
                now + windowMs,
                allowed ? 0 : bucket.millisUntilAvailable()
        );
    }
}
