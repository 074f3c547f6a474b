package com.example.apirecovery.limit;

public interface RateLimiter {
    /**
     * 尝试占用一个配额，返回本次判定结果
     */
    RateLimitResult tryAcquire();
}
