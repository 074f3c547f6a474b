package com.example.apirecovery.limit.SPIFactory.impl;

import com.example.apirecovery.limit.RateLimiter;
import com.example.apirecovery.limit.SPIFactory.SPIRateLimiterFactory;
import com.example.apirecovery.limit.impl.SlidingWindowRateLimiter;

public class SlidingWindowRateLimiterFactory implements SPIRateLimiterFactory {
    @Override
    public RateLimiter create(int maxRequests, long windowMs) {
        return new SlidingWindowRateLimiter(maxRequests, windowMs);
    }

    @Override
    public String getType() {
        return "SlidingWindow";
    }
}
