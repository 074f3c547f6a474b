package com.example.apirecovery.limit.SPIFactory.impl;

import com.example.apirecovery.limit.RateLimiter;
import com.example.apirecovery.limit.SPIFactory.SPIRateLimiterFactory;
import com.example.apirecovery.limit.impl.FixedWindowRateLimiter;

public class FixedWindowRateLimiterFactory implements SPIRateLimiterFactory {
    @Override
    public RateLimiter create(int maxRequests, long windowMs) {
        return new FixedWindowRateLimiter(maxRequests, windowMs);
    }

    @Override
    public String getType() {
        return "FixedWindow";
    }
}
