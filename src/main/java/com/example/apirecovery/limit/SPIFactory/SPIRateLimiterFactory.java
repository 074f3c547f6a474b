package com.example.apirecovery.limit.SPIFactory;

import com.example.apirecovery.limit.RateLimiter;

//通过工厂模式去隔离因为SPI机制导致的单例
public interface SPIRateLimiterFactory {
    RateLimiter create(int maxRequests, long windowMs);

    String getType();
}
