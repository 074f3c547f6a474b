package com.example.apirecovery.exception;

import com.example.apirecovery.limit.RateLimitResult;
import lombok.Getter;

@Getter
public class RateLimitExceededException extends RecoveryException {
    private final String endpoint;
    private final RateLimitResult result;

    public RateLimitExceededException(String endpoint, RateLimitResult result) {
        super("Rate limit exceeded for '" + endpoint + "', retry after " + result.getRetryAfter() + "ms");
        this.endpoint = endpoint;
        this.result = result;
    }
}
