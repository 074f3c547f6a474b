package com.example.apirecovery.exception;

import com.example.apirecovery.circuitBreaker.CircuitBreaker;
import lombok.Getter;

/**
 * 熔断器拒绝请求，操作未被调用。
 */
@Getter
public class CircuitOpenException extends RecoveryException {
    private final String breakerName;
    private final CircuitBreaker.State state;

    public CircuitOpenException(String breakerName, CircuitBreaker.State state) {
        super("Circuit breaker '" + breakerName + "' is " + state + ". Request blocked.");
        this.breakerName = breakerName;
        this.state = state;
    }
}
