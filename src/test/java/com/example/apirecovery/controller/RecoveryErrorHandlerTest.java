package com.example.apirecovery.controller;

import com.example.apirecovery.circuitBreaker.CircuitBreaker;
import com.example.apirecovery.exception.CircuitOpenException;
import com.example.apirecovery.exception.QueueTimeoutException;
import com.example.apirecovery.exception.RateLimitExceededException;
import com.example.apirecovery.exception.RetryExhaustedException;
import com.example.apirecovery.limit.RateLimitResult;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecoveryErrorHandlerTest {
    private final RecoveryErrorHandler handler = new RecoveryErrorHandler();

    @Test
    void shouldMapCircuitOpenToServiceUnavailable() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleRecoveryException(new CircuitOpenException("users", CircuitBreaker.State.OPEN));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals(503, response.getBody().get("code"));
        assertEquals("Circuit breaker 'users' is OPEN. Request blocked.", response.getBody().get("message"));
        assertNotNull(response.getBody().get("timestamp"));
    }

    @Test
    void shouldMapRateLimitToTooManyRequestsWithRetryAfter() {
        RateLimitResult result = new RateLimitResult(false, 0, 10, System.currentTimeMillis() + 1500, 1500);

        ResponseEntity<Map<String, Object>> response =
                handler.handleRecoveryException(new RateLimitExceededException("users", result));

        assertEquals(HttpStatus.TOO_MANY_REQUESTS, response.getStatusCode());
        assertEquals("2", response.getHeaders().getFirst("Retry-After"));
    }

    @Test
    void shouldMapTimeoutsAndExhaustion() {
        assertEquals(HttpStatus.GATEWAY_TIMEOUT,
                handler.handleRecoveryException(new QueueTimeoutException("r-1", 61_000)).getStatusCode());
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE,
                handler.handleRecoveryException(new RetryExhaustedException(new RuntimeException("503"), List.of()))
                        .getStatusCode());
    }
}
