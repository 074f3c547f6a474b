package com.example.apirecovery.controller;

import com.example.apirecovery.exception.QueueTimeoutException;
import com.example.apirecovery.exception.RateLimitExceededException;
import com.example.apirecovery.exception.RecoveryException;
import com.example.apirecovery.exception.RetryTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * 把恢复链路的终态异常转换成统一的 JSON 错误响应
 */
@RestControllerAdvice
public class RecoveryErrorHandler {
    private static final Logger logger = LoggerFactory.getLogger(RecoveryErrorHandler.class);

    @ExceptionHandler(RecoveryException.class)
    public ResponseEntity<Map<String, Object>> handleRecoveryException(RecoveryException e) {
        HttpStatus status = statusOf(e);
        logger.warn("恢复链路异常 {} -> {}: {}", e.getClass().getSimpleName(), status.value(), e.getMessage());
        Map<String, Object> errorData = new HashMap<>();
        errorData.put("code", status.value());
        errorData.put("message", e.getMessage());
        errorData.put("timestamp", System.currentTimeMillis());
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
        if (e instanceof RateLimitExceededException) {
            long retryAfterMs = ((RateLimitExceededException) e).getResult().getRetryAfter();
            builder.header("Retry-After", String.valueOf(Math.max(1, (retryAfterMs + 999) / 1000)));
        }
        return builder.body(errorData);
    }

    static HttpStatus statusOf(RecoveryException e) {
        if (e instanceof RateLimitExceededException) {
            return HttpStatus.TOO_MANY_REQUESTS;
        }
        if (e instanceof QueueTimeoutException || e instanceof RetryTimeoutException) {
            return HttpStatus.GATEWAY_TIMEOUT;
        }
        // 熔断打开、队列溢出、重试耗尽
        return HttpStatus.SERVICE_UNAVAILABLE;
    }
}
