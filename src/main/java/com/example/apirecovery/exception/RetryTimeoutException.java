package com.example.apirecovery.exception;

import com.example.apirecovery.retry.RetryAttempt;
import lombok.Getter;

import java.util.List;

/**
 * 下一次退避会超出总超时，放弃剩余的重试。
 */
@Getter
public class RetryTimeoutException extends RecoveryException {
    private final List<RetryAttempt> attempts;
    private final long timeout;

    public RetryTimeoutException(List<RetryAttempt> attempts, long timeout, Throwable lastError) {
        super("Retry operation timed out after " + timeout + "ms", lastError);
        this.attempts = List.copyOf(attempts);
        this.timeout = timeout;
    }
}
