package com.example.apirecovery.exception;

import com.example.apirecovery.retry.RetryAttempt;
import lombok.Getter;

import java.util.List;

/**
 * 所有重试次数耗尽，cause 为最后一次失败。
 */
@Getter
public class RetryExhaustedException extends RecoveryException {
    private final List<RetryAttempt> attempts;
    private final long totalTime;

    public RetryExhaustedException(Throwable lastError, List<RetryAttempt> attempts) {
        super("Operation failed after " + attempts.size() + " attempts. Last error: " + lastError.getMessage(), lastError);
        this.attempts = List.copyOf(attempts);
        this.totalTime = attempts.isEmpty() ? 0 : attempts.get(attempts.size() - 1).getElapsedMs();
    }
}
