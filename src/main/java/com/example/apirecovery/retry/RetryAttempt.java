package com.example.apirecovery.retry;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 一次失败尝试的记录，delayMs 为该次失败后安排的退避时长（最后一次为 0）。
 */
@Getter
@ToString
@AllArgsConstructor
public class RetryAttempt {
    private final int attemptNumber;
    private final long delayMs;
    private final long elapsedMs;
    private final Throwable error;
    private final long timestamp;
}
