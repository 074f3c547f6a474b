package com.example.apirecovery.exception;

import lombok.Getter;

@Getter
public class QueueTimeoutException extends RecoveryException {
    private final String requestId;
    private final long waitedMs;

    public QueueTimeoutException(String requestId, long waitedMs) {
        super("Request " + requestId + " timed out in queue after " + waitedMs + "ms");
        this.requestId = requestId;
        this.waitedMs = waitedMs;
    }
}
