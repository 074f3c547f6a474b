package com.example.apirecovery.exception;

import lombok.Getter;

@Getter
public class QueueOverflowException extends RecoveryException {
    private final int maxSize;
    // true 表示因背压被挤出队列，而不是入队时被拒绝
    private final boolean shed;

    public QueueOverflowException(String message, int maxSize, boolean shed) {
        super(message);
        this.maxSize = maxSize;
        this.shed = shed;
    }
}
