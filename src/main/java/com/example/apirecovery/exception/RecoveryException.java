package com.example.apirecovery.exception;

/**
 * 恢复链路抛出的终态异常基类，调用方可以按具体子类分支处理。
 */
public abstract class RecoveryException extends RuntimeException {

    protected RecoveryException(String message) {
        super(message);
    }

    protected RecoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
