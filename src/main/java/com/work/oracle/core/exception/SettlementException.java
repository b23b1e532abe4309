package com.work.oracle.core.exception;

/**
 * 组件内部的统一异常类型，携带 {@link ErrorKind}，便于编排层区分“重试”与“中止”。
 */
public class SettlementException extends RuntimeException {

    private final ErrorKind kind;

    public SettlementException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SettlementException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    public boolean isFatal() {
        return kind.isFatal();
    }
}
