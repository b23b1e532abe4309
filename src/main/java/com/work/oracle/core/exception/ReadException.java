package com.work.oracle.core.exception;

/**
 * 链上只读调用失败（RPC 错误或解码失败）。
 */
public class ReadException extends SettlementException {

    public ReadException(String message) {
        super(ErrorKind.READ, message);
    }

    public ReadException(String message, Throwable cause) {
        super(ErrorKind.READ, message, cause);
    }
}
