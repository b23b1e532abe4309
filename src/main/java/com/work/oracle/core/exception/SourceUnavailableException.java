package com.work.oracle.core.exception;

/**
 * campaign id 列表拿不到（网络错误、响应格式错误等）。整轮失败，绝不能退化为空列表。
 */
public class SourceUnavailableException extends SettlementException {

    public SourceUnavailableException(String message) {
        super(ErrorKind.SOURCE_UNAVAILABLE, message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(ErrorKind.SOURCE_UNAVAILABLE, message, cause);
    }
}
