package com.work.oracle.core.exception;

/**
 * 错误分类：编排层据此机械地决定“中止进程”还是“下一轮重试”，而不是去解析异常消息。
 */
public enum ErrorKind {

    /**
     * 配置缺失/非法，仅在启动期出现，致命。
     */
    CONFIG(true, false),

    /**
     * campaign id 来源不可用，本轮失败，下一个间隔重试。
     */
    SOURCE_UNAVAILABLE(false, true),

    /**
     * 单个 campaign 读取失败，跳过，下一轮重试。
     */
    READ(false, true),

    /**
     * 单个 campaign 的交易提交失败（可能是部分执行），下一轮按最新链上状态重新评估。
     */
    SUBMISSION(false, true);

    private final boolean fatal;
    private final boolean retryable;

    ErrorKind(boolean fatal, boolean retryable) {
        this.fatal = fatal;
        this.retryable = retryable;
    }

    public boolean isFatal() {
        return fatal;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
