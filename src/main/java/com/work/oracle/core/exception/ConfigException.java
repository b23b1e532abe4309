package com.work.oracle.core.exception;

/**
 * 启动期配置错误，进程应直接退出。
 */
public class ConfigException extends SettlementException {

    public ConfigException(String message) {
        super(ErrorKind.CONFIG, message);
    }

    public ConfigException(String message, Throwable cause) {
        super(ErrorKind.CONFIG, message, cause);
    }
}
