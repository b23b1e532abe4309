package com.work.oracle.core.config;

import java.math.BigInteger;
import java.time.Instant;

/**
 * 链上截止时间的存储单位。比较前把“当前时间”换算（向下取整）到同一单位，避免秒/毫秒混用让所有截止判断失效。
 */
public enum DeadlineUnit {
    SECONDS {
        @Override
        public BigInteger fromInstant(Instant instant) {
            return BigInteger.valueOf(instant.getEpochSecond());
        }
    },
    MILLISECONDS {
        @Override
        public BigInteger fromInstant(Instant instant) {
            return BigInteger.valueOf(instant.toEpochMilli());
        }
    };

    public abstract BigInteger fromInstant(Instant instant);
}
