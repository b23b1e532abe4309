package com.work.oracle.core.support;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * 参数校验工具类，统一参数校验逻辑，减少代码重复
 */
public final class ValidationUtils {

    /**
     * EVM 地址：0x 前缀 + 40 位十六进制。
     */
    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 校验字符串参数不为空
     */
    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    /**
     * 校验对象不为null
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " 不能为null");
        }
        return value;
    }

    /**
     * 校验Duration必须大于0
     */
    public static Duration requirePositive(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return duration;
    }

    /**
     * 校验long值必须非负
     */
    public static long requireNonNegative(long value, String paramName) {
        if (value < 0) {
            throw new IllegalArgumentException(paramName + " 不能为负数");
        }
        return value;
    }

    public static BigInteger requireNonNegative(BigInteger value, String paramName) {
        requireNonNull(value, paramName);
        if (value.signum() < 0) {
            throw new IllegalArgumentException(paramName + " 不能为负数");
        }
        return value;
    }

    /**
     * 校验比例位于 (0, 1] 区间。
     */
    public static BigDecimal requireFraction(BigDecimal value, String paramName) {
        requireNonNull(value, paramName);
        if (value.signum() <= 0 || value.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException(paramName + " 必须位于 (0, 1] 区间");
        }
        return value;
    }

    public static boolean isAddress(String value) {
        return value != null && ADDRESS_PATTERN.matcher(value).matches();
    }

    /**
     * 校验 EVM 地址格式。
     */
    public static String requireAddress(String value, String paramName) {
        requireNonEmpty(value, paramName);
        if (!isAddress(value)) {
            throw new IllegalArgumentException(paramName + " 非法，必须是 0x 开头的 40 位十六进制地址");
        }
        return value;
    }
}
