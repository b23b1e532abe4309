package com.work.oracle.core.config;

import java.math.BigDecimal;
import java.time.Duration;

import static com.work.oracle.core.support.ValidationUtils.requireFraction;
import static com.work.oracle.core.support.ValidationUtils.requireNonNull;
import static com.work.oracle.core.support.ValidationUtils.requirePositive;

/**
 * 纯组件侧的结算配置，不依赖任意框架。宿主应用把自身读取到的配置注入即可，
 * 确保 core 包与 Spring 解耦。
 */
public class SettlementSettings {

    public static final BigDecimal DEFAULT_SETTLEMENT_FRACTION = new BigDecimal("0.9");

    private final BigDecimal settlementFraction;
    private final DeadlineUnit deadlineUnit;
    private final TimeSource timeSource;
    private final boolean autoFulfil;
    private final GasLimits gasLimits;
    private final int parallelism;
    private final Duration dispatchTimeout;

    public SettlementSettings(BigDecimal settlementFraction,
                              DeadlineUnit deadlineUnit,
                              TimeSource timeSource,
                              boolean autoFulfil,
                              GasLimits gasLimits,
                              int parallelism,
                              Duration dispatchTimeout) {
        this.settlementFraction = requireFraction(settlementFraction, "settlementFraction");
        this.deadlineUnit = requireNonNull(deadlineUnit, "deadlineUnit");
        this.timeSource = requireNonNull(timeSource, "timeSource");
        this.autoFulfil = autoFulfil;
        this.gasLimits = requireNonNull(gasLimits, "gasLimits");
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism 必须大于0");
        }
        this.parallelism = parallelism;
        this.dispatchTimeout = requirePositive(dispatchTimeout, "dispatchTimeout");
    }

    public static SettlementSettings defaultSettings() {
        return new SettlementSettings(DEFAULT_SETTLEMENT_FRACTION,
                DeadlineUnit.SECONDS,
                TimeSource.WALL_CLOCK,
                true,
                GasLimits.defaults(),
                1,
                Duration.ofMinutes(10));
    }

    public BigDecimal getSettlementFraction() {
        return settlementFraction;
    }

    public DeadlineUnit getDeadlineUnit() {
        return deadlineUnit;
    }

    public TimeSource getTimeSource() {
        return timeSource;
    }

    /**
     * ACCEPTED 且未过推广截止时间时是否立即 fulfil；false 时保持等待。
     */
    public boolean isAutoFulfil() {
        return autoFulfil;
    }

    public GasLimits getGasLimits() {
        return gasLimits;
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * 单个 campaign 在账户串行队列中允许占用的最长时间（需覆盖两次打包等待）。
     */
    public Duration getDispatchTimeout() {
        return dispatchTimeout;
    }
}
