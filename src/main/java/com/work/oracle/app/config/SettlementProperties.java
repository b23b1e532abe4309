package com.work.oracle.app.config;

import com.work.oracle.core.config.DeadlineUnit;
import com.work.oracle.core.config.TimeSource;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * 结算轮询配置。
 */
@Validated
@ConfigurationProperties(prefix = "settlement")
public class SettlementProperties {

    /**
     * 是否启用定时轮询（关闭后仍可通过运维接口手动触发）
     */
    private boolean enabled = true;

    @NotNull
    private CampaignSourceMode campaignSource = CampaignSourceMode.CHAIN;

    /**
     * 两轮之间的休眠间隔，从上一轮完成时开始计时
     */
    @Positive
    private long pollIntervalMs = 10_000L;

    /**
     * 单轮内并发评估的 campaign 数；提交始终串行
     */
    @Positive
    private int parallelism = 1;

    /**
     * fulfil 时付给 kol 的比例
     */
    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private BigDecimal settlementFraction = new BigDecimal("0.9");

    @NotNull
    private DeadlineUnit deadlineUnit = DeadlineUnit.SECONDS;

    @NotNull
    private TimeSource timeSource = TimeSource.WALL_CLOCK;

    /**
     * ACCEPTED 且未过推广截止时间时是否立即 fulfil
     */
    private boolean autoFulfil = true;

    /**
     * 单个 campaign 在账户串行队列中允许占用的最长时间，需大于两次 receipt 等待之和
     */
    private Duration dispatchTimeout = Duration.ofMinutes(10);

    /**
     * 内存中保留的部分结算记录条数
     */
    @Positive
    private int anomalyCapacity = 1000;

    private final Gas gas = new Gas();

    public static class Gas {

        private long transition = 100_000L;

        private long fulfil = 200_000L;

        private long transfer = 100_000L;

        public long getTransition() {
            return transition;
        }

        public void setTransition(long transition) {
            this.transition = transition;
        }

        public long getFulfil() {
            return fulfil;
        }

        public void setFulfil(long fulfil) {
            this.fulfil = fulfil;
        }

        public long getTransfer() {
            return transfer;
        }

        public void setTransfer(long transfer) {
            this.transfer = transfer;
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public CampaignSourceMode getCampaignSource() {
        return campaignSource;
    }

    public void setCampaignSource(CampaignSourceMode campaignSource) {
        this.campaignSource = campaignSource;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public BigDecimal getSettlementFraction() {
        return settlementFraction;
    }

    public void setSettlementFraction(BigDecimal settlementFraction) {
        this.settlementFraction = settlementFraction;
    }

    public DeadlineUnit getDeadlineUnit() {
        return deadlineUnit;
    }

    public void setDeadlineUnit(DeadlineUnit deadlineUnit) {
        this.deadlineUnit = deadlineUnit;
    }

    public TimeSource getTimeSource() {
        return timeSource;
    }

    public void setTimeSource(TimeSource timeSource) {
        this.timeSource = timeSource;
    }

    public boolean isAutoFulfil() {
        return autoFulfil;
    }

    public void setAutoFulfil(boolean autoFulfil) {
        this.autoFulfil = autoFulfil;
    }

    public Duration getDispatchTimeout() {
        return dispatchTimeout;
    }

    public void setDispatchTimeout(Duration dispatchTimeout) {
        this.dispatchTimeout = dispatchTimeout;
    }

    public int getAnomalyCapacity() {
        return anomalyCapacity;
    }

    public void setAnomalyCapacity(int anomalyCapacity) {
        this.anomalyCapacity = anomalyCapacity;
    }

    public Gas getGas() {
        return gas;
    }
}
