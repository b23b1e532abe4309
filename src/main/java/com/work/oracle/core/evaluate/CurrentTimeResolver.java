package com.work.oracle.core.evaluate;

import com.work.oracle.core.chain.ChainClient;
import com.work.oracle.core.config.TimeSource;

import java.time.Clock;
import java.time.Instant;

import static com.work.oracle.core.support.ValidationUtils.requireNonNull;

/**
 * 解析评估用的“当前时间”。LATEST_BLOCK 模式下读取失败抛出 ReadException，按单个 campaign 的读失败处理。
 */
public class CurrentTimeResolver {

    private final TimeSource timeSource;
    private final Clock clock;
    private final ChainClient chainClient;

    public CurrentTimeResolver(TimeSource timeSource, Clock clock, ChainClient chainClient) {
        this.timeSource = requireNonNull(timeSource, "timeSource");
        this.clock = requireNonNull(clock, "clock");
        this.chainClient = requireNonNull(chainClient, "chainClient");
    }

    public Instant now() {
        if (timeSource == TimeSource.LATEST_BLOCK) {
            return Instant.ofEpochSecond(chainClient.latestBlockTimestamp());
        }
        return clock.instant();
    }
}
