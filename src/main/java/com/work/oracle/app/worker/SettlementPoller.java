package com.work.oracle.app.worker;

import com.work.oracle.app.config.SettlementProperties;
import com.work.oracle.core.SettlementEngine;
import com.work.oracle.core.exception.SourceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时轮询：上一轮结束后间隔 settlement.poll-interval-ms 再开始下一轮（fixed delay）。
 * 来源不可用只记日志，下一个间隔重试；进程不退出。
 */
@Component
public class SettlementPoller {

    private static final Logger log = LoggerFactory.getLogger(SettlementPoller.class);

    private final SettlementEngine engine;
    private final SettlementProperties properties;

    public SettlementPoller(SettlementEngine engine, SettlementProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${settlement.poll-interval-ms:10000}",
            initialDelayString = "${settlement.initial-delay-ms:0}")
    public void poll() {
        if (!properties.isEnabled()) {
            return;
        }
        try {
            engine.runPass();
        } catch (SourceUnavailableException e) {
            log.warn("Settlement pass aborted, campaign source unavailable. retryInMs={} err={}",
                    properties.getPollIntervalMs(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Settlement pass failed unexpectedly. retryInMs={}", properties.getPollIntervalMs(), e);
        }
    }
}
