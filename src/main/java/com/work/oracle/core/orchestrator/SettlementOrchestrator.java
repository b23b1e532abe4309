package com.work.oracle.core.orchestrator;

import com.work.oracle.core.chain.CampaignSource;
import com.work.oracle.core.chain.ChainClient;
import com.work.oracle.core.evaluate.CurrentTimeResolver;
import com.work.oracle.core.evaluate.SettlementEvaluator;
import com.work.oracle.core.exception.SettlementException;
import com.work.oracle.core.exception.SourceUnavailableException;
import com.work.oracle.core.execution.SettlementExecutor;
import com.work.oracle.core.metrics.SettlementMetrics;
import com.work.oracle.core.model.Campaign;
import com.work.oracle.core.model.CampaignFailure;
import com.work.oracle.core.model.CampaignId;
import com.work.oracle.core.model.PassReport;
import com.work.oracle.core.model.SettlementAction;
import com.work.oracle.core.model.SettlementOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static com.work.oracle.core.support.ValidationUtils.requireNonNull;

/**
 * 单轮编排：拉取 id 列表，逐个（或有界并发）读取 -> 评估 -> 执行。
 * <p>
 * 单个 campaign 的任何失败都在这里被捕获、记录（带 id 与最后一次快照），不影响其余 campaign，
 * 也不会向上抛出；只有 id 来源不可用会让整轮失败。
 * <p>
 * 同一时刻只允许一轮在跑：上一轮未结束时 runPass 直接返回 skipped。
 */
public class SettlementOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SettlementOrchestrator.class);

    private final CampaignSource campaignSource;
    private final ChainClient chainClient;
    private final SettlementEvaluator evaluator;
    private final SettlementExecutor executor;
    private final CurrentTimeResolver timeResolver;
    private final SettlementMetrics metrics;
    private final Clock clock;
    private final ExecutorService pool;

    private final AtomicReference<OrchestratorState> state = new AtomicReference<>(OrchestratorState.IDLE);
    private volatile PassReport lastReport;

    public SettlementOrchestrator(CampaignSource campaignSource,
                                  ChainClient chainClient,
                                  SettlementEvaluator evaluator,
                                  SettlementExecutor executor,
                                  CurrentTimeResolver timeResolver,
                                  SettlementMetrics metrics,
                                  Clock clock,
                                  int parallelism) {
        this.campaignSource = requireNonNull(campaignSource, "campaignSource");
        this.chainClient = requireNonNull(chainClient, "chainClient");
        this.evaluator = requireNonNull(evaluator, "evaluator");
        this.executor = requireNonNull(executor, "executor");
        this.timeResolver = requireNonNull(timeResolver, "timeResolver");
        this.metrics = requireNonNull(metrics, "metrics");
        this.clock = requireNonNull(clock, "clock");
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism 必须大于0");
        }
        this.pool = parallelism == 1 ? null : Executors.newFixedThreadPool(parallelism, threadFactory());
    }

    /**
     * 执行一轮。id 来源不可用时抛出 {@link SourceUnavailableException}。
     */
    public PassReport runPass() {
        if (!state.compareAndSet(OrchestratorState.IDLE, OrchestratorState.POLLING)) {
            log.debug("Settlement pass already running, skip");
            return PassReport.skipped(clock.instant());
        }
        try {
            PassReport report = doRunPass();
            lastReport = report;
            return report;
        } finally {
            state.set(OrchestratorState.IDLE);
        }
    }

    private PassReport doRunPass() {
        Instant startedAt = clock.instant();
        List<CampaignId> ids;
        try {
            ids = campaignSource.listCampaignIds();
        } catch (SourceUnavailableException e) {
            metrics.sourceUnavailable();
            throw e;
        }

        List<SettlementOutcome> executed = new ArrayList<>();
        List<CampaignFailure> failures = new ArrayList<>();

        if (pool == null) {
            for (CampaignId id : ids) {
                collect(processCampaign(id), executed, failures);
            }
        } else {
            List<CompletableFuture<CampaignResult>> futures = new ArrayList<>(ids.size());
            for (CampaignId id : ids) {
                futures.add(CompletableFuture.supplyAsync(() -> processCampaign(id), pool));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    collect(futures.get(i).get(), executed, failures);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    failures.add(new CampaignFailure(ids.get(i), null, "interrupted", null));
                } catch (ExecutionException e) {
                    failures.add(new CampaignFailure(ids.get(i), null, String.valueOf(e.getCause()), null));
                }
            }
        }

        PassReport report = new PassReport(startedAt, clock.instant(), ids.size(), executed, failures);
        metrics.passCompleted(ids.size(), executed.size(), failures.size());
        log.info("Settlement pass finished. campaigns={} executed={} failed={}", ids.size(), executed.size(), failures.size());
        return report;
    }

    private CampaignResult processCampaign(CampaignId id) {
        Campaign snapshot = null;
        try {
            snapshot = chainClient.getCampaignInfo(id);
            SettlementAction action = evaluator.evaluate(snapshot, timeResolver.now());
            if (action.isNone()) {
                return CampaignResult.ok(null);
            }
            log.info("Campaign requires action. campaignId={} action={}", id, action);
            return CampaignResult.ok(executor.execute(action));
        } catch (SettlementException e) {
            metrics.campaignFailed(e.getKind().name());
            log.warn("Campaign settlement failed, will retry next pass. campaignId={} kind={} snapshot={} err={}",
                    id, e.getKind(), snapshot, e.getMessage());
            return CampaignResult.failed(new CampaignFailure(id, e.getKind(), e.getMessage(), snapshot));
        } catch (RuntimeException e) {
            metrics.campaignFailed("UNEXPECTED");
            log.error("Unexpected error while settling campaign. campaignId={} snapshot={}", id, snapshot, e);
            return CampaignResult.failed(new CampaignFailure(id, null, String.valueOf(e.getMessage()), snapshot));
        }
    }

    private static void collect(CampaignResult result, List<SettlementOutcome> executed, List<CampaignFailure> failures) {
        if (result.failure != null) {
            failures.add(result.failure);
        } else if (result.outcome != null && result.outcome.isExecuted()) {
            executed.add(result.outcome);
        }
    }

    public OrchestratorState getState() {
        return state.get();
    }

    /**
     * 最近一次完成的一轮，尚未完成过时为 null。
     */
    public PassReport getLastReport() {
        return lastReport;
    }

    @Override
    public void close() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    private static ThreadFactory threadFactory() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName("settlement-eval-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class CampaignResult {
        final SettlementOutcome outcome;
        final CampaignFailure failure;

        private CampaignResult(SettlementOutcome outcome, CampaignFailure failure) {
            this.outcome = outcome;
            this.failure = failure;
        }

        static CampaignResult ok(SettlementOutcome outcome) {
            return new CampaignResult(outcome, null);
        }

        static CampaignResult failed(CampaignFailure failure) {
            return new CampaignResult(null, failure);
        }
    }
}
