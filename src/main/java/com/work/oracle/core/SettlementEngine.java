package com.work.oracle.core;

import com.work.oracle.core.anomaly.AnomalyJournal;
import com.work.oracle.core.chain.CampaignSource;
import com.work.oracle.core.chain.CampaignStatusNotifier;
import com.work.oracle.core.chain.ChainClient;
import com.work.oracle.core.config.SettlementSettings;
import com.work.oracle.core.evaluate.CurrentTimeResolver;
import com.work.oracle.core.evaluate.SettlementEvaluator;
import com.work.oracle.core.execution.SettlementExecutor;
import com.work.oracle.core.execution.WorkerQueueAccountExecutor;
import com.work.oracle.core.metrics.SettlementMetrics;
import com.work.oracle.core.model.Campaign;
import com.work.oracle.core.model.CampaignEvaluation;
import com.work.oracle.core.model.CampaignId;
import com.work.oracle.core.model.PassReport;
import com.work.oracle.core.model.SettlementAccount;
import com.work.oracle.core.model.SettlementAction;
import com.work.oracle.core.model.SettlementAnomaly;
import com.work.oracle.core.model.SettlementOutcome;
import com.work.oracle.core.nonce.NonceSequencer;
import com.work.oracle.core.orchestrator.OrchestratorState;
import com.work.oracle.core.orchestrator.SettlementOrchestrator;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static com.work.oracle.core.support.ValidationUtils.requireNonNull;

/**
 * 门面（Facade）：显式构造的结算上下文，持有链客户端、id 来源、结算账户与配置，
 * 对宿主暴露最少的调用面。不依赖任何进程级全局状态，可并存多个隔离实例（测试替身即由此注入）。
 */
public class SettlementEngine implements AutoCloseable {

    private final ChainClient chainClient;
    private final SettlementAccount account;
    private final SettlementEvaluator evaluator;
    private final CurrentTimeResolver timeResolver;
    private final SettlementExecutor executor;
    private final SettlementOrchestrator orchestrator;
    private final AnomalyJournal anomalyJournal;
    private final WorkerQueueAccountExecutor accountExecutor;

    public SettlementEngine(ChainClient chainClient,
                            CampaignSource campaignSource,
                            SettlementAccount account,
                            SettlementSettings settings,
                            AnomalyJournal anomalyJournal,
                            CampaignStatusNotifier notifier,
                            SettlementMetrics metrics,
                            Clock clock) {
        this.chainClient = requireNonNull(chainClient, "chainClient");
        this.account = requireNonNull(account, "account");
        this.anomalyJournal = requireNonNull(anomalyJournal, "anomalyJournal");
        requireNonNull(campaignSource, "campaignSource");
        requireNonNull(settings, "settings");
        requireNonNull(clock, "clock");

        this.evaluator = new SettlementEvaluator(settings.getSettlementFraction(), settings.getDeadlineUnit(), settings.isAutoFulfil());
        this.timeResolver = new CurrentTimeResolver(settings.getTimeSource(), clock, chainClient);
        // 轮询与运维接口的所有提交都经过同一个串行队列
        this.accountExecutor = new WorkerQueueAccountExecutor(Math.max(16, settings.getParallelism() * 4),
                settings.getDispatchTimeout(), "settlement-submitter-");
        NonceSequencer sequencer = new NonceSequencer(chainClient, account.getAddress());
        this.executor = new SettlementExecutor(chainClient, sequencer, accountExecutor, evaluator,
                settings.getGasLimits(), anomalyJournal, notifier, metrics, clock);
        this.orchestrator = new SettlementOrchestrator(campaignSource, chainClient, evaluator, executor,
                timeResolver, metrics, clock, settings.getParallelism());
    }

    /**
     * 执行一轮轮询。
     */
    public PassReport runPass() {
        return orchestrator.runPass();
    }

    /**
     * 读取并评估，不执行。
     */
    public CampaignEvaluation evaluate(CampaignId id) {
        Campaign snapshot = chainClient.getCampaignInfo(requireNonNull(id, "id"));
        Instant now = timeResolver.now();
        return new CampaignEvaluation(snapshot, now, evaluator.evaluate(snapshot, now));
    }

    /**
     * 管理操作：接受一个 OPEN 的 campaign。状态不符时合约会 revert，表现为 SubmissionException。
     */
    public SettlementOutcome acceptCampaign(CampaignId id) {
        return executor.execute(SettlementAction.accept(requireNonNull(id, "id")));
    }

    public List<SettlementAnomaly> recentAnomalies(int limit) {
        return anomalyJournal.recent(limit);
    }

    public OrchestratorState getState() {
        return orchestrator.getState();
    }

    public PassReport getLastReport() {
        return orchestrator.getLastReport();
    }

    public SettlementAccount getAccount() {
        return account;
    }

    @Override
    public void close() {
        orchestrator.close();
        accountExecutor.close();
    }
}
