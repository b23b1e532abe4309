package com.work.oracle.core.execution;

import com.work.oracle.core.anomaly.AnomalyJournal;
import com.work.oracle.core.chain.CampaignStatusNotifier;
import com.work.oracle.core.chain.ChainClient;
import com.work.oracle.core.config.GasLimits;
import com.work.oracle.core.evaluate.SettlementEvaluator;
import com.work.oracle.core.exception.SubmissionException;
import com.work.oracle.core.exception.UnconfirmedSubmissionException;
import com.work.oracle.core.metrics.SettlementMetrics;
import com.work.oracle.core.model.ActionType;
import com.work.oracle.core.model.Campaign;
import com.work.oracle.core.model.CampaignId;
import com.work.oracle.core.model.ContractCall;
import com.work.oracle.core.model.SettlementAction;
import com.work.oracle.core.model.SettlementAnomaly;
import com.work.oracle.core.model.SettlementOutcome;
import com.work.oracle.core.model.TxReceipt;
import com.work.oracle.core.nonce.NonceReservation;
import com.work.oracle.core.nonce.NonceSequencer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

import static com.work.oracle.core.support.ValidationUtils.requireNonNull;

/**
 * 两段式执行器。
 * <p>
 * 阶段 1：领取 nonce，提交状态迁移并阻塞等待 receipt；revert 或提交失败则整个动作失败，不做划转。
 * 迁移已广播但拿不到 receipt 时，对需要划转的动作按部分结算记录（划转目标取自原动作）。
 * <p>
 * 阶段 2：重新读取 campaign，确认已到达期望状态，基于新快照推导收款方与金额，
 * 在上一笔确认之后重新推导 nonce，提交划转并等待 receipt。
 * 阶段 2 的任何失败（含 nonce、gas price 读取）即“部分结算”：记入 AnomalyJournal 供人工对账，并抛出 partial 的 SubmissionException。
 * <p>
 * 整个动作在账户串行队列内执行。
 */
public class SettlementExecutor {

    private static final Logger log = LoggerFactory.getLogger(SettlementExecutor.class);

    private final ChainClient chainClient;
    private final NonceSequencer sequencer;
    private final AccountExecutor accountExecutor;
    private final SettlementEvaluator evaluator;
    private final GasLimits gasLimits;
    private final AnomalyJournal anomalyJournal;
    private final CampaignStatusNotifier notifier;
    private final SettlementMetrics metrics;
    private final Clock clock;

    public SettlementExecutor(ChainClient chainClient,
                              NonceSequencer sequencer,
                              AccountExecutor accountExecutor,
                              SettlementEvaluator evaluator,
                              GasLimits gasLimits,
                              AnomalyJournal anomalyJournal,
                              CampaignStatusNotifier notifier,
                              SettlementMetrics metrics,
                              Clock clock) {
        this.chainClient = requireNonNull(chainClient, "chainClient");
        this.sequencer = requireNonNull(sequencer, "sequencer");
        this.accountExecutor = requireNonNull(accountExecutor, "accountExecutor");
        this.evaluator = requireNonNull(evaluator, "evaluator");
        this.gasLimits = requireNonNull(gasLimits, "gasLimits");
        this.anomalyJournal = requireNonNull(anomalyJournal, "anomalyJournal");
        this.notifier = requireNonNull(notifier, "notifier");
        this.metrics = requireNonNull(metrics, "metrics");
        this.clock = requireNonNull(clock, "clock");
    }

    public SettlementOutcome execute(SettlementAction action) {
        requireNonNull(action, "action");
        if (action.isNone()) {
            return SettlementOutcome.skipped(action.getCampaignId());
        }
        return accountExecutor.execute(sequencer.getAddress(), () -> executeSerial(action));
    }

    private SettlementOutcome executeSerial(SettlementAction action) {
        ActionType type = action.getType();
        CampaignId id = action.getCampaignId();
        NonceReservation reservation = sequencer.reserve(type.transfersFunds() ? 2 : 1);

        // 阶段 1：状态迁移
        ContractCall transitionCall = ContractCall.transition(type.getTransition(), id);
        TxReceipt transition;
        try {
            transition = submit(reservation, transitionCall);
        } catch (UnconfirmedSubmissionException e) {
            // 已广播但未确认：迁移可能稍后上链，划转必须进入对账
            if (!type.transfersFunds()) {
                throw e;
            }
            throw partial(action, e.getTxHash(), action,
                    "transition broadcast but receipt unavailable, nonce=" + e.getNonce() + ": " + e.getMessage(), e);
        }
        if (!transition.isSuccess()) {
            throw new SubmissionException(transitionCall + " reverted, txHash=" + transition.getTxHash());
        }
        log.info("Campaign transition mined. campaignId={} action={} txHash={} nonce={}",
                id, type, transition.getTxHash(), transition.getNonce());

        if (!type.transfersFunds()) {
            return new SettlementOutcome(id, type, transition, null);
        }

        // 阶段 2：基于新快照推导划转
        String transitionTxHash = transition.getTxHash();
        Campaign fresh;
        try {
            fresh = chainClient.getCampaignInfo(id);
        } catch (RuntimeException e) {
            throw partial(action, transitionTxHash, null, "re-read after transition failed: " + e.getMessage(), e);
        }
        if (fresh.getStatus() != type.getTargetStatus()) {
            throw partial(action, transitionTxHash, null,
                    "status after transition is " + fresh.getStatus() + ", expected " + type.getTargetStatus(), null);
        }
        SettlementAction transfer;
        try {
            transfer = evaluator.transferAfterTransition(fresh, type);
        } catch (RuntimeException e) {
            throw partial(action, transitionTxHash, null, "transfer derivation failed: " + e.getMessage(), e);
        }

        ContractCall transferCall = ContractCall.transfer(id, transfer.getTransferTo(), transfer.getAmount());
        TxReceipt transferReceipt;
        try {
            transferReceipt = submit(reservation, transferCall);
        } catch (RuntimeException e) {
            // 包括 nonce 推导与 gas price 读取失败
            throw partial(action, transitionTxHash, transfer, "transfer submission failed: " + e.getMessage(), e);
        }
        if (!transferReceipt.isSuccess()) {
            throw partial(action, transitionTxHash, transfer, "transfer reverted, txHash=" + transferReceipt.getTxHash(), null);
        }
        log.info("Settlement transfer mined. campaignId={} to={} amount={} txHash={} nonce={}",
                id, transfer.getTransferTo(), transfer.getAmount(), transferReceipt.getTxHash(), transferReceipt.getNonce());

        notifySettled(id, type);
        return new SettlementOutcome(id, type, transition, transferReceipt);
    }

    private TxReceipt submit(NonceReservation reservation, ContractCall call) {
        long nonce = reservation.next();
        TxReceipt receipt;
        try {
            receipt = chainClient.buildAndSubmit(call, nonce, gasLimits.forCall(call.getKind()));
        } catch (SubmissionException e) {
            reservation.release(nonce);
            metrics.transactionSubmitted(call.getKind().name(), false);
            throw e;
        } catch (RuntimeException e) {
            reservation.release(nonce);
            metrics.transactionSubmitted(call.getKind().name(), false);
            throw new SubmissionException(call + " failed: " + e.getMessage(), e);
        }
        // receipt 出现即 nonce 已被消耗，revert 也一样
        reservation.confirm(nonce);
        metrics.transactionSubmitted(call.getKind().name(), receipt.isSuccess());
        return receipt;
    }

    private SubmissionException partial(SettlementAction action,
                                        String transitionTxHash,
                                        SettlementAction intendedTransfer,
                                        String reason,
                                        Throwable cause) {
        SettlementAction intended = intendedTransfer != null ? intendedTransfer : action;
        SettlementAnomaly anomaly = new SettlementAnomaly(
                action.getCampaignId(),
                action.getType(),
                transitionTxHash,
                intended.getTransferTo(),
                intended.getAmount() == null ? null : intended.getAmount().toString(),
                reason,
                clock.instant());
        anomalyJournal.record(anomaly);
        metrics.partialSettlement(action.getType().name());
        log.error("Partial settlement, manual reconciliation required. {}", anomaly);
        return new SubmissionException("partial settlement for campaign " + action.getCampaignId() + ": " + reason, cause, true);
    }

    private void notifySettled(CampaignId id, ActionType type) {
        try {
            notifier.campaignSettled(id, type.getTargetStatus());
        } catch (RuntimeException e) {
            log.warn("Campaign status notification failed. campaignId={} status={} err={}",
                    id, type.getTargetStatus(), e.getMessage());
        }
    }
}
