package com.work.oracle.app.chain;

import com.work.oracle.core.chain.ChainClient;
import com.work.oracle.core.exception.ReadException;
import com.work.oracle.core.exception.SubmissionException;
import com.work.oracle.core.model.Campaign;
import com.work.oracle.core.model.CampaignId;
import com.work.oracle.core.model.CampaignStatus;
import com.work.oracle.core.model.CallKind;
import com.work.oracle.core.model.ContractCall;
import com.work.oracle.core.model.TxReceipt;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.work.oracle.core.support.ValidationUtils.requireAddress;
import static com.work.oracle.core.support.ValidationUtils.requireNonNull;

/**
 * 内存版链客户端：进程内模拟 marketplace 合约与结算代币，仅用于 mock 模式与测试。
 * <p>
 * 与真实链一致的约束：
 * - 只接受等于账户当前 nonce 的交易，否则视为未打包（SubmissionException）
 * - 状态迁移的前置状态不符时交易仍会打包并消耗 nonce，但 receipt.success=false（revert）
 */
public class InMemoryChainClient implements ChainClient {

    /**
     * 一笔已打包的交易。
     */
    public static class MinedTx {
        private final ContractCall call;
        private final long nonce;
        private final BigInteger gasLimit;
        private final TxReceipt receipt;

        MinedTx(ContractCall call, long nonce, BigInteger gasLimit, TxReceipt receipt) {
            this.call = call;
            this.nonce = nonce;
            this.gasLimit = gasLimit;
            this.receipt = receipt;
        }

        public ContractCall getCall() {
            return call;
        }

        public long getNonce() {
            return nonce;
        }

        public BigInteger getGasLimit() {
            return gasLimit;
        }

        public TxReceipt getReceipt() {
            return receipt;
        }
    }

    private final String accountAddress;
    private final Clock clock;

    private final Map<CampaignId, Campaign> campaigns = new LinkedHashMap<>();
    private final List<MinedTx> mined = new ArrayList<>();
    private final Deque<CallKind> submissionFailures = new ArrayDeque<>();
    private final Set<CampaignId> unreadable = new HashSet<>();

    private BigInteger gasPrice = BigInteger.valueOf(1_000_000_000L);
    private long accountNonce;
    private long blockNumber = 1L;
    private boolean enumerationFailing;

    public InMemoryChainClient(String accountAddress, Clock clock) {
        this.accountAddress = requireAddress(accountAddress, "accountAddress");
        this.clock = requireNonNull(clock, "clock");
    }

    @Override
    public synchronized Campaign getCampaignInfo(CampaignId id) {
        if (unreadable.contains(id)) {
            throw new ReadException("eth_call getCampaignInfo failed for " + id);
        }
        Campaign c = campaigns.get(id);
        if (c == null) {
            throw new ReadException("campaign not found: " + id);
        }
        return c;
    }

    @Override
    public synchronized List<CampaignId> getAllCampaigns() {
        if (enumerationFailing) {
            throw new ReadException("eth_call getAllCampaigns failed");
        }
        return new ArrayList<>(campaigns.keySet());
    }

    @Override
    public synchronized BigInteger currentGasPrice() {
        return gasPrice;
    }

    @Override
    public synchronized long accountNonce(String address) {
        return accountAddress.equalsIgnoreCase(address) ? accountNonce : 0L;
    }

    @Override
    public long latestBlockTimestamp() {
        return clock.instant().getEpochSecond();
    }

    @Override
    public synchronized TxReceipt buildAndSubmit(ContractCall call, long nonce, BigInteger gasLimit) {
        requireNonNull(call, "call");
        requireNonNull(gasLimit, "gasLimit");
        if (nonce != accountNonce) {
            throw new SubmissionException("nonce mismatch: expected " + accountNonce + ", got " + nonce);
        }
        if (!submissionFailures.isEmpty() && submissionFailures.peekFirst() == call.getKind()) {
            submissionFailures.removeFirst();
            throw new SubmissionException("transaction not mined: " + call);
        }

        boolean success = apply(call);
        long bn = blockNumber++;
        accountNonce++;
        TxReceipt receipt = new TxReceipt("0x" + String.format("%064x", bn), nonce, bn, success);
        mined.add(new MinedTx(call, nonce, gasLimit, receipt));
        return receipt;
    }

    private boolean apply(ContractCall call) {
        if (call.getKind() == CallKind.TRANSFER) {
            return true;
        }
        Campaign c = campaigns.get(call.getCampaignId());
        if (c == null) {
            return false;
        }
        CampaignStatus required;
        CampaignStatus target;
        switch (call.getKind()) {
            case ACCEPT_PROJECT_CAMPAIGN:
                required = CampaignStatus.OPEN;
                target = CampaignStatus.ACCEPTED;
                break;
            case DISCARD_CAMPAIGN:
                required = CampaignStatus.OPEN;
                target = CampaignStatus.DISCARDED;
                break;
            case FULFIL_PROJECT_CAMPAIGN:
                required = CampaignStatus.ACCEPTED;
                target = CampaignStatus.FULFILLED;
                break;
            case UNFULFILL_CAMPAIGN:
                required = CampaignStatus.ACCEPTED;
                target = CampaignStatus.UNFULFILLED;
                break;
            default:
                return false;
        }
        if (c.getStatus() != required) {
            return false;
        }
        campaigns.put(c.getId(), c.withStatus(target));
        return true;
    }

    public synchronized void putCampaign(Campaign campaign) {
        campaigns.put(campaign.getId(), campaign);
    }

    /**
     * 下一次该类型的提交不会被打包（不消耗 nonce）。
     */
    public synchronized void failNextSubmission(CallKind kind) {
        submissionFailures.addLast(kind);
    }

    public synchronized void failReads(CampaignId id) {
        unreadable.add(id);
    }

    public synchronized void setEnumerationFailing(boolean failing) {
        this.enumerationFailing = failing;
    }

    public synchronized void setGasPrice(BigInteger gasPrice) {
        this.gasPrice = requireNonNull(gasPrice, "gasPrice");
    }

    /**
     * 模拟外部（非本进程）使用同一账户发送了交易。
     */
    public synchronized void advanceAccountNonce(long delta) {
        accountNonce += delta;
    }

    public synchronized List<MinedTx> getMined() {
        return Collections.unmodifiableList(new ArrayList<>(mined));
    }

    public String getAccountAddress() {
        return accountAddress;
    }
}
