package com.work.oracle.app.chain.web3j;

import com.work.oracle.core.chain.ChainClient;
import com.work.oracle.core.exception.ReadException;
import com.work.oracle.core.exception.SubmissionException;
import com.work.oracle.core.exception.UnconfirmedSubmissionException;
import com.work.oracle.core.model.Campaign;
import com.work.oracle.core.model.CampaignId;
import com.work.oracle.core.model.CampaignIdType;
import com.work.oracle.core.model.ContractCall;
import com.work.oracle.core.model.TxReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthBlock;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthGasPrice;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.tx.response.TransactionReceiptProcessor;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.util.List;

import static com.work.oracle.core.support.ValidationUtils.requireAddress;
import static com.work.oracle.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 Web3j 的链客户端实现：
 * - 只读：eth_call getCampaignInfo / getAllCampaigns，eth_gasPrice，eth_getTransactionCount(pending)，最新区块时间戳
 * - 写：本地签名（EIP-155）后 eth_sendRawTransaction，再由 receipt processor 有界等待打包
 *
 * 错误映射：只读失败 -> ReadException；签名/发送/等待失败 -> SubmissionException。
 */
public class Web3jChainClient implements ChainClient {

    private static final Logger log = LoggerFactory.getLogger(Web3jChainClient.class);

    private final Web3j web3j;
    private final Credentials credentials;
    private final long chainId;
    private final String marketplaceAddress;
    private final String tokenAddress;
    private final CampaignIdType campaignIdType;
    private final TransactionReceiptProcessor receiptProcessor;

    public Web3jChainClient(Web3j web3j,
                            Credentials credentials,
                            long chainId,
                            String marketplaceAddress,
                            String tokenAddress,
                            CampaignIdType campaignIdType,
                            TransactionReceiptProcessor receiptProcessor) {
        this.web3j = requireNonNull(web3j, "web3j");
        this.credentials = requireNonNull(credentials, "credentials");
        this.chainId = chainId;
        this.marketplaceAddress = requireAddress(marketplaceAddress, "marketplaceAddress");
        this.tokenAddress = requireAddress(tokenAddress, "tokenAddress");
        this.campaignIdType = requireNonNull(campaignIdType, "campaignIdType");
        this.receiptProcessor = requireNonNull(receiptProcessor, "receiptProcessor");
    }

    @Override
    public Campaign getCampaignInfo(CampaignId id) {
        String data = call(MarketplaceAbi.encodeGetCampaignInfo(id), "getCampaignInfo(" + id + ")");
        try {
            return MarketplaceAbi.decodeCampaign(id, data);
        } catch (RuntimeException e) {
            throw new ReadException("malformed getCampaignInfo result for " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<CampaignId> getAllCampaigns() {
        String data = call(MarketplaceAbi.encodeGetAllCampaigns(campaignIdType), "getAllCampaigns");
        try {
            return MarketplaceAbi.decodeCampaignIds(campaignIdType, data);
        } catch (RuntimeException e) {
            throw new ReadException("malformed getAllCampaigns result: " + e.getMessage(), e);
        }
    }

    @Override
    public BigInteger currentGasPrice() {
        try {
            EthGasPrice resp = web3j.ethGasPrice().send();
            if (resp.hasError()) {
                throw new ReadException("eth_gasPrice failed: " + resp.getError().getMessage());
            }
            return resp.getGasPrice();
        } catch (IOException e) {
            throw new ReadException("eth_gasPrice failed: " + e.getMessage(), e);
        }
    }

    @Override
    public long accountNonce(String address) {
        try {
            // pending：把本账户已发出但未打包的交易也算进去
            EthGetTransactionCount resp = web3j.ethGetTransactionCount(address, DefaultBlockParameterName.PENDING).send();
            if (resp.hasError()) {
                throw new ReadException("eth_getTransactionCount failed: " + resp.getError().getMessage());
            }
            return resp.getTransactionCount().longValueExact();
        } catch (IOException e) {
            throw new ReadException("eth_getTransactionCount failed: " + e.getMessage(), e);
        }
    }

    @Override
    public long latestBlockTimestamp() {
        try {
            EthBlock resp = web3j.ethGetBlockByNumber(DefaultBlockParameterName.LATEST, false).send();
            if (resp.hasError() || resp.getBlock() == null) {
                throw new ReadException("eth_getBlockByNumber(latest) returned no block");
            }
            return resp.getBlock().getTimestamp().longValueExact();
        } catch (IOException e) {
            throw new ReadException("eth_getBlockByNumber failed: " + e.getMessage(), e);
        }
    }

    @Override
    public TxReceipt buildAndSubmit(ContractCall call, long nonce, BigInteger gasLimit) {
        String to;
        String data;
        if (call.getKind().isMarketplaceCall()) {
            to = marketplaceAddress;
            data = MarketplaceAbi.encodeTransition(call.getKind(), call.getCampaignId());
        } else {
            to = tokenAddress;
            data = MarketplaceAbi.encodeTransfer(call.getRecipient(), call.getAmount());
        }

        BigInteger gasPrice;
        try {
            gasPrice = currentGasPrice();
        } catch (ReadException e) {
            throw new SubmissionException("gas price unavailable for " + call + ": " + e.getMessage(), e);
        }

        RawTransaction raw = RawTransaction.createTransaction(BigInteger.valueOf(nonce), gasPrice, gasLimit, to, data);
        String signed = Numeric.toHexString(TransactionEncoder.signMessage(raw, chainId, credentials));

        String txHash;
        try {
            EthSendTransaction sent = web3j.ethSendRawTransaction(signed).send();
            if (sent.hasError()) {
                throw new SubmissionException("eth_sendRawTransaction rejected " + call + ": " + sent.getError().getMessage());
            }
            txHash = sent.getTransactionHash();
        } catch (IOException e) {
            throw new SubmissionException("eth_sendRawTransaction failed for " + call + ": " + e.getMessage(), e);
        }
        log.info("Transaction sent. call={} nonce={} gasPrice={} gasLimit={} txHash={}", call, nonce, gasPrice, gasLimit, txHash);

        try {
            TransactionReceipt r = receiptProcessor.waitForTransactionReceipt(txHash);
            return new TxReceipt(txHash, nonce, r.getBlockNumber().longValue(), isReceiptSuccess(r));
        } catch (IOException | TransactionException e) {
            throw new UnconfirmedSubmissionException(txHash, nonce,
                    "receipt not available for " + txHash + ": " + e.getMessage(), e);
        }
    }

    private String call(String encoded, String what) {
        try {
            EthCall resp = web3j.ethCall(
                    Transaction.createEthCallTransaction(credentials.getAddress(), marketplaceAddress, encoded),
                    DefaultBlockParameterName.LATEST).send();
            if (resp.hasError()) {
                throw new ReadException("eth_call " + what + " failed: " + resp.getError().getMessage());
            }
            if (resp.isReverted()) {
                throw new ReadException("eth_call " + what + " reverted: " + resp.getRevertReason());
            }
            String value = resp.getValue();
            if (value == null || "0x".equals(value)) {
                throw new ReadException("eth_call " + what + " returned empty data");
            }
            return value;
        } catch (IOException e) {
            throw new ReadException("eth_call " + what + " failed: " + e.getMessage(), e);
        }
    }

    private boolean isReceiptSuccess(TransactionReceipt receipt) {
        // EVM receipt status: 0x1 success, 0x0 failure；部分链不返回 status
        String status = receipt.getStatus();
        if (status == null) {
            return true;
        }
        return !"0x0".equalsIgnoreCase(status);
    }
}
