package com.work.oracle.core.chain;

import com.work.oracle.core.model.Campaign;
import com.work.oracle.core.model.CampaignId;
import com.work.oracle.core.model.ContractCall;
import com.work.oracle.core.model.TxReceipt;

import java.math.BigInteger;
import java.util.List;

/**
 * 合约读写网关，由宿主应用实现（web3j / 内存模拟）。core 只依赖该接口。
 * <p>
 * 只读调用失败抛出 {@link com.work.oracle.core.exception.ReadException}，
 * 写调用失败抛出 {@link com.work.oracle.core.exception.SubmissionException}。
 */
public interface ChainClient {

    /**
     * 读取单个 campaign 快照（eth_call getCampaignInfo）。
     */
    Campaign getCampaignInfo(CampaignId id);

    /**
     * 枚举合约内全部 campaign id（eth_call getAllCampaigns）。
     */
    List<CampaignId> getAllCampaigns();

    /**
     * 当前 gas price，每次构造交易前重新查询，不缓存。
     */
    BigInteger currentGasPrice();

    /**
     * 账户的下一个可用 nonce（EVM: eth_getTransactionCount(pending)）。
     */
    long accountNonce(String address);

    /**
     * 最新区块时间戳（epoch 秒）。
     */
    long latestBlockTimestamp();

    /**
     * 构造、签名并提交交易，阻塞直到打包（有超时上限），返回 receipt。
     * <p>
     * 上链但执行失败（revert）时返回 success=false 的 receipt：nonce 已被消耗，由调用方决定如何处理。
     */
    TxReceipt buildAndSubmit(ContractCall call, long nonce, BigInteger gasLimit);
}
