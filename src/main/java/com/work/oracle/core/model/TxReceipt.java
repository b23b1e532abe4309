package com.work.oracle.core.model;

/**
 * 最小 receipt 表达：只要 receipt 出现，该 nonce 即已被链消耗（无论 success=true/false）。
 */
public class TxReceipt {

    private final String txHash;
    private final long nonce;
    private final long blockNumber;
    private final boolean success;

    public TxReceipt(String txHash, long nonce, long blockNumber, boolean success) {
        this.txHash = txHash;
        this.nonce = nonce;
        this.blockNumber = blockNumber;
        this.success = success;
    }

    public String getTxHash() {
        return txHash;
    }

    public long getNonce() {
        return nonce;
    }

    public long getBlockNumber() {
        return blockNumber;
    }

    public boolean isSuccess() {
        return success;
    }

    @Override
    public String toString() {
        return "TxReceipt{txHash=" + txHash + ", nonce=" + nonce + ", blockNumber=" + blockNumber + ", success=" + success + '}';
    }
}
