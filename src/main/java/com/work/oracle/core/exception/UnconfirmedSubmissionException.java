package com.work.oracle.core.exception;

/**
 * 交易已被节点接受（已广播），但在等待窗口内没有拿到 receipt。
 * <p>
 * 交易之后仍可能被打包，调用方不能把它当作“未发生”。
 */
public class UnconfirmedSubmissionException extends SubmissionException {

    private final String txHash;
    private final long nonce;

    public UnconfirmedSubmissionException(String txHash, long nonce, String message, Throwable cause) {
        super(message, cause);
        this.txHash = txHash;
        this.nonce = nonce;
    }

    public String getTxHash() {
        return txHash;
    }

    public long getNonce() {
        return nonce;
    }
}
