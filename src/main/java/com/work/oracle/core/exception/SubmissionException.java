package com.work.oracle.core.exception;

/**
 * 交易提交失败：发送前被拒、上链后 revert、或等待打包超时（见 {@link UnconfirmedSubmissionException}）。
 * <p>
 * partial=true 表示状态迁移已上链而资金划转失败，需要人工对账。
 */
public class SubmissionException extends SettlementException {

    private final boolean partial;

    public SubmissionException(String message) {
        this(message, null, false);
    }

    public SubmissionException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public SubmissionException(String message, Throwable cause, boolean partial) {
        super(ErrorKind.SUBMISSION, message, cause);
        this.partial = partial;
    }

    public boolean isPartial() {
        return partial;
    }
}
