package com.capflow.api.exception;

/**
 * 重试耗尽
 * 包装最后一次失败的原因
 */
public class MaxRetriesExceededException extends CapFlowException {

    private final int attempts;
    private final String lastReason;

    public MaxRetriesExceededException(int attempts, String lastReason, Throwable lastFailure) {
        super(ErrorCode.MAX_RETRIES_EXCEEDED,
                "Max retries exceeded after " + attempts + " attempts, last reason: " + lastReason,
                lastFailure);
        this.attempts = attempts;
        this.lastReason = lastReason;
    }

    /**
     * 实际执行的总次数（首次 + 重试）
     */
    public int getAttempts() {
        return attempts;
    }

    public String getLastReason() {
        return lastReason;
    }
}
