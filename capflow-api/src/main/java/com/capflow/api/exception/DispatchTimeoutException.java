package com.capflow.api.exception;

import java.time.Duration;

/**
 * 派发超时
 * 注意：超时并不保证目标侧的执行已被取消
 */
public class DispatchTimeoutException extends CapFlowException {

    private final Duration timeout;

    public DispatchTimeoutException(String intentId, String targetId, Duration timeout) {
        super(ErrorCode.TIMEOUT, String.format("Dispatch of intent %s to %s timed out after %dms",
                intentId, targetId, timeout.toMillis()));
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
