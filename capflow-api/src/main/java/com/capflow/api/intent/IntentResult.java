package com.capflow.api.intent;

import com.capflow.api.exception.CapFlowException;
import com.capflow.api.exception.ErrorCode;

/**
 * 单个意图的派发结果
 * 成功时 value 为目标返回值；失败时 errorCode / reason 描述原因
 */
public record IntentResult(String intentId,
                           String targetId,
                           Object value,
                           ErrorCode errorCode,
                           String reason,
                           Throwable cause,
                           long durationMs) {

    public static IntentResult success(String intentId, String targetId, Object value, long durationMs) {
        return new IntentResult(intentId, targetId, value, null, null, null, durationMs);
    }

    public static IntentResult failure(String intentId, String targetId, CapFlowException error, long durationMs) {
        return new IntentResult(intentId, targetId, null, error.getErrorCode(), error.getReason(), error, durationMs);
    }

    public static IntentResult failure(String intentId, String targetId, Throwable error, long durationMs) {
        if (error instanceof CapFlowException capFlowException) {
            return failure(intentId, targetId, capFlowException, durationMs);
        }
        return new IntentResult(intentId, targetId, null, ErrorCode.DISPATCH_FAILED,
                String.valueOf(error.getMessage()), error, durationMs);
    }

    public boolean isSuccess() {
        return errorCode == null;
    }
}
