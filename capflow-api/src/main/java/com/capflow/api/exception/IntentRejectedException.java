package com.capflow.api.exception;

/**
 * 意图被校验拒绝
 * <p>
 * 插件在 validate / transform 钩子中抛出此异常时，reason 会被原样透传给调用方，
 * 例如 "invalid_path"；未给出原因时记为 validation_failed。
 * </p>
 */
public class IntentRejectedException extends CapFlowException {

    private final String reason;

    public IntentRejectedException(String reason) {
        this(reason, "Intent rejected: " + reason);
    }

    public IntentRejectedException(String reason, String message) {
        super(ErrorCode.VALIDATION_FAILED, message);
        this.reason = reason != null ? reason : ErrorCode.VALIDATION_FAILED.reason();
    }

    public IntentRejectedException(String reason, String message, Throwable cause) {
        super(ErrorCode.VALIDATION_FAILED, message, cause);
        this.reason = reason != null ? reason : ErrorCode.VALIDATION_FAILED.reason();
    }

    @Override
    public String getReason() {
        return reason;
    }
}
