package com.capflow.api.exception;

/**
 * CapFlow 基础异常
 *
 * @author CapFlow
 */
public class CapFlowException extends RuntimeException {

    private final ErrorCode errorCode;

    public CapFlowException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CapFlowException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * 失败原因（默认为错误码标识，子类可覆盖为更具体的原因）
     */
    public String getReason() {
        return errorCode.reason();
    }
}
