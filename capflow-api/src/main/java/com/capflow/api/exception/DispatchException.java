package com.capflow.api.exception;

/**
 * 目标处理意图时失败
 */
public class DispatchException extends CapFlowException {

    public DispatchException(String message) {
        super(ErrorCode.DISPATCH_FAILED, message);
    }

    public DispatchException(String message, Throwable cause) {
        super(ErrorCode.DISPATCH_FAILED, message, cause);
    }
}
