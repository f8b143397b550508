package com.capflow.api.exception;

/**
 * 负载均衡候选集为空
 */
public class NoAvailableTargetsException extends CapFlowException {

    public NoAvailableTargetsException(String detail) {
        super(ErrorCode.NO_AVAILABLE_TARGETS, "No available targets: " + detail);
    }
}
