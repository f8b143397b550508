package com.capflow.api.exception;

/**
 * 委派目标不存在
 */
public class TargetProcessorNotFoundException extends CapFlowException {

    public TargetProcessorNotFoundException(String targetId) {
        super(ErrorCode.TARGET_PROCESSOR_NOT_FOUND, "Target processor not found: " + targetId);
    }
}
