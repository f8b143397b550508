package com.capflow.api.exception;

/**
 * 能力目录查询未命中
 */
public class CapabilityNotFoundException extends CapFlowException {

    public CapabilityNotFoundException(String capabilityId) {
        super(ErrorCode.NOT_FOUND, "Capability not found: " + capabilityId);
    }
}
