package com.capflow.api.exception;

import java.util.List;

/**
 * 能力执行失败（契约校验或函数本身出错）
 */
public class CapabilityExecutionException extends CapFlowException {

    private final String capabilityId;
    private final List<String> fields;

    public CapabilityExecutionException(ErrorCode errorCode, String capabilityId, List<String> fields) {
        super(errorCode, String.format("Capability [%s] failed: %s %s", capabilityId, errorCode.reason(), fields));
        this.capabilityId = capabilityId;
        this.fields = List.copyOf(fields);
    }

    public CapabilityExecutionException(String capabilityId, Throwable cause) {
        super(ErrorCode.EXECUTION_FAILED,
                String.format("Capability [%s] execution failed: %s", capabilityId, cause.getMessage()), cause);
        this.capabilityId = capabilityId;
        this.fields = List.of();
    }

    public String getCapabilityId() {
        return capabilityId;
    }

    /**
     * 缺失的字段（仅契约校验失败时非空）
     */
    public List<String> getFields() {
        return fields;
    }
}
