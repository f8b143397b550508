package com.capflow.api.exception;

/**
 * 错误码
 * 与异常类型一一对应，用于在结果对象中携带失败原因
 *
 * @author CapFlow
 */
public enum ErrorCode {
    NOT_FOUND("not_found"),
    NO_AVAILABLE_TARGETS("no_available_targets"),
    NO_ROUTE("no_route"),
    UNSUPPORTED_COMPOSITION_PATTERN("unsupported_composition_pattern"),
    TARGET_PROCESSOR_NOT_FOUND("target_processor_not_found"),
    COMPONENT_NOT_REGISTERED("component_not_registered"),
    TIMEOUT("timeout"),
    MAX_RETRIES_EXCEEDED("max_retries_exceeded"),
    VALIDATION_FAILED("validation_failed"),
    DISPATCH_FAILED("dispatch_failed"),
    COMPOSITION_FAILED("composition_failed"),

    // 能力执行
    NO_EXECUTE_FUNCTION("no_execute_function"),
    MISSING_REQUIRED_FIELDS("missing_required_fields"),
    MISSING_PROVIDED_FIELDS("missing_provided_fields"),
    EXECUTION_FAILED("execution_failed");

    private final String reason;

    ErrorCode(String reason) {
        this.reason = reason;
    }

    /**
     * 对外暴露的原因标识
     */
    public String reason() {
        return reason;
    }
}
