package com.capflow.api.exception;

/**
 * 不支持的组合策略
 */
public class UnsupportedCompositionPatternException extends CapFlowException {

    private final String pattern;

    public UnsupportedCompositionPatternException(String pattern) {
        super(ErrorCode.UNSUPPORTED_COMPOSITION_PATTERN, "Unsupported composition pattern: " + pattern);
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}
