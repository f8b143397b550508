package com.capflow.api.exception;

/**
 * 意图无法解析到任何目标，且没有注册默认目标
 */
public class NoRouteException extends CapFlowException {

    public NoRouteException(String intentType) {
        super(ErrorCode.NO_ROUTE, "No route for intent type: " + intentType);
    }
}
