package com.capflow.api.catalog;

import java.util.Map;

/**
 * 能力的执行体
 */
@FunctionalInterface
public interface CapabilityFunction {

    Map<String, Object> execute(Map<String, Object> payload, Map<String, Object> context) throws Exception;
}
