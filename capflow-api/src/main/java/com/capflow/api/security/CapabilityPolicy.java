package com.capflow.api.security;

import java.util.Map;

/**
 * 上下文能力策略
 * 根据调用上下文（时间、租户、来源等）决定能力是否可用
 */
@FunctionalInterface
public interface CapabilityPolicy {

    boolean permits(Capability capability, Map<String, Object> context);

    default CapabilityPolicy and(CapabilityPolicy other) {
        return (capability, context) -> permits(capability, context) && other.permits(capability, context);
    }
}
