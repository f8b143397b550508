package com.capflow.core.router;

import com.capflow.core.discovery.LoadBalancingStrategy;

import java.time.Duration;

/**
 * 单次派发的可选参数，字段为 null 时使用配置默认值
 *
 * @param timeout       等待目标响应的上限
 * @param loadBalancing 路由时的负载均衡策略
 */
public record DispatchOptions(Duration timeout, LoadBalancingStrategy loadBalancing) {

    private static final DispatchOptions DEFAULTS = new DispatchOptions(null, null);

    public static DispatchOptions defaults() {
        return DEFAULTS;
    }

    public static DispatchOptions withTimeout(Duration timeout) {
        return new DispatchOptions(timeout, null);
    }
}
