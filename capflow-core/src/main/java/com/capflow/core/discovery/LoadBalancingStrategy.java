package com.capflow.core.discovery;

/**
 * 负载均衡策略
 */
public enum LoadBalancingStrategy {
    /**
     * 单调计数器对候选数取模，计数跨调用保留
     */
    ROUND_ROBIN("round_robin"),
    /**
     * 选择已记录连接数最少的组件，并为其计数 +1
     */
    LEAST_CONNECTIONS("least_connections"),
    /**
     * 按发现得分加权随机
     */
    WEIGHTED_ROUND_ROBIN("weighted_round_robin"),
    /**
     * 均匀随机
     */
    RANDOM("random");

    private final String key;

    LoadBalancingStrategy(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static LoadBalancingStrategy of(String name) {
        for (LoadBalancingStrategy strategy : values()) {
            if (strategy.key.equalsIgnoreCase(name) || strategy.name().equalsIgnoreCase(name)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown load balancing strategy: " + name);
    }
}
