package com.capflow.api.component;

/**
 * 组件健康状态
 */
public enum Health {
    HEALTHY(0.3),
    DEGRADED(0.0),
    UNHEALTHY(-1.0),
    UNKNOWN(-0.2);

    private final double scoreBonus;

    Health(double scoreBonus) {
        this.scoreBonus = scoreBonus;
    }

    /**
     * 发现打分时的健康加分
     */
    public double scoreBonus() {
        return scoreBonus;
    }
}
