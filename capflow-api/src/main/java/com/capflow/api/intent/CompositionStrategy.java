package com.capflow.api.intent;

import com.capflow.api.exception.UnsupportedCompositionPatternException;

/**
 * 组合策略
 */
public enum CompositionStrategy {
    /**
     * 按顺序逐个派发，失败即停（不回滚已成功的步骤）
     */
    SEQUENTIAL("sequential"),
    /**
     * 并发派发，收集全部结果，结果顺序与输入一致
     */
    PARALLEL("parallel"),
    /**
     * 顺序执行，每步后由调用方谓词决定是否继续
     */
    CONDITIONAL("conditional"),
    /**
     * 顺序执行，上一步输出作为下一步输入，返回合并后的单一结果
     */
    PIPELINE("pipeline"),
    /**
     * 将同一组意图广播到多个目标
     */
    FAN_OUT("fan_out");

    private final String key;

    CompositionStrategy(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * 按名称解析，未知名称抛出 {@link UnsupportedCompositionPatternException}
     */
    public static CompositionStrategy of(String name) {
        if (name != null) {
            for (CompositionStrategy strategy : values()) {
                if (strategy.key.equalsIgnoreCase(name) || strategy.name().equalsIgnoreCase(name)) {
                    return strategy;
                }
            }
        }
        throw new UnsupportedCompositionPatternException(name);
    }
}
