package com.capflow.api.catalog;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 能力声明的副作用，例如审计日志、指标
 *
 * @param type    效果类型，内置 audit_log / metrics
 * @param options 效果参数
 */
public record EffectSpec(String type, Map<String, Object> options) implements Serializable {

    public static final String AUDIT_LOG = "audit_log";
    public static final String METRICS = "metrics";

    public EffectSpec {
        Objects.requireNonNull(type, "type");
        options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public static EffectSpec auditLog(String level) {
        return new EffectSpec(AUDIT_LOG, Map.of("level", level));
    }

    public static EffectSpec counter(String name) {
        return new EffectSpec(METRICS, Map.of("type", "counter", "name", name));
    }

    public static EffectSpec histogram(String name) {
        return new EffectSpec(METRICS, Map.of("type", "histogram", "name", name));
    }

    public String option(String key, String defaultValue) {
        Object value = options.get(key);
        return value != null ? value.toString() : defaultValue;
    }
}
