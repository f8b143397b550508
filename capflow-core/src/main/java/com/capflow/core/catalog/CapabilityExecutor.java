package com.capflow.core.catalog;

import com.capflow.api.catalog.CapabilityFunction;
import com.capflow.api.catalog.EffectSpec;
import com.capflow.api.exception.CapabilityExecutionException;
import com.capflow.api.exception.ErrorCode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.event.Level;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 能力执行器
 * <p>
 * 执行顺序：输入契约校验 → before 阶段副作用 → 执行体 → after 阶段副作用 → 输出契约校验
 * </p>
 */
@Slf4j
public class CapabilityExecutor {

    public static final String CONTEXT_CAPABILITY_ID = "capability_id";
    public static final String CONTEXT_EXECUTION_TIME = "execution_time";

    static final String DEFAULT_METRIC_NAME = "capability_execution";

    private static final String SOURCE = "catalog";

    private final CapabilityCatalog catalog;
    @Getter
    private final CapabilityMetrics metrics;

    public CapabilityExecutor(CapabilityCatalog catalog, CapabilityMetrics metrics) {
        this.catalog = catalog;
        this.metrics = metrics != null ? metrics : new CapabilityMetrics();
    }

    /**
     * 执行能力
     *
     * @throws com.capflow.api.exception.CapabilityNotFoundException ID 不存在
     * @throws CapabilityExecutionException                          无执行体、契约不满足或执行体抛出异常
     */
    public Map<String, Object> execute(String capabilityId, Map<String, Object> payload, Map<String, Object> context) {
        CatalogEntry entry = catalog.get(capabilityId);
        CapabilityFunction function = entry.executeFunction()
                .orElseThrow(() -> new CapabilityExecutionException(ErrorCode.NO_EXECUTE_FUNCTION, capabilityId, List.of()));

        Map<String, Object> input = payload != null ? payload : Map.of();
        List<String> missingInput = missing(entry.requires(), input);
        if (!missingInput.isEmpty()) {
            throw new CapabilityExecutionException(ErrorCode.MISSING_REQUIRED_FIELDS, capabilityId, missingInput);
        }

        Map<String, Object> effectContext = new LinkedHashMap<>();
        if (context != null) {
            effectContext.putAll(context);
        }
        effectContext.put(CONTEXT_CAPABILITY_ID, capabilityId);

        applyEffects(entry, Phase.BEFORE, input, effectContext);

        long start = System.nanoTime();
        Map<String, Object> output;
        try {
            output = function.execute(input, Collections.unmodifiableMap(new LinkedHashMap<>(effectContext)));
        } catch (Exception e) {
            log.warn("[{}] Capability {} threw {}", SOURCE, capabilityId, e.toString());
            throw new CapabilityExecutionException(capabilityId, e);
        }
        long executionTime = (System.nanoTime() - start) / 1_000_000L;
        if (output == null) {
            output = Map.of();
        }

        effectContext.put(CONTEXT_EXECUTION_TIME, executionTime);
        applyEffects(entry, Phase.AFTER, output, effectContext);

        List<String> missingOutput = missing(entry.provides(), output);
        if (!missingOutput.isEmpty()) {
            throw new CapabilityExecutionException(ErrorCode.MISSING_PROVIDED_FIELDS, capabilityId, missingOutput);
        }
        return output;
    }

    private static List<String> missing(List<String> fields, Map<String, Object> data) {
        List<String> missing = new ArrayList<>();
        for (String field : fields) {
            if (!data.containsKey(field)) {
                missing.add(field);
            }
        }
        return missing;
    }

    private void applyEffects(CatalogEntry entry, Phase phase, Map<String, Object> data, Map<String, Object> context) {
        for (EffectSpec effect : entry.effects()) {
            switch (effect.type()) {
                case EffectSpec.AUDIT_LOG -> audit(effect, phase, data, context);
                case EffectSpec.METRICS -> recordMetric(effect, phase, context);
                default -> log.trace("[{}] Unknown effect {} ignored", SOURCE, effect.type());
            }
        }
    }

    private void audit(EffectSpec effect, Phase phase, Map<String, Object> data, Map<String, Object> context) {
        log.atLevel(levelOf(effect.option("level", "info")))
                .log("[AUDIT] Capability={}, Phase={}, Data={}, Context={}",
                        context.get(CONTEXT_CAPABILITY_ID), phase.key, data, context);
    }

    private void recordMetric(EffectSpec effect, Phase phase, Map<String, Object> context) {
        if (phase != Phase.AFTER) {
            return;
        }
        String name = effect.option("name", DEFAULT_METRIC_NAME);
        switch (effect.option("type", "counter")) {
            case "counter" -> metrics.increment(name);
            case "histogram" -> {
                Object time = context.get(CONTEXT_EXECUTION_TIME);
                metrics.record(name, time instanceof Number n ? n.longValue() : 0L);
            }
            default -> log.trace("[{}] Unknown metric type for {}", SOURCE, name);
        }
    }

    static Level levelOf(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if ("WARNING".equals(normalized)) {
            return Level.WARN;
        }
        try {
            return Level.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return Level.INFO;
        }
    }

    private enum Phase {
        BEFORE("before"),
        AFTER("after");

        private final String key;

        Phase(String key) {
            this.key = key;
        }
    }
}
