package com.capflow.core.config;

import com.capflow.core.compose.RetryPolicy;
import com.capflow.core.discovery.LoadBalancingStrategy;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * YAML 配置加载器
 * <p>
 * 支持根节点直接写配置项，或放在 {@code capflow:} 节点下：
 * </p>
 * <pre>
 * capflow:
 *   dispatchTimeout: PT5S
 *   healthCacheTtl: 30000
 *   defaultLoadBalancing: least_connections
 *   retry:
 *     maxRetries: 3
 *     retryDelay: 100
 *     exponentialBackoff: true
 *     maxDelay: PT5S
 * </pre>
 * 时长既可以是 ISO-8601，也可以是毫秒整数。未知键只记录日志。
 */
@Slf4j
public class CapFlowConfigLoader {

    private static final String ROOT = "capflow";

    private CapFlowConfigLoader() {
    }

    /**
     * 从类路径加载，资源不存在时返回默认配置
     */
    public static CapFlowConfig loadFromClasspath(String resource) {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = CapFlowConfigLoader.class.getClassLoader();
        }
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                log.info("Config resource {} not found, using defaults", resource);
                return CapFlowConfig.defaults();
            }
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read config resource " + resource, e);
        }
    }

    public static CapFlowConfig load(InputStream inputStream) {
        Reader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8);
        Yaml yaml = new Yaml(new LoaderOptions());
        Object document = yaml.load(reader);
        return fromMap(asMap(document));
    }

    static CapFlowConfig fromMap(Map<String, Object> raw) {
        CapFlowConfig config = CapFlowConfig.defaults();
        if (raw == null) {
            return config;
        }
        Map<String, Object> values = raw.containsKey(ROOT) ? asMap(raw.get(ROOT)) : raw;
        if (values == null) {
            return config;
        }

        for (Map.Entry<String, Object> entry : values.entrySet()) {
            Object value = entry.getValue();
            switch (entry.getKey()) {
                case "dispatchTimeout" -> config.setDispatchTimeout(toDuration(entry.getKey(), value));
                case "cancelOnTimeout" -> config.setCancelOnTimeout(toBoolean(value));
                case "dispatchThreads" -> config.setDispatchThreads(toInt(entry.getKey(), value));
                case "enforceCapabilities" -> config.setEnforceCapabilities(toBoolean(value));
                case "defaultTargetId" -> config.setDefaultTargetId(value != null ? value.toString() : null);
                case "defaultLoadBalancing" -> config.setDefaultLoadBalancing(LoadBalancingStrategy.of(String.valueOf(value)));
                case "healthProbeTimeout" -> config.setHealthProbeTimeout(toDuration(entry.getKey(), value));
                case "healthCacheTtl" -> config.setHealthCacheTtl(toDuration(entry.getKey(), value));
                case "serviceCallTimeout" -> config.setServiceCallTimeout(toDuration(entry.getKey(), value));
                case "autoDiscoverCapabilities" -> config.setAutoDiscoverCapabilities(toBoolean(value));
                case "retry" -> config.setDefaultRetry(toRetryPolicy(asMap(value)));
                default -> log.warn("Ignoring unknown config key: {}", entry.getKey());
            }
        }
        return config;
    }

    private static RetryPolicy toRetryPolicy(Map<String, Object> values) {
        RetryPolicy defaults = RetryPolicy.defaults();
        if (values == null) {
            return defaults;
        }
        int maxRetries = values.containsKey("maxRetries")
                ? toInt("retry.maxRetries", values.get("maxRetries")) : defaults.maxRetries();
        Duration retryDelay = values.containsKey("retryDelay")
                ? toDuration("retry.retryDelay", values.get("retryDelay")) : defaults.retryDelay();
        boolean exponential = values.containsKey("exponentialBackoff")
                ? toBoolean(values.get("exponentialBackoff")) : defaults.exponentialBackoff();
        Duration maxDelay = values.containsKey("maxDelay")
                ? toDuration("retry.maxDelay", values.get("maxDelay")) : defaults.maxDelay();
        return new RetryPolicy(maxRetries, retryDelay, exponential, maxDelay);
    }

    static Duration toDuration(String key, Object value) {
        if (value instanceof Number number) {
            return Duration.ofMillis(number.longValue());
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            if (trimmed.startsWith("P") || trimmed.startsWith("p")) {
                return Duration.parse(trimmed.toUpperCase());
            }
            try {
                return Duration.ofMillis(Long.parseLong(trimmed));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid duration for " + key + ": " + text, e);
            }
        }
        throw new IllegalArgumentException("Invalid duration for " + key + ": " + value);
    }

    private static int toInt(String key, Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        return Boolean.parseBoolean(String.valueOf(value));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new IllegalArgumentException("Expected a mapping but got: " + value.getClass().getSimpleName());
    }
}
