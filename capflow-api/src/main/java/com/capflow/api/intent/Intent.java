package com.capflow.api.intent;

import com.capflow.api.security.Capability;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 意图：对某种效果的请求
 * <p>
 * 不可变值对象，所有 with* 方法都返回新实例。由 {@link IntentFactory} 创建，
 * 由路由/组合器消费，从不持久化。
 * </p>
 *
 * @param id           全局唯一 ID
 * @param type         意图类型标签，例如 "ReadFileIntent"
 * @param payload      业务参数
 * @param capabilities 处理该意图所需的能力
 * @param metadata     标记位，例如 dynamic / composite / delegated_to
 */
public record Intent(String id,
                     String type,
                     Map<String, Object> payload,
                     List<Capability> capabilities,
                     Map<String, Object> metadata) implements Serializable {

    public static final String META_DYNAMIC = "dynamic";
    public static final String META_COMPOSITE = "composite";
    public static final String META_DELEGATED_TO = "delegated_to";

    public Intent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        payload = freeze(payload);
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        metadata = freeze(metadata);
    }

    public Intent withMetadata(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new Intent(id, type, payload, capabilities, copy);
    }

    public Intent withPayload(Map<String, Object> newPayload) {
        return new Intent(id, type, newPayload, capabilities, metadata);
    }

    public Intent withType(String newType) {
        return new Intent(id, newType, payload, capabilities, metadata);
    }

    /**
     * 委派目标（经 delegate 后才存在）
     */
    public Optional<String> delegatedTo() {
        Object target = metadata.get(META_DELEGATED_TO);
        return target == null ? Optional.empty() : Optional.of(target.toString());
    }

    public boolean isDynamic() {
        return Boolean.TRUE.equals(metadata.get(META_DYNAMIC));
    }

    private static Map<String, Object> freeze(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
