package com.capflow.core.catalog;

import com.capflow.api.catalog.CapabilityDescriptor;
import com.capflow.api.catalog.CapabilityFunction;
import com.capflow.api.catalog.EffectSpec;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 能力目录条目，注册后不再变更
 *
 * @param id           能力 ID
 * @param intent       自由文本意图描述
 * @param requires     输入必须包含的字段
 * @param provides     输出保证包含的字段
 * @param effects      副作用声明
 * @param attributes   额外属性
 * @param module       声明该能力的单元
 * @param execute      执行体，可为空
 * @param registeredAt 注册时间
 */
public record CatalogEntry(String id,
                           String intent,
                           List<String> requires,
                           List<String> provides,
                           List<EffectSpec> effects,
                           Map<String, Object> attributes,
                           Object module,
                           CapabilityFunction execute,
                           Instant registeredAt) {

    public static final String FIELD_ID = "id";
    public static final String FIELD_INTENT = "intent";
    public static final String FIELD_REQUIRES = "requires";
    public static final String FIELD_PROVIDES = "provides";
    public static final String FIELD_MODULE = "module";

    public CatalogEntry {
        Objects.requireNonNull(id, "id");
        requires = requires == null ? List.of() : List.copyOf(requires);
        provides = provides == null ? List.of() : List.copyOf(provides);
        effects = effects == null ? List.of() : List.copyOf(effects);
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    static CatalogEntry of(CapabilityDescriptor descriptor, Object module, Instant registeredAt) {
        return new CatalogEntry(descriptor.getId(), descriptor.getIntent(), descriptor.getRequires(),
                descriptor.getProvides(), descriptor.getEffects(), descriptor.getAttributes(),
                module, descriptor.getExecute(), registeredAt);
    }

    public Optional<CapabilityFunction> executeFunction() {
        return Optional.ofNullable(execute);
    }

    /**
     * 结构化查询中的字段相等判断
     * module 既可与单元对象比较，也可与其类名比较；其他未知键查 attributes
     */
    boolean fieldEquals(String key, Object expected) {
        switch (key) {
            case FIELD_ID:
                return Objects.equals(id, expected);
            case FIELD_MODULE:
                if (Objects.equals(module, expected)) {
                    return true;
                }
                if (module == null) {
                    return false;
                }
                if (expected instanceof Class<?> type) {
                    return type.isInstance(module);
                }
                return expected instanceof String name
                        && (name.equals(module.getClass().getName()) || name.equals(module.getClass().getSimpleName()));
            default:
                return attributes.containsKey(key) && Objects.equals(attributes.get(key), expected);
        }
    }
}
