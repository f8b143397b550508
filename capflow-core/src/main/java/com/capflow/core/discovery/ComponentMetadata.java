package com.capflow.core.discovery;

import com.capflow.api.security.Capability;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 组件元数据
 * <p>
 * 字段为 null 表示"未设置"：注册时由推导值补齐，更新时表示保留原值。
 * </p>
 *
 * @param type         组件类型，例如 "file"
 * @param version      语义化版本号
 * @param capabilities 组件提供的能力
 * @param dependencies 依赖的其他组件 ID
 * @param tags         标签
 * @param interfaces   句柄实现的接口
 * @param attributes   其他扩展属性
 */
@Builder(toBuilder = true)
public record ComponentMetadata(String type,
                                String version,
                                List<Capability> capabilities,
                                List<String> dependencies,
                                Set<String> tags,
                                List<String> interfaces,
                                Map<String, Object> attributes) {

    public static final String DEFAULT_VERSION = "1.0.0";

    public ComponentMetadata {
        capabilities = capabilities == null ? null : List.copyOf(capabilities);
        dependencies = dependencies == null ? null : List.copyOf(dependencies);
        tags = tags == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        interfaces = interfaces == null ? null : List.copyOf(interfaces);
        attributes = attributes == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static ComponentMetadata empty() {
        return ComponentMetadata.builder().build();
    }

    /**
     * 浅合并：override 中非空字段覆盖当前值，attributes 按键合并
     */
    public ComponentMetadata mergedWith(ComponentMetadata override) {
        if (override == null) {
            return this;
        }
        Map<String, Object> mergedAttributes = attributes;
        if (override.attributes != null) {
            Map<String, Object> merged = new LinkedHashMap<>();
            if (attributes != null) {
                merged.putAll(attributes);
            }
            merged.putAll(override.attributes);
            mergedAttributes = merged;
        }
        return new ComponentMetadata(
                override.type != null ? override.type : type,
                override.version != null ? override.version : version,
                override.capabilities != null ? override.capabilities : capabilities,
                override.dependencies != null ? override.dependencies : dependencies,
                override.tags != null ? override.tags : tags,
                override.interfaces != null ? override.interfaces : interfaces,
                mergedAttributes);
    }

    public List<Capability> capabilitiesOrEmpty() {
        return capabilities != null ? capabilities : List.of();
    }

    public Set<String> tagsOrEmpty() {
        return tags != null ? tags : Set.of();
    }
}
