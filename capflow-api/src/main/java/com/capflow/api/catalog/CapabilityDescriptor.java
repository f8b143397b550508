package com.capflow.api.catalog;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;
import java.util.Map;

/**
 * 能力声明
 * <p>
 * 一个能力单元声明的单项能力：自由文本意图描述 + 输入/输出契约 + 副作用。
 * </p>
 * <pre>{@code
 * CapabilityDescriptor.builder()
 *         .id("user_transform")
 *         .intent("Transform user data with specified operations")
 *         .require("user_id").require("operations")
 *         .provide("transformed_user").provide("operation_log")
 *         .effect(EffectSpec.auditLog("info"))
 *         .execute((payload, context) -> ...)
 *         .build();
 * }</pre>
 */
@Getter
@Builder
public class CapabilityDescriptor {

    private final String id;

    private final String intent;

    @Singular("require")
    private final List<String> requires;

    @Singular("provide")
    private final List<String> provides;

    @Singular
    private final List<EffectSpec> effects;

    // 额外属性，可在结构化发现中按相等匹配
    @Singular
    private final Map<String, Object> attributes;

    // 可选执行体
    private final CapabilityFunction execute;
}
