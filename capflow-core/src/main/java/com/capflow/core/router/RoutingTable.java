package com.capflow.core.router;

import com.capflow.api.intent.Intent;
import com.capflow.core.discovery.DiscoveryPattern;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 意图分类表
 * <p>
 * 按顺序匹配规则，第一个命中的规则决定目标类别；均未命中时使用默认类别。
 * 表本身不可变，可安全地在多个路由器之间共享。
 * </p>
 */
public final class RoutingTable {

    public static final String FILE_TYPE = "file";
    public static final String USER_TYPE = "user";
    public static final String DEFAULT_TYPE = "default";

    @Getter
    private final List<RoutingRule> rules;

    @Getter
    private final DiscoveryPattern defaultPattern;

    // 路由无匹配时的兜底组件
    private final String defaultTargetId;

    private RoutingTable(Builder builder) {
        this.rules = List.copyOf(builder.rules);
        this.defaultPattern = builder.defaultPattern;
        this.defaultTargetId = builder.defaultTargetId;
    }

    /**
     * 默认表：类型名含 "File" 交给文件类组件，含 "User" 交给用户类组件，其余交给默认类组件
     */
    public static RoutingTable standard() {
        return builder()
                .typeContains("File", FILE_TYPE)
                .typeContains("User", USER_TYPE)
                .defaultPattern(DiscoveryPattern.ofType(DEFAULT_TYPE))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 分类：返回第一个命中规则的查询条件
     */
    public DiscoveryPattern classify(Intent intent) {
        for (RoutingRule rule : rules) {
            if (rule.matches(intent)) {
                return rule.pattern();
            }
        }
        return defaultPattern;
    }

    public Optional<String> getDefaultTargetId() {
        return Optional.ofNullable(defaultTargetId);
    }

    public static final class Builder {
        private final List<RoutingRule> rules = new ArrayList<>();
        private DiscoveryPattern defaultPattern = DiscoveryPattern.ofType(DEFAULT_TYPE);
        private String defaultTargetId;

        private Builder() {
        }

        public Builder rule(String name, Predicate<Intent> predicate, DiscoveryPattern pattern) {
            rules.add(new RoutingRule(name, predicate, pattern));
            return this;
        }

        /**
         * 类型名包含片段时路由到指定组件类型
         */
        public Builder typeContains(String fragment, String componentType) {
            Objects.requireNonNull(fragment, "fragment");
            return rule("type-contains-" + fragment,
                    intent -> intent.type().contains(fragment),
                    DiscoveryPattern.ofType(componentType));
        }

        public Builder defaultPattern(DiscoveryPattern pattern) {
            this.defaultPattern = Objects.requireNonNull(pattern, "pattern");
            return this;
        }

        public Builder defaultTargetId(String targetId) {
            this.defaultTargetId = targetId;
            return this;
        }

        public RoutingTable build() {
            return new RoutingTable(this);
        }
    }
}
