package com.capflow.core.router;

import com.capflow.api.intent.Intent;
import com.capflow.core.discovery.DiscoveryPattern;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * 路由规则：(谓词, 目标类别)
 *
 * @param name      规则名，用于日志
 * @param predicate 意图是否命中
 * @param pattern   命中后交给发现服务的查询条件
 */
public record RoutingRule(String name, Predicate<Intent> predicate, DiscoveryPattern pattern) {

    public RoutingRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(pattern, "pattern");
    }

    public boolean matches(Intent intent) {
        return predicate.test(intent);
    }
}
