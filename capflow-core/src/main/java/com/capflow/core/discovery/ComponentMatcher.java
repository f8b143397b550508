package com.capflow.core.discovery;

import com.capflow.api.component.Health;
import com.capflow.api.security.CapabilityAlgebra;

/**
 * 组件匹配与打分（纯函数，不持有状态）
 * <p>
 * 得分规则：
 * <ul>
 * <li>基础分 1.0</li>
 * <li>类型精确匹配 +0.5</li>
 * <li>给出了能力条件：全部满足 +1.0，否则 -0.5</li>
 * <li>健康加分：healthy +0.3 / degraded 0 / unhealthy -1.0 / unknown -0.2</li>
 * <li>版本加分：major*0.1 + minor*0.01 + patch*0.001（偏向新版本）</li>
 * </ul>
 */
public class ComponentMatcher {

    static final double BASE_SCORE = 1.0;
    static final double TYPE_MATCH_BONUS = 0.5;
    static final double CAPABILITY_MATCH_BONUS = 1.0;
    static final double CAPABILITY_MISMATCH_PENALTY = -0.5;

    private final CapabilityAlgebra algebra;

    public ComponentMatcher(CapabilityAlgebra algebra) {
        this.algebra = algebra != null ? algebra : CapabilityAlgebra.standard();
    }

    /**
     * 除健康外的全部条件（健康需要探测，由调用方在过滤后再补）
     */
    public boolean matchesStatic(ComponentRecord record, DiscoveryPattern pattern) {
        ComponentMetadata metadata = record.metadata();
        if (pattern.name() != null
                && !record.name().contains(pattern.name())
                && !record.id().contains(pattern.name())) {
            return false;
        }
        if (pattern.type() != null && !pattern.type().equals(metadata.type())) {
            return false;
        }
        if (pattern.version() != null && !pattern.version().equals(metadata.version())) {
            return false;
        }
        if (pattern.capabilities() != null
                && !algebra.validateAll(pattern.capabilities(), metadata.capabilitiesOrEmpty())) {
            return false;
        }
        return pattern.tags() == null || metadata.tagsOrEmpty().containsAll(pattern.tags());
    }

    public boolean matches(ComponentRecord record, Health health, DiscoveryPattern pattern) {
        return matchesStatic(record, pattern) && (pattern.health() == null || pattern.health() == health);
    }

    public double score(ComponentRecord record, Health health, DiscoveryPattern pattern) {
        ComponentMetadata metadata = record.metadata();
        double score = BASE_SCORE;

        if (pattern.type() != null && pattern.type().equals(metadata.type())) {
            score += TYPE_MATCH_BONUS;
        }

        if (pattern.capabilities() != null && !pattern.capabilities().isEmpty()) {
            boolean satisfied = algebra.validateAll(pattern.capabilities(), metadata.capabilitiesOrEmpty());
            score += satisfied ? CAPABILITY_MATCH_BONUS : CAPABILITY_MISMATCH_PENALTY;
        }

        score += (health != null ? health : Health.UNKNOWN).scoreBonus();
        score += versionBonus(metadata.version());
        return score;
    }

    /**
     * major*0.1 + minor*0.01 + patch*0.001，无法解析的部分按 0 计
     */
    static double versionBonus(String version) {
        if (version == null || version.isBlank()) {
            return 0.0;
        }
        // 去掉预发布/构建后缀：1.2.3-beta+7 -> 1.2.3
        String core = version.split("[-+]", 2)[0];
        String[] parts = core.split("\\.");
        double[] weights = {0.1, 0.01, 0.001};
        double bonus = 0.0;
        for (int i = 0; i < weights.length && i < parts.length; i++) {
            bonus += parsePart(parts[i]) * weights[i];
        }
        return bonus;
    }

    private static int parsePart(String part) {
        try {
            return Integer.parseInt(part.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
