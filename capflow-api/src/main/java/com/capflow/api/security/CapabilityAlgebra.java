package com.capflow.api.security;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 能力运算
 * <p>
 * 基于 {@link ActionLattice} 提供蕴含、闭包、集合合并、校验、委派/撤销、
 * 时效与上下文校验。实例不可变且无共享状态，可随意注入与并发使用。
 * </p>
 *
 * @author CapFlow
 */
public final class CapabilityAlgebra {

    private static final CapabilityAlgebra STANDARD =
            new CapabilityAlgebra(ActionLattice.defaults(), CapabilityPolicies.allowAll());

    private final ActionLattice lattice;
    private final CapabilityPolicy contextPolicy;

    public CapabilityAlgebra(ActionLattice lattice, CapabilityPolicy contextPolicy) {
        this.lattice = lattice != null ? lattice : ActionLattice.defaults();
        this.contextPolicy = contextPolicy != null ? contextPolicy : CapabilityPolicies.allowAll();
    }

    /**
     * 默认动作格、无上下文限制
     */
    public static CapabilityAlgebra standard() {
        return STANDARD;
    }

    public CapabilityAlgebra withContextPolicy(CapabilityPolicy policy) {
        return new CapabilityAlgebra(lattice, policy);
    }

    public ActionLattice lattice() {
        return lattice;
    }

    // ==================== 蕴含 ====================

    public boolean implies(Capability a, Capability b) {
        return lattice.implies(a, b);
    }

    /**
     * 能力蕴含的全部其他能力（不含自身）
     * 例如 admin(R) -> {read(R), write(R), delete(R)}
     */
    public Set<Capability> impliedCapabilities(Capability capability) {
        Set<Capability> result = new LinkedHashSet<>();
        for (String action : lattice.impliedActions(capability.action())) {
            result.add(capability.withAction(action));
        }
        return Collections.unmodifiableSet(result);
    }

    // ==================== 集合运算 ====================

    /**
     * 将能力列表合成为集合，重复项合并
     */
    public Set<Capability> compose(Collection<Capability> capabilities) {
        if (capabilities == null) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(capabilities));
    }

    public Set<Capability> merge(Collection<? extends Collection<Capability>> sets) {
        Set<Capability> merged = new LinkedHashSet<>();
        if (sets != null) {
            sets.forEach(merged::addAll);
        }
        return Collections.unmodifiableSet(merged);
    }

    public List<Capability> filter(Collection<Capability> capabilities, Predicate<Capability> predicate) {
        List<Capability> result = new ArrayList<>();
        for (Capability capability : capabilities) {
            if (predicate.test(capability)) {
                result.add(capability);
            }
        }
        return Collections.unmodifiableList(result);
    }

    // ==================== 校验 ====================

    /**
     * 可用能力中任意一个蕴含目标即通过
     */
    public boolean validate(Capability target, Collection<Capability> available) {
        if (target == null || available == null) {
            return false;
        }
        for (Capability candidate : available) {
            if (lattice.implies(candidate, target)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 每个所需能力都被某个可用能力蕴含（存在性匹配，与位置无关）
     */
    public boolean validateAll(Collection<Capability> required, Collection<Capability> available) {
        if (required == null || required.isEmpty()) {
            return true;
        }
        for (Capability capability : required) {
            if (!validate(capability, available)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 返回未被满足的所需能力
     */
    public List<Capability> missing(Collection<Capability> required, Collection<Capability> available) {
        if (required == null) {
            return List.of();
        }
        return filter(required, capability -> !validate(capability, available));
    }

    // ==================== 委派与撤销 ====================

    public Delegation delegate(Capability capability, String grantor, String grantee) {
        return new Delegation(capability, grantor, grantee);
    }

    public List<Delegation> delegateAll(Collection<Capability> capabilities, String grantor, String grantee) {
        List<Delegation> result = new ArrayList<>(capabilities.size());
        for (Capability capability : capabilities) {
            result.add(delegate(capability, grantor, grantee));
        }
        return Collections.unmodifiableList(result);
    }

    public Revocation revoke(Capability capability, String holder) {
        return new Revocation(capability, holder);
    }

    public List<Revocation> revokeAll(Collection<Capability> capabilities, String holder) {
        List<Revocation> result = new ArrayList<>(capabilities.size());
        for (Capability capability : capabilities) {
            result.add(revoke(capability, holder));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * 委派是否有效：授予方的可用能力必须蕴含被委派的能力
     */
    public boolean isDelegationValid(Delegation delegation, Collection<Capability> grantorCapabilities) {
        return delegation != null && validate(delegation.capability(), grantorCapabilities);
    }

    /**
     * 撤销是否有效：持有方当前确实具备该能力
     */
    public boolean isRevocationValid(Revocation revocation, Collection<Capability> holderCapabilities) {
        return revocation != null && validate(revocation.capability(), holderCapabilities);
    }

    /**
     * 应用撤销记录，返回剩余能力
     */
    public Set<Capability> applyRevocations(Collection<Capability> held, Collection<Revocation> revocations) {
        Set<Capability> remaining = new LinkedHashSet<>(held);
        for (Revocation revocation : revocations) {
            remaining.remove(revocation.capability());
        }
        return Collections.unmodifiableSet(remaining);
    }

    // ==================== 时效 ====================

    public TemporalCapability createTemporal(Capability capability, Instant validFrom, Instant validUntil) {
        return new TemporalCapability(capability, validFrom, validUntil);
    }

    public TemporalCapability createTemporal(Capability capability, Instant validFrom, Duration validFor) {
        return new TemporalCapability(capability, validFrom, validFrom.plus(validFor));
    }

    /**
     * validFrom <= now < validUntil
     */
    public boolean validateTemporal(TemporalCapability temporal, Instant now) {
        return temporal != null && temporal.isValidAt(now);
    }

    // ==================== 上下文 ====================

    public boolean validateInContext(Capability capability, Map<String, Object> context) {
        return contextPolicy.permits(capability, context != null ? context : Map.of());
    }
}
