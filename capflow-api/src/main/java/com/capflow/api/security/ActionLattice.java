package com.capflow.api.security;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 动作蕴含图
 * <p>
 * 以有向边 (强动作 -> 弱动作) 描述动作之间的蕴含关系，与资源无关。
 * 蕴含关系为边的自反传递闭包，新动作只需追加边即可，无需修改代码。
 * </p>
 * 默认格：
 * <pre>
 * admin -> write -> read
 * admin -> delete
 * </pre>
 * 实例不可变，构建后可在线程间共享。
 */
public final class ActionLattice {

    private static final ActionLattice DEFAULTS = builder()
            .edge(Capability.ADMIN, Capability.WRITE)
            .edge(Capability.ADMIN, Capability.DELETE)
            .edge(Capability.WRITE, Capability.READ)
            .build();

    // action -> 其直接蕴含的动作
    private final Map<String, Set<String>> edges;

    // action -> 传递闭包（不含自身），构建时一次算好
    private final Map<String, Set<String>> closure;

    private ActionLattice(Map<String, Set<String>> edges) {
        Map<String, Set<String>> copy = new HashMap<>();
        edges.forEach((k, v) -> copy.put(k, Collections.unmodifiableSet(new LinkedHashSet<>(v))));
        this.edges = Collections.unmodifiableMap(copy);

        Map<String, Set<String>> computed = new HashMap<>();
        for (String action : copy.keySet()) {
            computed.put(action, Collections.unmodifiableSet(reachableFrom(action)));
        }
        this.closure = Collections.unmodifiableMap(computed);
    }

    public static ActionLattice defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 以当前格为基础继续追加边
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        edges.forEach((from, targets) -> targets.forEach(to -> builder.edge(from, to)));
        return builder;
    }

    /**
     * a 是否蕴含 b：相同资源，且动作相等或 a 的动作可达 b 的动作
     */
    public boolean implies(Capability a, Capability b) {
        if (a == null || b == null) {
            return false;
        }
        if (a.equals(b)) {
            return true;
        }
        if (!a.resource().equals(b.resource())) {
            return false;
        }
        return impliesAction(a.action(), b.action());
    }

    /**
     * 动作层面的蕴含（自反）
     */
    public boolean impliesAction(String strong, String weak) {
        if (strong.equals(weak)) {
            return true;
        }
        return closure.getOrDefault(strong, Set.of()).contains(weak);
    }

    /**
     * 动作的严格蕴含闭包（不包含自身）
     */
    public Set<String> impliedActions(String action) {
        return closure.getOrDefault(action, Set.of());
    }

    /**
     * 已知的所有动作
     */
    public Set<String> actions() {
        Set<String> all = new LinkedHashSet<>(edges.keySet());
        edges.values().forEach(all::addAll);
        return all;
    }

    private Set<String> reachableFrom(String action) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>(edges.getOrDefault(action, Set.of()));
        while (!stack.isEmpty()) {
            String next = stack.pop();
            if (next.equals(action) || !visited.add(next)) {
                continue;
            }
            stack.addAll(edges.getOrDefault(next, Set.of()));
        }
        return visited;
    }

    public static final class Builder {
        private final Map<String, Set<String>> edges = new HashMap<>();

        private Builder() {
        }

        /**
         * 追加一条蕴含边：stronger 蕴含 weaker
         */
        public Builder edge(String stronger, String weaker) {
            if (stronger == null || weaker == null || stronger.equals(weaker)) {
                throw new IllegalArgumentException("Invalid lattice edge: " + stronger + " -> " + weaker);
            }
            edges.computeIfAbsent(stronger, k -> new LinkedHashSet<>()).add(weaker);
            edges.computeIfAbsent(weaker, k -> new LinkedHashSet<>());
            return this;
        }

        public ActionLattice build() {
            return new ActionLattice(edges);
        }
    }
}
