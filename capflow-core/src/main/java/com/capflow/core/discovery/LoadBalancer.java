package com.capflow.core.discovery;

import com.capflow.api.exception.NoAvailableTargetsException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * 负载均衡状态与选择算法
 * <p>
 * 注意：非线程安全，只允许在 {@link ComponentDiscovery} 的串行循环线程内访问。
 * </p>
 */
class LoadBalancer {

    private final Random random;

    // 轮询计数器，跨调用单调递增
    private long roundRobinCounter;

    // 组件 ID -> 当前连接数
    private final Map<String, Integer> connections = new HashMap<>();

    LoadBalancer(Random random) {
        this.random = random != null ? random : new Random();
    }

    ComponentMatch select(List<ComponentMatch> candidates, LoadBalancingStrategy strategy) {
        if (candidates == null || candidates.isEmpty()) {
            throw new NoAvailableTargetsException("empty candidate set for " + strategy.key());
        }
        return switch (strategy) {
            case ROUND_ROBIN -> roundRobin(candidates);
            case LEAST_CONNECTIONS -> leastConnections(candidates);
            case WEIGHTED_ROUND_ROBIN -> weighted(candidates);
            case RANDOM -> candidates.get(random.nextInt(candidates.size()));
        };
    }

    private ComponentMatch roundRobin(List<ComponentMatch> candidates) {
        int index = (int) Math.floorMod(roundRobinCounter++, (long) candidates.size());
        return candidates.get(index);
    }

    private ComponentMatch leastConnections(List<ComponentMatch> candidates) {
        ComponentMatch best = candidates.get(0);
        int bestCount = connectionCount(best.componentId());
        for (int i = 1; i < candidates.size(); i++) {
            ComponentMatch candidate = candidates.get(i);
            int count = connectionCount(candidate.componentId());
            // 相同连接数时保留得分更高者（候选已按得分降序）
            if (count < bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        connections.merge(best.componentId(), 1, Integer::sum);
        return best;
    }

    private ComponentMatch weighted(List<ComponentMatch> candidates) {
        double totalWeight = 0;
        double[] weights = new double[candidates.size()];
        for (int i = 0; i < candidates.size(); i++) {
            // 负分（例如不健康组件）不参与加权
            weights[i] = Math.max(0.0, candidates.get(i).score());
            totalWeight += weights[i];
        }

        if (totalWeight <= 0) {
            return candidates.get(0);
        }

        double point = random.nextDouble() * totalWeight;
        double current = 0;
        for (int i = 0; i < candidates.size(); i++) {
            current += weights[i];
            if (point < current) {
                return candidates.get(i);
            }
        }
        return candidates.get(candidates.size() - 1);
    }

    void release(String componentId) {
        connections.computeIfPresent(componentId, (id, count) -> count <= 1 ? null : count - 1);
    }

    void forget(String componentId) {
        connections.remove(componentId);
    }

    int connectionCount(String componentId) {
        return connections.getOrDefault(componentId, 0);
    }

    long roundRobinCounter() {
        return roundRobinCounter;
    }
}
