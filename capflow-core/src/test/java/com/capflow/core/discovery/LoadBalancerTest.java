package com.capflow.core.discovery;

import com.capflow.api.component.Health;
import com.capflow.api.exception.NoAvailableTargetsException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LoadBalancer 单元测试")
public class LoadBalancerTest {

    private LoadBalancer loadBalancer;
    private List<ComponentMatch> matches;

    @BeforeEach
    void setUp() {
        loadBalancer = new LoadBalancer(new Random(7));
        matches = List.of(match("a", 2.0), match("b", 1.5), match("c", 1.0));
    }

    private static ComponentMatch match(String id, double score) {
        ComponentRecord record = new ComponentRecord(id, new Object(), ComponentMetadata.empty(), Instant.EPOCH);
        return new ComponentMatch(record, Health.HEALTHY, score);
    }

    private List<String> selectIds(LoadBalancingStrategy strategy, int times) {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < times; i++) {
            ids.add(loadBalancer.select(matches, strategy).componentId());
        }
        return ids;
    }

    @Test
    @DisplayName("轮询依次访问每个候选，计数跨调用保留")
    void roundRobinRotates() {
        assertEquals(List.of("a", "b", "c", "a", "b", "c"), selectIds(LoadBalancingStrategy.ROUND_ROBIN, 6));
        assertEquals(6, loadBalancer.roundRobinCounter());
    }

    @Test
    @DisplayName("最少连接选择计数最低者并累加")
    void leastConnectionsBalances() {
        assertEquals(List.of("a", "b", "c"), selectIds(LoadBalancingStrategy.LEAST_CONNECTIONS, 3));
        assertEquals(1, loadBalancer.connectionCount("b"));

        loadBalancer.release("b");

        assertEquals("b", loadBalancer.select(matches, LoadBalancingStrategy.LEAST_CONNECTIONS).componentId());
    }

    @Test
    @DisplayName("释放连接不会低于 0")
    void releaseFloorsAtZero() {
        loadBalancer.release("a");
        loadBalancer.release("a");

        assertEquals(0, loadBalancer.connectionCount("a"));
    }

    @Test
    @DisplayName("加权随机不会选中非正权重的候选")
    void weightedSkipsNonPositive() {
        List<ComponentMatch> candidates = List.of(match("sick", -0.5), match("ok", 1.8));

        for (int i = 0; i < 50; i++) {
            assertEquals("ok", loadBalancer.select(candidates, LoadBalancingStrategy.WEIGHTED_ROUND_ROBIN).componentId());
        }
    }

    @Test
    @DisplayName("总权重为 0 时取第一个")
    void weightedAllZeroPicksFirst() {
        List<ComponentMatch> candidates = List.of(match("x", 0.0), match("y", -1.0));

        assertEquals("x", loadBalancer.select(candidates, LoadBalancingStrategy.WEIGHTED_ROUND_ROBIN).componentId());
    }

    @Test
    @DisplayName("随机选择总在候选集中")
    void randomStaysInCandidates() {
        for (String id : selectIds(LoadBalancingStrategy.RANDOM, 20)) {
            assertTrue(List.of("a", "b", "c").contains(id));
        }
    }

    @Test
    @DisplayName("空候选集报 no_available_targets")
    void emptyCandidatesRejected() {
        NoAvailableTargetsException e = assertThrows(NoAvailableTargetsException.class,
                () -> loadBalancer.select(List.of(), LoadBalancingStrategy.ROUND_ROBIN));
        assertEquals("no_available_targets", e.getReason());
    }
}
