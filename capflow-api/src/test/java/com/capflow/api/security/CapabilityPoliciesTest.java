package com.capflow.api.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CapabilityPolicies 单元测试")
public class CapabilityPoliciesTest {

    private static final Capability WRITE = Capability.write("/data");

    @Test
    @DisplayName("跨午夜的时间窗口")
    void windowCrossingMidnight() {
        CapabilityPolicy policy = CapabilityPolicies.timeWindow(
                LocalTime.of(22, 0), LocalTime.of(6, 0), Set.of(Capability.WRITE));

        assertTrue(policy.permits(WRITE, Map.of(CapabilityPolicies.CONTEXT_TIME, LocalTime.of(23, 30))));
        assertTrue(policy.permits(WRITE, Map.of(CapabilityPolicies.CONTEXT_TIME, LocalTime.of(5, 59))));
        assertFalse(policy.permits(WRITE, Map.of(CapabilityPolicies.CONTEXT_TIME, LocalTime.of(12, 0))));
    }

    @Test
    @DisplayName("上下文未给时间时使用时钟")
    void fallsBackToClock() {
        Clock noon = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        CapabilityPolicy policy = CapabilityPolicies.timeWindow(
                LocalTime.of(9, 0), LocalTime.of(17, 0), Set.of(Capability.WRITE), noon);

        assertTrue(policy.permits(WRITE, Map.of()));
    }

    @Test
    @DisplayName("支持 LocalDateTime 与 Instant 形式的上下文时间")
    void acceptsDateTimeAndInstant() {
        Clock utc = Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC);
        CapabilityPolicy policy = CapabilityPolicies.timeWindow(
                LocalTime.of(9, 0), LocalTime.of(17, 0), Set.of(Capability.WRITE), utc);

        assertTrue(policy.permits(WRITE,
                Map.of(CapabilityPolicies.CONTEXT_TIME, LocalDateTime.of(2026, 3, 1, 10, 0))));
        assertFalse(policy.permits(WRITE,
                Map.of(CapabilityPolicies.CONTEXT_TIME, Instant.parse("2026-03-01T18:00:00Z"))));
    }

    @Test
    @DisplayName("组合策略需同时满足")
    void andCombinesPolicies() {
        CapabilityPolicy denyDelete = (capability, context) -> !capability.action().equals(Capability.DELETE);
        CapabilityPolicy combined = CapabilityPolicies.allowAll().and(denyDelete);

        assertTrue(combined.permits(WRITE, Map.of()));
        assertFalse(combined.permits(Capability.delete("/data"), Map.of()));
    }
}
