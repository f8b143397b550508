package com.capflow.core.discovery;

import com.capflow.api.component.Health;
import com.capflow.api.security.Capability;
import com.capflow.api.security.CapabilityAlgebra;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ComponentMatcher 单元测试")
public class ComponentMatcherTest {

    private static final String F = "/srv/data.csv";

    private final ComponentMatcher matcher = new ComponentMatcher(CapabilityAlgebra.standard());

    private static ComponentRecord record(String id, String type, String version, List<Capability> caps, Set<String> tags) {
        ComponentMetadata metadata = ComponentMetadata.builder()
                .type(type)
                .version(version)
                .capabilities(caps)
                .tags(tags)
                .build();
        return new ComponentRecord(id, new Object(), metadata, Instant.EPOCH);
    }

    @Nested
    @DisplayName("匹配")
    class MatchTests {

        @Test
        @DisplayName("通配模式匹配任意组件")
        void anyMatchesEverything() {
            assertTrue(matcher.matches(record("a", "file", "1.0.0", List.of(), Set.of()),
                    Health.UNKNOWN, DiscoveryPattern.any()));
        }

        @Test
        @DisplayName("能力条件按蕴含判断")
        void capabilityFilterUsesImplication() {
            ComponentRecord reader = record("a", "file", "1.0.0", List.of(Capability.read(F)), Set.of());
            ComponentRecord admin = record("b", "file", "1.0.0", List.of(Capability.admin(F)), Set.of());
            DiscoveryPattern pattern = DiscoveryPattern.builder()
                    .type("file")
                    .capabilities(List.of(Capability.write(F)))
                    .build();

            assertFalse(matcher.matchesStatic(reader, pattern));
            assertTrue(matcher.matchesStatic(admin, pattern));
        }

        @Test
        @DisplayName("名称按子串匹配组件 ID 或句柄类名")
        void nameIsSubstring() {
            ComponentRecord record = record("file-reactor-1", "file", "1.0.0", List.of(), Set.of());

            assertTrue(matcher.matchesStatic(record, DiscoveryPattern.builder().name("reactor").build()));
            assertTrue(matcher.matchesStatic(record, DiscoveryPattern.builder().name("java.lang").build()));
            assertFalse(matcher.matchesStatic(record, DiscoveryPattern.builder().name("user").build()));
        }

        @Test
        @DisplayName("标签必须全部具备，版本精确匹配")
        void tagsAndVersion() {
            ComponentRecord record = record("a", "file", "2.1.0", List.of(), Set.of("fast", "local"));

            assertTrue(matcher.matchesStatic(record, DiscoveryPattern.builder().tags(Set.of("fast")).build()));
            assertFalse(matcher.matchesStatic(record, DiscoveryPattern.builder().tags(Set.of("fast", "remote")).build()));
            assertFalse(matcher.matchesStatic(record, DiscoveryPattern.builder().version("2.1").build()));
        }

        @Test
        @DisplayName("健康条件精确匹配")
        void healthMustMatch() {
            ComponentRecord record = record("a", "file", "1.0.0", List.of(), Set.of());
            DiscoveryPattern healthy = DiscoveryPattern.builder().health(Health.HEALTHY).build();

            assertTrue(matcher.matches(record, Health.HEALTHY, healthy));
            assertFalse(matcher.matches(record, Health.DEGRADED, healthy));
        }
    }

    @Nested
    @DisplayName("打分")
    class ScoreTests {

        @Test
        @DisplayName("类型 + 能力满足 + 健康 + 版本")
        void fullScore() {
            ComponentRecord record = record("b", "file", "1.2.3", List.of(Capability.admin(F)), Set.of());
            DiscoveryPattern pattern = DiscoveryPattern.builder()
                    .type("file")
                    .capabilities(List.of(Capability.write(F)))
                    .build();

            double score = matcher.score(record, Health.HEALTHY, pattern);

            assertEquals(1.0 + 0.5 + 1.0 + 0.3 + 0.123, score, 1e-9);
        }

        @Test
        @DisplayName("能力不满足扣分，不健康大幅扣分")
        void penalties() {
            ComponentRecord record = record("a", "file", "0.0.0", List.of(Capability.read(F)), Set.of());
            DiscoveryPattern pattern = DiscoveryPattern.builder()
                    .capabilities(List.of(Capability.write(F)))
                    .build();

            assertEquals(1.0 - 0.5 - 1.0, matcher.score(record, Health.UNHEALTHY, pattern), 1e-9);
            assertEquals(1.0 - 0.5 - 0.2, matcher.score(record, Health.UNKNOWN, pattern), 1e-9);
        }

        @Test
        @DisplayName("版本加分偏向新版本，无法解析的部分按 0 计")
        void versionBonus() {
            assertEquals(0.2 + 0.03 + 0.004, ComponentMatcher.versionBonus("2.3.4"), 1e-9);
            assertEquals(0.1, ComponentMatcher.versionBonus("1.x.y"), 1e-9);
            assertEquals(0.1 + 0.01, ComponentMatcher.versionBonus("1.1.0-beta"), 1e-9);
            assertEquals(0.0, ComponentMatcher.versionBonus(null));
            assertTrue(ComponentMatcher.versionBonus("2.0.0") > ComponentMatcher.versionBonus("1.9.9"));
        }
    }
}
