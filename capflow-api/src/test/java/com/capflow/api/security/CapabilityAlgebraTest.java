package com.capflow.api.security;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CapabilityAlgebra 单元测试")
public class CapabilityAlgebraTest {

    private static final String FILE = "/tmp/report.txt";

    private CapabilityAlgebra algebra;

    @BeforeEach
    void setUp() {
        algebra = CapabilityAlgebra.standard();
    }

    @Nested
    @DisplayName("蕴含关系")
    class ImplicationTests {

        @ParameterizedTest
        @ValueSource(strings = {"/tmp/a", "user:42", "room/general"})
        @DisplayName("admin 蕴含 read/write/delete，write 蕴含 read")
        void strongerActionsImplyWeaker(String resource) {
            assertTrue(algebra.implies(Capability.admin(resource), Capability.read(resource)));
            assertTrue(algebra.implies(Capability.admin(resource), Capability.write(resource)));
            assertTrue(algebra.implies(Capability.admin(resource), Capability.delete(resource)));
            assertTrue(algebra.implies(Capability.write(resource), Capability.read(resource)));
        }

        @ParameterizedTest
        @ValueSource(strings = {"/tmp/a", "user:42"})
        @DisplayName("较弱动作不蕴含较强动作")
        void weakerActionsDoNotImplyStronger(String resource) {
            assertFalse(algebra.implies(Capability.read(resource), Capability.admin(resource)));
            assertFalse(algebra.implies(Capability.read(resource), Capability.write(resource)));
            assertFalse(algebra.implies(Capability.write(resource), Capability.delete(resource)));
        }

        @Test
        @DisplayName("任意能力蕴含自身")
        void capabilityImpliesItself() {
            Capability custom = Capability.of("publish", "topic/news");
            assertTrue(algebra.implies(custom, custom));
            assertTrue(algebra.implies(Capability.read(FILE), Capability.read(FILE)));
        }

        @Test
        @DisplayName("不同资源之间不存在蕴含")
        void differentResourcesNeverImply() {
            assertFalse(algebra.implies(Capability.admin("/a"), Capability.read("/b")));
        }

        @Test
        @DisplayName("admin 的蕴含闭包恰好是 read/write/delete")
        void adminClosureHasThreeMembers() {
            Set<Capability> implied = algebra.impliedCapabilities(Capability.admin(FILE));

            assertEquals(Set.of(Capability.read(FILE), Capability.write(FILE), Capability.delete(FILE)), implied);
        }

        @Test
        @DisplayName("自定义动作格可以扩展新的动作")
        void customLatticeAddsActions() {
            ActionLattice lattice = ActionLattice.defaults().toBuilder()
                    .edge("owner", Capability.ADMIN)
                    .build();
            CapabilityAlgebra custom = new CapabilityAlgebra(lattice, CapabilityPolicies.allowAll());

            assertTrue(custom.implies(Capability.of("owner", FILE), Capability.read(FILE)));
            assertEquals(4, custom.impliedCapabilities(Capability.of("owner", FILE)).size());
        }
    }

    @Nested
    @DisplayName("集合运算与校验")
    class SetOperationTests {

        @Test
        @DisplayName("compose 合并重复能力")
        void composeCollapsesDuplicates() {
            Set<Capability> composed = algebra.compose(
                    List.of(Capability.read(FILE), Capability.write(FILE), Capability.read(FILE)));

            assertEquals(2, composed.size());
        }

        @Test
        @DisplayName("merge 合并多个集合")
        void mergeUnionsSets() {
            Set<Capability> merged = algebra.merge(List.of(
                    Set.of(Capability.read("/a")),
                    Set.of(Capability.read("/a"), Capability.write("/b"))));

            assertEquals(Set.of(Capability.read("/a"), Capability.write("/b")), merged);
        }

        @Test
        @DisplayName("filter 按谓词过滤")
        void filterKeepsMatching() {
            List<Capability> filtered = algebra.filter(
                    List.of(Capability.read("/a"), Capability.write("/a"), Capability.read("/b")),
                    c -> c.action().equals(Capability.READ));

            assertEquals(List.of(Capability.read("/a"), Capability.read("/b")), filtered);
        }

        @Test
        @DisplayName("validateAll 是存在性匹配：admin 同时满足 read 与 write")
        void validateAllIsExistential() {
            assertTrue(algebra.validateAll(
                    List.of(Capability.read(FILE), Capability.write(FILE)),
                    List.of(Capability.admin(FILE))));
        }

        @Test
        @DisplayName("缺失能力时校验失败并报告缺失项")
        void missingCapabilitiesReported() {
            List<Capability> required = List.of(Capability.read(FILE), Capability.delete(FILE));
            List<Capability> available = List.of(Capability.write(FILE));

            assertFalse(algebra.validateAll(required, available));
            assertEquals(List.of(Capability.delete(FILE)), algebra.missing(required, available));
        }

        @Test
        @DisplayName("空需求总是满足")
        void emptyRequirementAlwaysSatisfied() {
            assertTrue(algebra.validateAll(List.of(), List.of()));
        }
    }

    @Nested
    @DisplayName("委派、撤销与时效")
    class DelegationAndTemporalTests {

        @Test
        @DisplayName("授予方具备更强能力时委派有效")
        void delegationValidWhenGrantorHoldsStronger() {
            Delegation delegation = algebra.delegate(Capability.read(FILE), "alice", "bob");

            assertTrue(algebra.isDelegationValid(delegation, List.of(Capability.admin(FILE))));
            assertFalse(algebra.isDelegationValid(delegation, List.of(Capability.delete(FILE))));
        }

        @Test
        @DisplayName("批量委派与撤销")
        void batchDelegateAndRevoke() {
            List<Capability> caps = List.of(Capability.read("/a"), Capability.write("/b"));

            List<Delegation> delegations = algebra.delegateAll(caps, "alice", "bob");
            List<Revocation> revocations = algebra.revokeAll(List.of(Capability.read("/a")), "bob");

            assertEquals(2, delegations.size());
            assertEquals("bob", delegations.get(1).grantee());
            assertEquals(Set.of(Capability.write("/b")), algebra.applyRevocations(caps, revocations));
            assertTrue(algebra.isRevocationValid(revocations.get(0), caps));
        }

        @Test
        @DisplayName("时效能力在 [from, until) 区间内有效")
        void temporalWindowIsHalfOpen() {
            Instant from = Instant.parse("2026-01-01T00:00:00Z");
            TemporalCapability temporal = algebra.createTemporal(Capability.read(FILE), from, Duration.ofHours(1));

            assertTrue(algebra.validateTemporal(temporal, from));
            assertTrue(algebra.validateTemporal(temporal, from.plusSeconds(3599)));
            assertFalse(algebra.validateTemporal(temporal, from.plusSeconds(3600)));
            assertFalse(algebra.validateTemporal(temporal, from.minusSeconds(1)));
        }

        @Test
        @DisplayName("上下文校验使用注入的策略")
        void contextValidationUsesPolicy() {
            CapabilityAlgebra gated = algebra.withContextPolicy(CapabilityPolicies.timeWindow(
                    LocalTime.of(9, 0), LocalTime.of(17, 0), Set.of(Capability.WRITE)));

            assertTrue(gated.validateInContext(Capability.write(FILE),
                    Map.of(CapabilityPolicies.CONTEXT_TIME, LocalTime.of(10, 0))));
            assertFalse(gated.validateInContext(Capability.write(FILE),
                    Map.of(CapabilityPolicies.CONTEXT_TIME, LocalTime.of(20, 0))));
            assertTrue(gated.validateInContext(Capability.read(FILE),
                    Map.of(CapabilityPolicies.CONTEXT_TIME, LocalTime.of(20, 0))));
        }
    }
}
