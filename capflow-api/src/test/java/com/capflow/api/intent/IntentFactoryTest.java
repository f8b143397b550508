package com.capflow.api.intent;

import com.capflow.api.exception.ErrorCode;
import com.capflow.api.exception.TargetProcessorNotFoundException;
import com.capflow.api.exception.UnsupportedCompositionPatternException;
import com.capflow.api.security.Capability;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Intent 模型单元测试")
public class IntentFactoryTest {

    @Nested
    @DisplayName("创建意图")
    class CreateTests {

        @Test
        @DisplayName("每个意图拥有唯一 ID")
        void idsAreUnique() {
            Intent a = IntentFactory.create("ReadFileIntent", Map.of("path", "/a"));
            Intent b = IntentFactory.create("ReadFileIntent", Map.of("path", "/a"));

            assertNotEquals(a.id(), b.id());
        }

        @Test
        @DisplayName("payload 在创建后不受外部修改影响")
        void payloadIsFrozen() {
            Map<String, Object> payload = new HashMap<>();
            payload.put("path", "/a");
            Intent intent = IntentFactory.create("ReadFileIntent", payload, List.of(Capability.read("/a")));

            payload.put("path", "/b");

            assertEquals("/a", intent.payload().get("path"));
            assertThrows(UnsupportedOperationException.class, () -> intent.payload().put("x", 1));
        }

        @Test
        @DisplayName("动态意图带 dynamic 标记")
        void dynamicIntentFlagged() {
            Intent intent = IntentFactory.createDynamic("GeneratedIntent", Map.of(), List.of());

            assertTrue(intent.isDynamic());
        }

        @Test
        @DisplayName("组合意图带 composite 标记且保留子意图顺序")
        void compositeIntentKeepsOrder() {
            Intent first = IntentFactory.create("A", Map.of());
            Intent second = IntentFactory.create("B", Map.of());

            CompositeIntent composite = IntentFactory.createComposite(List.of(first, second),
                    CompositionStrategy.SEQUENTIAL);

            assertEquals(2, composite.size());
            assertEquals(first, composite.intents().get(0));
            assertEquals(Boolean.TRUE, composite.metadata().get(Intent.META_COMPOSITE));
        }

        @Test
        @DisplayName("withMetadata 返回新意图，原意图不变")
        void withMetadataIsNonMutating() {
            Intent intent = IntentFactory.create("A", Map.of());

            Intent delegated = intent.withMetadata(Intent.META_DELEGATED_TO, "worker-1");

            assertTrue(intent.delegatedTo().isEmpty());
            assertEquals("worker-1", delegated.delegatedTo().orElseThrow());
            assertEquals(intent.id(), delegated.id());
        }
    }

    @Nested
    @DisplayName("组合策略与结果")
    class StrategyAndResultTests {

        @Test
        @DisplayName("按名称解析策略，未知名称报 unsupported_composition_pattern")
        void strategyLookup() {
            assertEquals(CompositionStrategy.FAN_OUT, CompositionStrategy.of("fan_out"));
            assertEquals(CompositionStrategy.PIPELINE, CompositionStrategy.of("PIPELINE"));

            UnsupportedCompositionPatternException e = assertThrows(UnsupportedCompositionPatternException.class,
                    () -> CompositionStrategy.of("bogus"));
            assertEquals("unsupported_composition_pattern", e.getReason());
        }

        @Test
        @DisplayName("失败结果携带错误码与原因")
        void failureCarriesReason() {
            IntentResult result = IntentResult.failure("i-1", "t-1",
                    new TargetProcessorNotFoundException("t-1"), 3);

            assertFalse(result.isSuccess());
            assertEquals(ErrorCode.TARGET_PROCESSOR_NOT_FOUND, result.errorCode());
            assertEquals("target_processor_not_found", result.reason());
        }

        @Test
        @DisplayName("非框架异常归为 dispatch_failed")
        void foreignExceptionBecomesDispatchFailed() {
            IntentResult result = IntentResult.failure("i-1", null, new IllegalStateException("boom"), 0);

            assertEquals(ErrorCode.DISPATCH_FAILED, result.errorCode());
            assertEquals("boom", result.reason());
        }
    }
}
