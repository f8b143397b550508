package com.capflow.core.router;

import com.capflow.api.component.IntentHandler;
import com.capflow.api.exception.ErrorCode;
import com.capflow.api.exception.IntentRejectedException;
import com.capflow.api.exception.NoRouteException;
import com.capflow.api.exception.TargetProcessorNotFoundException;
import com.capflow.api.intent.Intent;
import com.capflow.api.intent.IntentFactory;
import com.capflow.api.intent.IntentResult;
import com.capflow.api.plugin.IntentPlugin;
import com.capflow.api.plugin.PluginType;
import com.capflow.api.security.Capability;
import com.capflow.api.security.CapabilityAlgebra;
import com.capflow.core.config.CapFlowConfig;
import com.capflow.core.discovery.ComponentDiscovery;
import com.capflow.core.discovery.ComponentMetadata;
import com.capflow.core.discovery.LoadBalancingStrategy;
import com.capflow.core.event.FabricEventBus;
import com.capflow.core.pipeline.PluginPipeline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IntentRouter 单元测试")
public class IntentRouterTest {

    private ComponentDiscovery discovery;
    private PluginPipeline pipeline;
    private ExecutorService executor;
    private IntentRouter router;

    private void start(CapFlowConfig config) {
        FabricEventBus eventBus = new FabricEventBus("router-test");
        discovery = new ComponentDiscovery(config, CapabilityAlgebra.standard(), eventBus);
        pipeline = new PluginPipeline("router-test");
        executor = IntentDispatcher.createExecutor(2);
        IntentDispatcher dispatcher = new IntentDispatcher(executor, config, eventBus);
        router = new IntentRouter(discovery, pipeline, RoutingTable.standard(), dispatcher,
                CapabilityAlgebra.standard(), config);
    }

    private void start() {
        start(CapFlowConfig.builder().dispatchTimeout(Duration.ofSeconds(2)).build());
    }

    @AfterEach
    void tearDown() {
        if (discovery != null) {
            discovery.close();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private void register(String id, String type, Capability... capabilities) {
        IntentHandler handler = intent -> id + ":" + intent.type();
        discovery.registerComponent(id, handler, ComponentMetadata.builder()
                .type(type)
                .capabilities(List.of(capabilities))
                .build());
    }

    @Nested
    @DisplayName("路由")
    class RouteTests {

        @Test
        @DisplayName("按意图类型分类到对应组件")
        void routesByClassification() {
            start();
            register("files", "file");
            register("users", "user");

            assertEquals("files", router.routeIntent(IntentFactory.create("ReadFileIntent", Map.of())).componentId());
            assertEquals("users", router.routeIntent(IntentFactory.create("CreateUserIntent", Map.of())).componentId());
        }

        @Test
        @DisplayName("开启能力校验时只选具备所需能力的组件")
        void routesToCapableComponent() {
            start();
            register("reader", "file", Capability.read("/data"));
            register("writer", "file", Capability.write("/data"));
            Intent write = IntentFactory.create("WriteFileIntent", Map.of(), List.of(Capability.write("/data")));

            for (int i = 0; i < 3; i++) {
                assertEquals("writer", router.routeIntent(write, LoadBalancingStrategy.ROUND_ROBIN).componentId());
            }
        }

        @Test
        @DisplayName("无匹配且无兜底时抛出 NoRouteException")
        void noRoute() {
            start();
            register("files", "file");

            NoRouteException e = assertThrows(NoRouteException.class,
                    () -> router.routeIntent(IntentFactory.create("PingIntent", Map.of())));
            assertEquals(ErrorCode.NO_ROUTE, e.getErrorCode());
        }

        @Test
        @DisplayName("无匹配时回退到配置的兜底目标")
        void fallsBackToDefaultTarget() {
            start(CapFlowConfig.builder().defaultTargetId("fallback").build());
            register("fallback", "misc");

            assertEquals("fallback", router.routeIntent(IntentFactory.create("PingIntent", Map.of())).componentId());
        }

        @Test
        @DisplayName("路由插件改写到未注册的目标时报错")
        void pluginOverrideToUnknownTarget() {
            start();
            register("files", "file");
            pipeline.register(new IntentPlugin() {
                @Override
                public PluginType type() {
                    return PluginType.ROUTING;
                }

                @Override
                public String route(Intent intent, String proposedTargetId) {
                    return "ghost";
                }
            });

            assertThrows(TargetProcessorNotFoundException.class,
                    () -> router.routeIntent(IntentFactory.create("ReadFileIntent", Map.of())));
            assertEquals(0, discovery.activeConnections("files"));
        }
    }

    @Nested
    @DisplayName("委派")
    class DelegationTests {

        @Test
        @DisplayName("委派到未注册目标时报错")
        void unknownTarget() {
            start();

            TargetProcessorNotFoundException e = assertThrows(TargetProcessorNotFoundException.class,
                    () -> router.delegateIntent(IntentFactory.create("ReadFileIntent", Map.of()), "nobody"));
            assertEquals(ErrorCode.TARGET_PROCESSOR_NOT_FOUND, e.getErrorCode());
        }

        @Test
        @DisplayName("委派返回新意图，原意图不变")
        void delegationMarksNewIntent() {
            start();
            register("special", "misc");
            Intent original = IntentFactory.create("ReadFileIntent", Map.of());

            Intent delegated = router.delegateIntent(original, "special");

            assertEquals("special", delegated.delegatedTo().orElseThrow());
            assertTrue(original.delegatedTo().isEmpty());
            assertEquals(original.id(), delegated.id());
        }

        @Test
        @DisplayName("已委派的意图绕过分类直接派发到委派目标")
        void delegatedDispatchGoesToTarget() {
            start();
            register("files", "file");
            register("special", "misc");

            Intent delegated = router.delegateIntent(IntentFactory.create("ReadFileIntent", Map.of()), "special");

            assertEquals("special:ReadFileIntent", router.dispatch(delegated));
        }
    }

    @Nested
    @DisplayName("派发")
    class DispatchTests {

        @Test
        @DisplayName("路由后派发并归还负载均衡连接")
        void dispatchReleasesConnection() {
            start();
            register("files", "file");

            Object result = router.dispatch(IntentFactory.create("ReadFileIntent", Map.of()),
                    new DispatchOptions(null, LoadBalancingStrategy.LEAST_CONNECTIONS));

            assertEquals("files:ReadFileIntent", result);
            assertEquals(0, discovery.activeConnections("files"));
        }

        @Test
        @DisplayName("目标缺少所需能力时以 insufficient_capabilities 拒绝")
        void insufficientCapabilities() {
            start();
            register("reader", "file", Capability.read("/data"));
            Intent write = IntentFactory.create("WriteFileIntent", Map.of(), List.of(Capability.write("/data")));

            IntentRejectedException e = assertThrows(IntentRejectedException.class,
                    () -> router.dispatchTo(write, "reader", DispatchOptions.defaults()));
            assertEquals(IntentRouter.INSUFFICIENT_CAPABILITIES, e.getReason());
        }

        @Test
        @DisplayName("关闭能力校验时不检查目标能力")
        void enforcementDisabled() {
            start(CapFlowConfig.builder().enforceCapabilities(false).build());
            register("reader", "file", Capability.read("/data"));
            Intent write = IntentFactory.create("WriteFileIntent", Map.of(), List.of(Capability.write("/data")));

            assertEquals("reader:WriteFileIntent", router.dispatchTo(write, "reader", DispatchOptions.defaults()));
        }

        @Test
        @DisplayName("校验插件拒绝的原因原样出现在结果中")
        void validationReasonInResult() {
            start();
            register("files", "file");
            pipeline.register(new IntentPlugin() {
                @Override
                public PluginType type() {
                    return PluginType.VALIDATION;
                }

                @Override
                public Intent validate(Intent intent) {
                    if (String.valueOf(intent.payload().get("path")).contains("..")) {
                        throw new IntentRejectedException("invalid_path");
                    }
                    return intent;
                }
            });

            IntentResult result = router.dispatchForResult(
                    IntentFactory.create("ReadFileIntent", Map.of("path", "../secret")), null);

            assertFalse(result.isSuccess());
            assertEquals("invalid_path", result.reason());
            assertEquals(ErrorCode.VALIDATION_FAILED, result.errorCode());
        }

        @Test
        @DisplayName("转换插件的结果被派发到目标")
        void transformedIntentDispatched() {
            start();
            register("files", "file");
            pipeline.register(new IntentPlugin() {
                @Override
                public PluginType type() {
                    return PluginType.TRANSFORMATION;
                }

                @Override
                public Intent transform(Intent intent) {
                    return intent.withType("Normalized" + intent.type());
                }
            });

            assertEquals("files:NormalizedReadFileIntent",
                    router.dispatch(IntentFactory.create("ReadFileIntent", Map.of())));
        }

        @Test
        @DisplayName("dispatchToForResult 不抛异常")
        void forResultNeverThrows() {
            start();

            IntentResult result = assertDoesNotThrow(() -> router.dispatchToForResult(
                    IntentFactory.create("ReadFileIntent", Map.of()), "ghost", null));

            assertEquals(ErrorCode.TARGET_PROCESSOR_NOT_FOUND, result.errorCode());
            assertEquals("ghost", result.targetId());
        }

        @Test
        @DisplayName("dispatchForResult 记录实际处理的组件")
        void forResultRecordsResolvedTarget() {
            start();
            register("files", "file");

            IntentResult result = router.dispatchForResult(IntentFactory.create("ReadFileIntent", Map.of()), null);

            assertTrue(result.isSuccess());
            assertEquals("files", result.targetId());
            assertEquals("files:ReadFileIntent", result.value());
        }

        @Test
        @DisplayName("校验插件未给出拒绝原因时返回失败结果")
        void rejectionWithoutReasonBecomesFailure() {
            start();
            register("files", "file");
            pipeline.register(new IntentPlugin() {
                @Override
                public PluginType type() {
                    return PluginType.VALIDATION;
                }

                @Override
                public Intent validate(Intent intent) {
                    throw new IntentRejectedException(null);
                }
            });

            IntentResult result = assertDoesNotThrow(
                    () -> router.dispatchForResult(IntentFactory.create("ReadFileIntent", Map.of()), null));

            assertFalse(result.isSuccess());
            assertEquals(ErrorCode.VALIDATION_FAILED, result.errorCode());
            assertEquals(ErrorCode.VALIDATION_FAILED.reason(), result.reason());
        }
    }
}
