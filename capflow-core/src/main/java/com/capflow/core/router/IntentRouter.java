package com.capflow.core.router;

import com.capflow.api.exception.CapFlowException;
import com.capflow.api.exception.IntentRejectedException;
import com.capflow.api.exception.NoRouteException;
import com.capflow.api.exception.TargetProcessorNotFoundException;
import com.capflow.api.intent.Intent;
import com.capflow.api.intent.IntentResult;
import com.capflow.api.security.Capability;
import com.capflow.api.security.CapabilityAlgebra;
import com.capflow.core.config.CapFlowConfig;
import com.capflow.core.discovery.ComponentDiscovery;
import com.capflow.core.discovery.ComponentMatch;
import com.capflow.core.discovery.ComponentRecord;
import com.capflow.core.discovery.DiscoveryPattern;
import com.capflow.core.discovery.LoadBalancingStrategy;
import com.capflow.core.pipeline.PipelineResult;
import com.capflow.core.pipeline.PluginPipeline;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * 意图路由器
 * <p>
 * 职责：
 * 1. 经插件管道校验、转换意图
 * 2. 按路由表分类，再通过发现服务解析出具体目标
 * 3. 委派：把意图钉到指定目标
 * 4. 调用派发原语，在超时内拿到目标响应
 * </p>
 */
@Slf4j
public class IntentRouter {

    public static final String INSUFFICIENT_CAPABILITIES = "insufficient_capabilities";

    private static final String SOURCE = "router";

    private final ComponentDiscovery discovery;
    @Getter
    private final PluginPipeline pipeline;
    @Getter
    private final RoutingTable routingTable;
    private final IntentDispatcher dispatcher;
    private final CapabilityAlgebra algebra;
    private final CapFlowConfig config;

    public IntentRouter(ComponentDiscovery discovery,
                        PluginPipeline pipeline,
                        RoutingTable routingTable,
                        IntentDispatcher dispatcher,
                        CapabilityAlgebra algebra,
                        CapFlowConfig config) {
        this.discovery = discovery;
        this.pipeline = pipeline;
        this.routingTable = routingTable != null ? routingTable : RoutingTable.standard();
        this.dispatcher = dispatcher;
        this.algebra = algebra != null ? algebra : CapabilityAlgebra.standard();
        this.config = config;
    }

    // ================= 校验 / 转换 =================

    public PipelineResult<Intent> validateIntent(Intent intent) {
        return pipeline.runValidate(intent);
    }

    public PipelineResult<Intent> transformIntent(Intent intent) {
        return pipeline.runTransform(intent);
    }

    // ================= 路由 =================

    public ComponentMatch routeIntent(Intent intent) {
        return routeIntent(intent, null);
    }

    /**
     * 解析意图的目标
     *
     * @throws NoRouteException                 无匹配且没有可用的兜底目标
     * @throws TargetProcessorNotFoundException 路由插件给出了未注册的目标
     */
    public ComponentMatch routeIntent(Intent intent, LoadBalancingStrategy strategy) {
        return resolveRoute(intent, strategy).match();
    }

    private Route resolveRoute(Intent intent, LoadBalancingStrategy strategy) {
        DiscoveryPattern pattern = patternFor(intent);
        Optional<ComponentMatch> best = discovery.getBestMatch(pattern, strategy);

        // 路由插件可改写目标
        String proposed = best.map(ComponentMatch::componentId).orElse(null);
        PipelineResult<String> routeResult = pipeline.runRoute(intent, proposed);
        if (!routeResult.isOk() && best.isPresent()) {
            discovery.releaseConnection(proposed);
        }
        String routed = routeResult.orThrow();
        if (routed != null && !routed.equals(proposed)) {
            if (best.isPresent()) {
                discovery.releaseConnection(proposed);
            }
            log.debug("[{}] Route of intent {} overridden by plugin: {} -> {}", SOURCE, intent.id(), proposed, routed);
            ComponentRecord record = discovery.findComponent(routed)
                    .orElseThrow(() -> new TargetProcessorNotFoundException(routed));
            return new Route(directMatch(record), false);
        }
        if (best.isPresent()) {
            return new Route(best.get(), true);
        }

        // 兜底目标
        Optional<String> fallback = routingTable.getDefaultTargetId()
                .or(() -> Optional.ofNullable(config.getDefaultTargetId()));
        if (fallback.isPresent()) {
            Optional<ComponentRecord> record = discovery.findComponent(fallback.get());
            if (record.isPresent()) {
                log.debug("[{}] No match for intent {}, falling back to default target {}",
                        SOURCE, intent.type(), fallback.get());
                return new Route(directMatch(record.get()), false);
            }
        }
        throw new NoRouteException(intent.type());
    }

    /**
     * 开启能力校验时，把意图所需能力并入查询条件，只选能处理它的组件
     */
    private DiscoveryPattern patternFor(Intent intent) {
        DiscoveryPattern pattern = routingTable.classify(intent);
        if (config.isEnforceCapabilities() && pattern.capabilities() == null && !intent.capabilities().isEmpty()) {
            return pattern.toBuilder().capabilities(intent.capabilities()).build();
        }
        return pattern;
    }

    private ComponentMatch directMatch(ComponentRecord record) {
        return new ComponentMatch(record, discovery.getComponentHealth(record.id()), 0.0);
    }

    // ================= 委派 =================

    /**
     * 返回带 delegated_to 标记的新意图，原意图不变
     *
     * @throws TargetProcessorNotFoundException 目标未注册
     */
    public Intent delegateIntent(Intent intent, String targetId) {
        if (targetId == null || !discovery.isRegistered(targetId)) {
            throw new TargetProcessorNotFoundException(targetId);
        }
        return intent.withMetadata(Intent.META_DELEGATED_TO, targetId);
    }

    // ================= 派发 =================

    public Object dispatch(Intent intent) {
        return dispatch(intent, DispatchOptions.defaults());
    }

    /**
     * 校验 → 转换 → 解析目标 → 能力检查 → 派发
     * 已委派的意图直接发往委派目标
     */
    public Object dispatch(Intent intent, DispatchOptions options) {
        return dispatchRouted(intent, options).value();
    }

    private Dispatched dispatchRouted(Intent intent, DispatchOptions options) {
        DispatchOptions opts = options != null ? options : DispatchOptions.defaults();
        Intent prepared = prepare(intent);

        Optional<String> delegated = prepared.delegatedTo();
        Route route;
        if (delegated.isPresent()) {
            ComponentRecord record = discovery.findComponent(delegated.get())
                    .orElseThrow(() -> new TargetProcessorNotFoundException(delegated.get()));
            route = new Route(directMatch(record), false);
        } else {
            route = resolveRoute(prepared, opts.loadBalancing());
        }

        String targetId = route.match().componentId();
        try {
            return new Dispatched(dispatchToRecord(prepared, route.match().component(), opts), targetId);
        } finally {
            if (route.balanced()) {
                discovery.releaseConnection(route.match().componentId());
            }
        }
    }

    /**
     * 绕过路由，直接派发到指定组件（仍经过校验与转换）
     */
    public Object dispatchTo(Intent intent, String targetId, DispatchOptions options) {
        DispatchOptions opts = options != null ? options : DispatchOptions.defaults();
        Intent prepared = prepare(intent);
        ComponentRecord record = discovery.findComponent(targetId)
                .orElseThrow(() -> new TargetProcessorNotFoundException(targetId));
        return dispatchToRecord(prepared, record, opts);
    }

    /**
     * 与 {@link #dispatch(Intent, DispatchOptions)} 相同，但失败以结果对象返回，不抛异常
     */
    public IntentResult dispatchForResult(Intent intent, DispatchOptions options) {
        long start = System.currentTimeMillis();
        try {
            Dispatched dispatched = dispatchRouted(intent, options);
            return IntentResult.success(intent.id(), dispatched.targetId(), dispatched.value(),
                    System.currentTimeMillis() - start);
        } catch (CapFlowException e) {
            return IntentResult.failure(intent.id(), null, e, System.currentTimeMillis() - start);
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected failure dispatching intent {}", SOURCE, intent.id(), e);
            return IntentResult.failure(intent.id(), null, e, System.currentTimeMillis() - start);
        }
    }

    public IntentResult dispatchToForResult(Intent intent, String targetId, DispatchOptions options) {
        long start = System.currentTimeMillis();
        try {
            Object value = dispatchTo(intent, targetId, options);
            return IntentResult.success(intent.id(), targetId, value, System.currentTimeMillis() - start);
        } catch (CapFlowException e) {
            return IntentResult.failure(intent.id(), targetId, e, System.currentTimeMillis() - start);
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected failure dispatching intent {} to {}", SOURCE, intent.id(), targetId, e);
            return IntentResult.failure(intent.id(), targetId, e, System.currentTimeMillis() - start);
        }
    }

    private Intent prepare(Intent intent) {
        Intent validated = pipeline.runValidate(intent).orThrow();
        return pipeline.runTransform(validated).orThrow();
    }

    private Object dispatchToRecord(Intent intent, ComponentRecord target, DispatchOptions opts) {
        if (config.isEnforceCapabilities()) {
            List<Capability> provided = target.metadata().capabilitiesOrEmpty();
            if (!algebra.validateAll(intent.capabilities(), provided)) {
                List<Capability> missing = algebra.missing(intent.capabilities(), provided);
                log.warn("[{}] Intent {} rejected: target {} lacks {}", SOURCE, intent.id(), target.id(), missing);
                throw new IntentRejectedException(INSUFFICIENT_CAPABILITIES,
                        "Target " + target.id() + " lacks capabilities " + missing);
            }
        }
        return dispatcher.dispatch(intent, target, opts.timeout());
    }

    /**
     * 解析出的目标；balanced 表示经负载均衡选出，派发后需要归还连接计数
     */
    private record Route(ComponentMatch match, boolean balanced) {
    }

    private record Dispatched(Object value, String targetId) {
    }
}
