package com.capflow.core.compose;

import com.capflow.api.exception.CompositionException;
import com.capflow.api.exception.NoAvailableTargetsException;
import com.capflow.api.exception.UnsupportedCompositionPatternException;
import com.capflow.api.intent.CompositeIntent;
import com.capflow.api.intent.CompositionStrategy;
import com.capflow.api.intent.Intent;
import com.capflow.api.intent.IntentResult;
import com.capflow.core.discovery.ComponentDiscovery;
import com.capflow.core.discovery.ComponentMatch;
import com.capflow.core.discovery.DiscoveryPattern;
import com.capflow.core.event.FabricEvent;
import com.capflow.core.event.FabricEventBus;
import com.capflow.core.router.DispatchOptions;
import com.capflow.core.router.IntentRouter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * 意图组合器
 * <p>
 * 失败即停的策略（sequential / pipeline）在第一处失败时抛出 {@link CompositionException}，
 * 已完成步骤不回滚；失败隔离的策略（parallel / fan_out）收集全部分支结果，单个分支失败不影响其他分支。
 * </p>
 */
@Slf4j
public class IntentComposer {

    /**
     * pipeline 策略中，上一步原始返回值在下一步 payload 中的键
     */
    public static final String PREVIOUS_RESULT = "previous_result";

    /**
     * 非 Map 返回值并入上下文时使用的键
     */
    public static final String RESULT = "result";

    private static final String SOURCE = "composer";

    private final IntentRouter router;
    private final ComponentDiscovery discovery;
    private final FabricEventBus eventBus;
    private final Executor branchExecutor;

    public IntentComposer(IntentRouter router,
                          ComponentDiscovery discovery,
                          FabricEventBus eventBus,
                          Executor branchExecutor) {
        this.router = router;
        this.discovery = discovery;
        this.eventBus = eventBus;
        this.branchExecutor = branchExecutor;
    }

    public CompositionResult compose(CompositeIntent composite, CompositionOptions options) {
        return compose(composite.intents(), composite.strategy(), options);
    }

    /**
     * 按名称指定策略，未知名称抛出 UnsupportedCompositionPatternException
     */
    public CompositionResult compose(List<Intent> intents, String strategy, CompositionOptions options) {
        return compose(intents, CompositionStrategy.of(strategy), options);
    }

    public CompositionResult compose(List<Intent> intents, CompositionStrategy strategy, CompositionOptions options) {
        if (strategy == null) {
            throw new UnsupportedCompositionPatternException(null);
        }
        CompositionOptions opts = options != null ? options : CompositionOptions.defaults();
        List<Intent> prepared = router.getPipeline().runCompose(List.copyOf(intents), strategy).orThrow();

        long startTime = System.currentTimeMillis();
        boolean success = false;
        try {
            CompositionResult result = switch (strategy) {
                case SEQUENTIAL -> sequential(prepared, opts);
                case PARALLEL -> parallel(prepared, opts);
                case CONDITIONAL -> conditional(prepared, opts);
                case PIPELINE -> pipeline(prepared, opts);
                case FAN_OUT -> fanOut(prepared, opts);
            };
            success = result.allSucceeded();
            return result;
        } finally {
            long duration = System.currentTimeMillis() - startTime;
            log.debug("[{}] {} composition of {} intents finished in {}ms (success={})",
                    SOURCE, strategy.key(), prepared.size(), duration, success);
            eventBus.publish(new FabricEvent.CompositionCompleted(SOURCE, strategy, prepared.size(), duration, success));
        }
    }

    // ================= 策略实现 =================

    private CompositionResult sequential(List<Intent> intents, CompositionOptions opts) {
        DispatchOptions dispatchOptions = opts.toDispatchOptions();
        List<IntentResult> results = new ArrayList<>();
        for (Intent intent : intents) {
            IntentResult result = router.dispatchForResult(intent, dispatchOptions);
            results.add(result);
            if (!result.isSuccess()) {
                throw new CompositionException(CompositionStrategy.SEQUENTIAL.key(), result, results);
            }
        }
        return new CompositionResult.Listed(CompositionStrategy.SEQUENTIAL, results);
    }

    private CompositionResult parallel(List<Intent> intents, CompositionOptions opts) {
        DispatchOptions dispatchOptions = opts.toDispatchOptions();
        List<CompletableFuture<IntentResult>> futures = new ArrayList<>();
        for (Intent intent : intents) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> router.dispatchForResult(intent, dispatchOptions), branchExecutor));
        }
        return new CompositionResult.Listed(CompositionStrategy.PARALLEL, joinInOrder(intents, futures));
    }

    private CompositionResult conditional(List<Intent> intents, CompositionOptions opts) {
        DispatchOptions dispatchOptions = opts.toDispatchOptions();
        List<IntentResult> results = new ArrayList<>();
        for (Intent intent : intents) {
            results.add(router.dispatchForResult(intent, dispatchOptions));
            if (!opts.getContinueWhile().test(List.copyOf(results))) {
                log.debug("[{}] Conditional composition stopped after {} of {} intents",
                        SOURCE, results.size(), intents.size());
                break;
            }
        }
        return new CompositionResult.Listed(CompositionStrategy.CONDITIONAL, results);
    }

    /**
     * 每一步的 payload = 自身 payload + 累积上下文 + previous_result
     */
    private CompositionResult pipeline(List<Intent> intents, CompositionOptions opts) {
        DispatchOptions dispatchOptions = opts.toDispatchOptions();
        List<IntentResult> results = new ArrayList<>();
        Map<String, Object> context = new LinkedHashMap<>();
        Object previous = null;
        boolean first = true;

        for (Intent intent : intents) {
            Intent step = intent;
            if (!first) {
                Map<String, Object> payload = new LinkedHashMap<>(intent.payload());
                payload.putAll(context);
                payload.put(PREVIOUS_RESULT, previous);
                step = intent.withPayload(payload);
            }

            IntentResult result = router.dispatchForResult(step, dispatchOptions);
            results.add(result);
            if (!result.isSuccess()) {
                throw new CompositionException(CompositionStrategy.PIPELINE.key(), result, results);
            }

            previous = result.value();
            mergeInto(context, previous);
            first = false;
        }
        return new CompositionResult.Merged(previous, context, results);
    }

    private CompositionResult fanOut(List<Intent> intents, CompositionOptions opts) {
        List<String> targets = resolveFanOutTargets(intents, opts);
        DispatchOptions dispatchOptions = opts.toDispatchOptions();

        List<CompletableFuture<CompositionResult.TargetResult>> futures = new ArrayList<>();
        for (String targetId : targets) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                // 同一目标内按顺序派发
                List<IntentResult> results = new ArrayList<>();
                for (Intent intent : intents) {
                    results.add(router.dispatchToForResult(intent, targetId, dispatchOptions));
                }
                return new CompositionResult.TargetResult(targetId, results);
            }, branchExecutor));
        }

        List<CompositionResult.TargetResult> perTarget = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            String targetId = targets.get(i);
            try {
                perTarget.add(futures.get(i).join());
            } catch (RuntimeException e) {
                log.error("[{}] Fan-out branch for {} failed unexpectedly", SOURCE, targetId, e);
                List<IntentResult> failed = new ArrayList<>();
                for (Intent intent : intents) {
                    failed.add(IntentResult.failure(intent.id(), targetId, unwrap(e), 0));
                }
                perTarget.add(new CompositionResult.TargetResult(targetId, failed));
            }
        }
        return new CompositionResult.FanOut(perTarget);
    }

    private List<String> resolveFanOutTargets(List<Intent> intents, CompositionOptions opts) {
        if (opts.getTargets() != null && !opts.getTargets().isEmpty()) {
            return List.copyOf(opts.getTargets());
        }
        DiscoveryPattern pattern = opts.getTargetPattern();
        if (pattern == null) {
            pattern = intents.isEmpty()
                    ? DiscoveryPattern.any()
                    : router.getRoutingTable().classify(intents.get(0));
        }
        List<String> targets = new ArrayList<>();
        for (ComponentMatch match : discovery.findComponents(pattern)) {
            targets.add(match.componentId());
        }
        if (targets.isEmpty()) {
            throw new NoAvailableTargetsException("no fan_out targets for " + pattern);
        }
        return targets;
    }

    // ================= 工具方法 =================

    private static List<IntentResult> joinInOrder(List<Intent> intents,
                                                  List<CompletableFuture<IntentResult>> futures) {
        List<IntentResult> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).join());
            } catch (RuntimeException e) {
                // dispatchForResult 不抛异常，这里只可能是执行器拒绝等意外
                results.add(IntentResult.failure(intents.get(i).id(), null, unwrap(e), 0));
            }
        }
        return results;
    }

    private static Throwable unwrap(Throwable e) {
        return e.getCause() != null && e instanceof CompletionException ? e.getCause() : e;
    }

    private static void mergeInto(Map<String, Object> context, Object output) {
        if (output instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                context.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        } else if (output != null) {
            context.put(RESULT, output);
        }
    }
}
