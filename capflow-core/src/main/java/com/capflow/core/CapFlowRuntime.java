package com.capflow.core;

import com.capflow.api.intent.CompositionStrategy;
import com.capflow.api.intent.Intent;
import com.capflow.api.plugin.IntentPlugin;
import com.capflow.api.security.CapabilityAlgebra;
import com.capflow.core.catalog.CapabilityCatalog;
import com.capflow.core.catalog.CapabilityExecutor;
import com.capflow.core.compose.CompositionOptions;
import com.capflow.core.compose.CompositionResult;
import com.capflow.core.compose.IntentComposer;
import com.capflow.core.compose.RetryingComposer;
import com.capflow.core.config.CapFlowConfig;
import com.capflow.core.discovery.ComponentDiscovery;
import com.capflow.core.event.FabricEventBus;
import com.capflow.core.pipeline.PluginPipeline;
import com.capflow.core.router.IntentRouter;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 一套运行时实例：持有全部服务及其线程资源
 * <p>
 * 每个实例完全独立，没有进程级共享状态；关闭时释放线程池。
 * </p>
 */
@Slf4j
@Getter
public class CapFlowRuntime implements AutoCloseable {

    private final CapFlowConfig config;
    private final CapabilityAlgebra algebra;
    private final FabricEventBus eventBus;
    private final PluginPipeline pipeline;
    private final ComponentDiscovery discovery;
    private final IntentRouter router;
    private final IntentComposer composer;
    private final RetryingComposer retryingComposer;
    private final CapabilityCatalog catalog;
    private final CapabilityExecutor capabilityExecutor;

    @Getter(AccessLevel.NONE)
    private final ExecutorService dispatchExecutor;
    @Getter(AccessLevel.NONE)
    private final ExecutorService branchExecutor;

    CapFlowRuntime(CapFlowConfig config,
                   CapabilityAlgebra algebra,
                   FabricEventBus eventBus,
                   PluginPipeline pipeline,
                   ComponentDiscovery discovery,
                   IntentRouter router,
                   IntentComposer composer,
                   RetryingComposer retryingComposer,
                   CapabilityCatalog catalog,
                   CapabilityExecutor capabilityExecutor,
                   ExecutorService dispatchExecutor,
                   ExecutorService branchExecutor) {
        this.config = config;
        this.algebra = algebra;
        this.eventBus = eventBus;
        this.pipeline = pipeline;
        this.discovery = discovery;
        this.router = router;
        this.composer = composer;
        this.retryingComposer = retryingComposer;
        this.catalog = catalog;
        this.capabilityExecutor = capabilityExecutor;
        this.dispatchExecutor = dispatchExecutor;
        this.branchExecutor = branchExecutor;
    }

    // ================= 便捷入口 =================

    public boolean registerComponent(String id, Object handle) {
        return discovery.registerComponent(id, handle);
    }

    public boolean registerPlugin(IntentPlugin plugin) {
        return pipeline.register(plugin);
    }

    public Object dispatch(Intent intent) {
        return router.dispatch(intent);
    }

    public CompositionResult compose(List<Intent> intents, CompositionStrategy strategy) {
        return composer.compose(intents, strategy, CompositionOptions.defaults());
    }

    @Override
    public void close() {
        log.info("CapFlow shutting down...");
        discovery.close();
        shutdown(branchExecutor, "branch");
        shutdown(dispatchExecutor, "dispatch");
        eventBus.clear();
    }

    private static void shutdown(ExecutorService executor, String name) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("{} executor did not terminate in time, forcing shutdown", name);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
