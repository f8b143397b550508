package com.capflow.core;

import com.capflow.api.security.CapabilityAlgebra;
import com.capflow.core.catalog.CapabilityCatalog;
import com.capflow.core.catalog.CapabilityExecutor;
import com.capflow.core.catalog.CapabilityMetrics;
import com.capflow.core.compose.IntentComposer;
import com.capflow.core.compose.RetryingComposer;
import com.capflow.core.config.CapFlowConfig;
import com.capflow.core.config.CapFlowConfigLoader;
import com.capflow.core.discovery.ComponentDiscovery;
import com.capflow.core.event.FabricEventBus;
import com.capflow.core.pipeline.PluginPipeline;
import com.capflow.core.router.IntentDispatcher;
import com.capflow.core.router.IntentRouter;
import com.capflow.core.router.RoutingTable;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * CapFlow 启动器
 * 组装全部服务并返回一个独立的 {@link CapFlowRuntime}，调用方负责关闭
 */
@Slf4j
public final class CapFlow {

    public static final String DEFAULT_CONFIG_RESOURCE = "capflow.yml";

    private CapFlow() {
    }

    /**
     * 使用默认配置启动
     */
    public static CapFlowRuntime start() {
        return start(CapFlowConfig.defaults());
    }

    /**
     * 从类路径 capflow.yml 读取配置启动（不存在时使用默认配置）
     */
    public static CapFlowRuntime startFromClasspath() {
        return start(CapFlowConfigLoader.loadFromClasspath(DEFAULT_CONFIG_RESOURCE));
    }

    public static CapFlowRuntime start(CapFlowConfig config) {
        return start(config, RoutingTable.standard(), CapabilityAlgebra.standard());
    }

    /**
     * 自定义路由表与能力代数启动
     */
    public static CapFlowRuntime start(CapFlowConfig config, RoutingTable routingTable, CapabilityAlgebra algebra) {
        long start = System.currentTimeMillis();
        log.info("Starting CapFlow runtime...");
        log.debug("CapFlow config: {}", config);

        // 基础设施
        FabricEventBus eventBus = new FabricEventBus("capflow");
        ExecutorService dispatchExecutor = IntentDispatcher.createExecutor(config.getDispatchThreads());
        AtomicInteger branchThreadNumber = new AtomicInteger(1);
        ExecutorService branchExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "capflow-compose-" + branchThreadNumber.getAndIncrement());
            t.setDaemon(true);
            return t;
        });

        // 核心服务
        PluginPipeline pipeline = new PluginPipeline("pipeline");
        ComponentDiscovery discovery = new ComponentDiscovery(config, algebra, eventBus);
        IntentDispatcher dispatcher = new IntentDispatcher(dispatchExecutor, config, eventBus);
        IntentRouter router = new IntentRouter(discovery, pipeline, routingTable, dispatcher, algebra, config);
        IntentComposer composer = new IntentComposer(router, discovery, eventBus, branchExecutor);
        RetryingComposer retryingComposer = new RetryingComposer(composer, config.getDefaultRetry(), eventBus);

        // 能力目录
        CapabilityCatalog catalog = new CapabilityCatalog(eventBus);
        if (config.isAutoDiscoverCapabilities()) {
            ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
            catalog.autoDiscover(classLoader != null ? classLoader : CapFlow.class.getClassLoader());
        }
        CapabilityExecutor capabilityExecutor = new CapabilityExecutor(catalog, new CapabilityMetrics());

        CapFlowRuntime runtime = new CapFlowRuntime(config, algebra, eventBus, pipeline, discovery, router,
                composer, retryingComposer, catalog, capabilityExecutor, dispatchExecutor, branchExecutor);

        log.info("CapFlow started in {} ms", System.currentTimeMillis() - start);
        return runtime;
    }
}
