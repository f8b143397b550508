package com.capflow.core.discovery;

import com.capflow.api.component.Health;
import com.capflow.api.exception.CapFlowException;
import com.capflow.api.exception.ComponentNotRegisteredException;
import com.capflow.api.exception.ErrorCode;
import com.capflow.api.security.CapabilityAlgebra;
import com.capflow.core.config.CapFlowConfig;
import com.capflow.core.event.FabricEvent;
import com.capflow.core.event.FabricEventBus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 组件发现服务
 * <p>
 * 职责：
 * 1. 维护可派发组件的注册表（注册 / 注销 / 元数据更新）
 * 2. 按模式查找组件并打分、排序
 * 3. 负载均衡选择最佳组件
 * 4. 缓存健康检查结果（TTL 过期后重新探测，后台定时清理）
 * </p>
 * <p>
 * 线程模型：注册表、健康缓存、负载均衡计数器只在单个串行循环线程内读写，
 * 其他线程通过 {@link #call(Callable)} 提交请求并在超时内同步等待结果。
 * 健康探针属于用户代码，始终在循环线程之外执行，慢探针不会阻塞注册表。
 * </p>
 */
@Slf4j
public class ComponentDiscovery implements AutoCloseable {

    private static final String SOURCE = "discovery";

    private final CapFlowConfig config;
    private final FabricEventBus eventBus;
    private final Clock clock;

    private final ComponentMatcher matcher;
    private final MetadataIntrospector introspector = new MetadataIntrospector();
    private final HealthInspector healthInspector;

    // 串行循环（单线程）：所有状态只在这里读写
    private final ScheduledExecutorService loop;
    private volatile Thread loopThread;

    // 健康探针执行器（用户代码）
    private final ExecutorService probeExecutor;

    // ================= 循环线程独占的状态 =================

    private final Map<String, ComponentRecord> components = new LinkedHashMap<>();
    // 整体替换以保证刷新的原子性
    private Map<String, HealthCacheEntry> healthCache = new HashMap<>();
    private final LoadBalancer loadBalancer;

    private volatile boolean closed = false;

    public ComponentDiscovery(CapFlowConfig config, CapabilityAlgebra algebra, FabricEventBus eventBus) {
        this(config, algebra, eventBus, Clock.systemUTC(), new Random());
    }

    public ComponentDiscovery(CapFlowConfig config,
                              CapabilityAlgebra algebra,
                              FabricEventBus eventBus,
                              Clock clock,
                              Random random) {
        this.config = Objects.requireNonNull(config, "config");
        this.eventBus = eventBus != null ? eventBus : new FabricEventBus(SOURCE);
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.matcher = new ComponentMatcher(algebra);
        this.loadBalancer = new LoadBalancer(random);

        this.loop = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "capflow-discovery");
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        });

        AtomicInteger probeThreadNumber = new AtomicInteger(1);
        this.probeExecutor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "capflow-health-probe-" + probeThreadNumber.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
        this.healthInspector = new HealthInspector(probeExecutor, config.getHealthProbeTimeout());

        schedulePurge();
        log.info("[{}] Component discovery started, health cache ttl={}ms",
                SOURCE, config.getHealthCacheTtl().toMillis());
    }

    // ================= 注册 =================

    public boolean registerComponent(String id, Object handle) {
        return registerComponent(id, handle, null);
    }

    /**
     * 注册组件，重复注册时替换旧记录
     *
     * @param metadata 调用方元数据，非空字段覆盖推导值
     * @return true 表示首次注册，false 表示替换了已有记录
     */
    public boolean registerComponent(String id, Object handle, ComponentMetadata metadata) {
        Objects.requireNonNull(id, "id");
        // 推导在调用线程完成，不占用循环
        ComponentMetadata derived = introspector.derive(handle).mergedWith(metadata);
        ComponentRecord record = new ComponentRecord(id, handle, derived, clock.instant());

        boolean replaced = call(() -> {
            ComponentRecord previous = components.put(id, record);
            if (previous != null) {
                healthCache.remove(id);
                loadBalancer.forget(id);
            }
            return previous != null;
        });

        if (replaced) {
            log.warn("[{}] Component {} was re-registered, previous record replaced", SOURCE, id);
        } else {
            log.info("[{}] Component registered: {} (type={}, version={})",
                    SOURCE, id, derived.type(), derived.version());
        }
        eventBus.publish(new FabricEvent.ComponentRegistered(SOURCE, id, derived.type(), replaced));
        return !replaced;
    }

    /**
     * 注销组件，同时清理健康缓存与负载均衡状态
     */
    public boolean unregisterComponent(String id) {
        boolean removed = call(() -> {
            healthCache.remove(id);
            loadBalancer.forget(id);
            return components.remove(id) != null;
        });
        if (removed) {
            log.info("[{}] Component unregistered: {}", SOURCE, id);
            eventBus.publish(new FabricEvent.ComponentUnregistered(SOURCE, id));
        }
        return removed;
    }

    /**
     * 浅合并元数据
     *
     * @throws ComponentNotRegisteredException 组件未注册
     */
    public ComponentMetadata updateComponentMetadata(String id, ComponentMetadata partial) {
        ComponentMetadata merged = call(() -> {
            ComponentRecord record = components.get(id);
            if (record == null) {
                return null;
            }
            ComponentMetadata result = record.metadata().mergedWith(partial);
            components.put(id, record.withMetadata(result));
            return result;
        });
        if (merged == null) {
            throw new ComponentNotRegisteredException(id);
        }
        log.debug("[{}] Metadata of component {} updated: {}", SOURCE, id, merged);
        eventBus.publish(new FabricEvent.ComponentMetadataUpdated(SOURCE, id));
        return merged;
    }

    // ================= 查询 =================

    public Optional<ComponentRecord> findComponent(String id) {
        return Optional.ofNullable(call(() -> components.get(id)));
    }

    public boolean isRegistered(String id) {
        return call(() -> components.containsKey(id));
    }

    public List<ComponentRecord> listComponents() {
        return call(() -> new ArrayList<>(components.values()));
    }

    /**
     * 按模式查找组件，结果按得分降序
     */
    public List<ComponentMatch> findComponents(DiscoveryPattern pattern) {
        DiscoveryPattern effective = pattern != null ? pattern : DiscoveryPattern.any();

        // 1. 在循环内取快照并做静态过滤
        List<ComponentRecord> candidates = call(() -> {
            List<ComponentRecord> result = new ArrayList<>();
            for (ComponentRecord record : components.values()) {
                if (matcher.matchesStatic(record, effective)) {
                    result.add(record);
                }
            }
            return result;
        });
        if (candidates.isEmpty()) {
            return List.of();
        }

        // 2. 解析健康（必要时在循环外探测）
        Map<String, Health> healthById = resolveHealth(candidates);

        // 3. 健康过滤 + 打分 + 排序
        List<ComponentMatch> matches = new ArrayList<>();
        for (ComponentRecord record : candidates) {
            Health health = healthById.getOrDefault(record.id(), Health.UNKNOWN);
            if (effective.health() != null && effective.health() != health) {
                continue;
            }
            matches.add(new ComponentMatch(record, health, matcher.score(record, health, effective)));
        }
        // List.sort 是稳定排序，同分时保持注册顺序
        matches.sort(Comparator.comparingDouble(ComponentMatch::score).reversed());
        return matches;
    }

    public Optional<ComponentMatch> getBestMatch(DiscoveryPattern pattern) {
        return getBestMatch(pattern, config.getDefaultLoadBalancing());
    }

    /**
     * 查找并按负载均衡策略选择一个组件，无匹配时返回空
     */
    public Optional<ComponentMatch> getBestMatch(DiscoveryPattern pattern, LoadBalancingStrategy strategy) {
        List<ComponentMatch> matches = findComponents(pattern);
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        LoadBalancingStrategy effective = strategy != null ? strategy : config.getDefaultLoadBalancing();
        ComponentMatch selected = call(() -> loadBalancer.select(matches, effective));
        log.debug("[{}] Selected component {} by {} among {} matches",
                SOURCE, selected.componentId(), effective.key(), matches.size());
        return Optional.of(selected);
    }

    /**
     * 释放一次 least_connections 选择占用的连接计数
     */
    public void releaseConnection(String id) {
        call(() -> {
            loadBalancer.release(id);
            return null;
        });
    }

    public int activeConnections(String id) {
        return call(() -> loadBalancer.connectionCount(id));
    }

    // ================= 健康 =================

    /**
     * 查询组件健康，缓存未命中或过期时重新探测；未注册的组件返回 UNKNOWN
     */
    public Health getComponentHealth(String id) {
        ComponentRecord record = call(() -> components.get(id));
        if (record == null) {
            return Health.UNKNOWN;
        }
        return resolveHealth(List.of(record)).getOrDefault(id, Health.UNKNOWN);
    }

    /**
     * 重新探测全部组件，并一次性替换健康缓存
     */
    public void refreshHealthCache() {
        List<ComponentRecord> snapshot = listComponents();
        Instant now = clock.instant();

        Map<String, HealthCacheEntry> fresh = new HashMap<>();
        checkAll(snapshot).forEach((id, health) -> fresh.put(id, new HealthCacheEntry(health, now)));

        call(() -> {
            // 探测期间被注销或替换的组件不写回
            fresh.keySet().removeIf(id -> {
                ComponentRecord current = components.get(id);
                return current == null || !sameHandle(current, snapshot, id);
            });
            healthCache = fresh;
            return null;
        });

        long unhealthy = fresh.values().stream().filter(e -> e.health() == Health.UNHEALTHY).count();
        log.info("[{}] Health cache refreshed: {} components, {} unhealthy", SOURCE, fresh.size(), unhealthy);
        eventBus.publish(new FabricEvent.HealthRefreshed(SOURCE, fresh.size(), unhealthy));
    }

    public int healthCacheSize() {
        return call(() -> healthCache.size());
    }

    private Map<String, Health> resolveHealth(List<ComponentRecord> records) {
        Instant now = clock.instant();
        Duration ttl = config.getHealthCacheTtl();

        Map<String, Health> resolved = new HashMap<>();
        List<ComponentRecord> stale = call(() -> {
            List<ComponentRecord> toProbe = new ArrayList<>();
            for (ComponentRecord record : records) {
                HealthCacheEntry entry = healthCache.get(record.id());
                if (entry != null && !entry.isExpired(now, ttl)) {
                    resolved.put(record.id(), entry.health());
                } else {
                    toProbe.add(record);
                }
            }
            return toProbe;
        });

        if (stale.isEmpty()) {
            return resolved;
        }

        Map<String, HealthCacheEntry> probed = new HashMap<>();
        Instant probedAt = clock.instant();
        checkAll(stale).forEach((id, health) -> {
            resolved.put(id, health);
            probed.put(id, new HealthCacheEntry(health, probedAt));
        });

        call(() -> {
            for (ComponentRecord record : stale) {
                ComponentRecord current = components.get(record.id());
                // 仅当同一句柄仍在注册时才写回缓存
                if (current != null && current.handle() == record.handle()) {
                    healthCache.put(record.id(), probed.get(record.id()));
                }
            }
            return null;
        });
        return resolved;
    }

    private Map<String, Health> checkAll(List<ComponentRecord> records) {
        Map<String, Health> probed = healthInspector.inspectAll(records);
        probed.forEach((id, health) -> {
            log.debug("[{}] Health probed: {} -> {}", SOURCE, id, health);
            eventBus.publish(new FabricEvent.HealthProbed(SOURCE, id, health));
        });
        return probed;
    }

    private static boolean sameHandle(ComponentRecord current, List<ComponentRecord> snapshot, String id) {
        for (ComponentRecord record : snapshot) {
            if (record.id().equals(id)) {
                return record.handle() == current.handle();
            }
        }
        return false;
    }

    /**
     * 后台清理：按 TTL 周期运行，每次执行后重新调度自身
     */
    private void schedulePurge() {
        if (closed) {
            return;
        }
        long ttlMillis = Math.max(1L, config.getHealthCacheTtl().toMillis());
        try {
            loop.schedule(() -> {
                try {
                    purgeExpired();
                } catch (RuntimeException e) {
                    log.error("[{}] Health cache purge failed", SOURCE, e);
                } finally {
                    schedulePurge();
                }
            }, ttlMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[{}] Purge timer stopped, loop is shut down", SOURCE);
        }
    }

    private void purgeExpired() {
        Instant now = clock.instant();
        Duration ttl = config.getHealthCacheTtl();
        int before = healthCache.size();
        healthCache.values().removeIf(entry -> entry.isExpired(now, ttl));
        int purged = before - healthCache.size();
        if (purged > 0) {
            log.debug("[{}] Purged {} expired health cache entries", SOURCE, purged);
        }
    }

    // ================= 串行循环 =================

    /**
     * 在串行循环内执行并同步等待结果
     */
    private <T> T call(Callable<T> task) {
        if (Thread.currentThread() == loopThread) {
            try {
                return task.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CapFlowException(ErrorCode.DISPATCH_FAILED, "Discovery task failed", e);
            }
        }

        Future<T> future;
        try {
            future = loop.submit(task);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Component discovery is closed", e);
        }

        Duration timeout = config.getServiceCallTimeout();
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CapFlowException(ErrorCode.TIMEOUT,
                    "Discovery did not respond within " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new CapFlowException(ErrorCode.DISPATCH_FAILED, "Discovery task failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapFlowException(ErrorCode.DISPATCH_FAILED, "Interrupted while waiting for discovery", e);
        }
    }

    public DiscoveryStats getStats() {
        return call(() -> new DiscoveryStats(components.size(), healthCache.size(),
                loadBalancer.roundRobinCounter()));
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        loop.shutdownNow();
        probeExecutor.shutdownNow();
        log.info("[{}] Component discovery closed", SOURCE);
    }

    public record DiscoveryStats(int componentCount, int healthCacheSize, long roundRobinCounter) {
        @Override
        public String toString() {
            return String.format("DiscoveryStats{components=%d, healthCache=%d, roundRobin=%d}",
                    componentCount, healthCacheSize, roundRobinCounter);
        }
    }
}
