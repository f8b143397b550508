package com.capflow.core.discovery;

import com.capflow.api.component.Health;
import com.capflow.api.component.HealthProbe;
import lombok.extern.slf4j.Slf4j;

import java.lang.ref.Reference;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 健康探测
 * <p>
 * 句柄实现了 {@link HealthProbe} 时调用探针（带超时，在独立线程执行，批量时并发）；
 * 否则检查句柄本身是否存活：线程、进程、执行器、引用等按各自语义判断，
 * 其他对象只要句柄仍被持有即视为存活。
 * </p>
 */
@Slf4j
class HealthInspector {

    private final ExecutorService probeExecutor;
    private final Duration probeTimeout;

    HealthInspector(ExecutorService probeExecutor, Duration probeTimeout) {
        this.probeExecutor = probeExecutor;
        this.probeTimeout = probeTimeout;
    }

    Health inspect(String componentId, Object handle) {
        if (handle == null) {
            return Health.UNHEALTHY;
        }
        if (handle instanceof HealthProbe probe) {
            Future<Health> future = submit(componentId, probe);
            return future != null ? await(componentId, future, probeTimeout.toNanos()) : Health.UNKNOWN;
        }
        return isAlive(handle) ? Health.HEALTHY : Health.UNHEALTHY;
    }

    /**
     * 批量探测：先提交全部探针，再按同一截止时间收集结果，
     * 总耗时不超过一个探测超时
     */
    Map<String, Health> inspectAll(List<ComponentRecord> records) {
        Map<String, Health> results = new LinkedHashMap<>();
        Map<String, Future<Health>> pending = new LinkedHashMap<>();
        for (ComponentRecord record : records) {
            if (record.handle() instanceof HealthProbe probe) {
                Future<Health> future = submit(record.id(), probe);
                if (future != null) {
                    pending.put(record.id(), future);
                } else {
                    results.put(record.id(), Health.UNKNOWN);
                }
            } else {
                results.put(record.id(), inspect(record.id(), record.handle()));
            }
        }

        long deadline = System.nanoTime() + probeTimeout.toNanos();
        for (Map.Entry<String, Future<Health>> entry : pending.entrySet()) {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            results.put(entry.getKey(), await(entry.getKey(), entry.getValue(), remaining));
        }
        return results;
    }

    private Future<Health> submit(String componentId, HealthProbe probe) {
        try {
            return probeExecutor.submit(probe::checkHealth);
        } catch (RejectedExecutionException e) {
            log.warn("[discovery] Health probe rejected for component {}", componentId);
            return null;
        }
    }

    private Health await(String componentId, Future<Health> future, long timeoutNanos) {
        try {
            Health health = future.get(timeoutNanos, TimeUnit.NANOSECONDS);
            return health != null ? health : Health.UNKNOWN;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[discovery] Health probe of component {} timed out after {}ms",
                    componentId, probeTimeout.toMillis());
            return Health.UNKNOWN;
        } catch (ExecutionException e) {
            log.warn("[discovery] Health probe of component {} failed: {}",
                    componentId, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return Health.UNHEALTHY;
        } catch (CancellationException e) {
            return Health.UNKNOWN;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return Health.UNKNOWN;
        }
    }

    private static boolean isAlive(Object handle) {
        if (handle instanceof Thread thread) {
            return thread.isAlive();
        }
        if (handle instanceof Process process) {
            return process.isAlive();
        }
        if (handle instanceof ExecutorService executor) {
            return !executor.isShutdown();
        }
        if (handle instanceof Reference<?> reference) {
            return reference.get() != null;
        }
        return true;
    }
}
