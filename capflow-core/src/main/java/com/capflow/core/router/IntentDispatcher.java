package com.capflow.core.router;

import com.capflow.api.component.IntentHandler;
import com.capflow.api.exception.CapFlowException;
import com.capflow.api.exception.DispatchException;
import com.capflow.api.exception.DispatchTimeoutException;
import com.capflow.api.intent.Intent;
import com.capflow.core.config.CapFlowConfig;
import com.capflow.core.discovery.ComponentRecord;
import com.capflow.core.event.FabricEvent;
import com.capflow.core.event.FabricEventBus;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 派发原语
 * 职责：线程隔离、超时控制、超时后按配置取消目标任务
 */
@Slf4j
public class IntentDispatcher {

    private static final String SOURCE = "dispatcher";
    private static final int QUEUE_CAPACITY = 1024;

    private final ExecutorService executor;
    private final CapFlowConfig config;
    private final FabricEventBus eventBus;

    public IntentDispatcher(ExecutorService executor, CapFlowConfig config, FabricEventBus eventBus) {
        this.executor = executor;
        this.config = config;
        this.eventBus = eventBus;
    }

    /**
     * 派发线程池：有界队列，满载时快速失败，不阻塞调用方
     */
    public static ExecutorService createExecutor(int threads) {
        AtomicInteger threadNumber = new AtomicInteger(1);
        return new ThreadPoolExecutor(
                threads, threads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(QUEUE_CAPACITY),
                r -> {
                    Thread t = new Thread(r, "capflow-dispatch-" + threadNumber.getAndIncrement());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * 将意图交给目标组件并在超时内等待结果
     *
     * @param timeout 为 null 时使用配置的 dispatchTimeout
     */
    public Object dispatch(Intent intent, ComponentRecord target, Duration timeout) {
        if (!(target.handle() instanceof IntentHandler handler)) {
            throw new DispatchException("Component " + target.id() + " does not accept intents");
        }
        Duration effective = timeout != null ? timeout : config.getDispatchTimeout();

        long startTime = System.currentTimeMillis();
        boolean success = false;
        try {
            Object result = doDispatch(intent, target.id(), handler, effective);
            success = true;
            return result;
        } finally {
            long duration = System.currentTimeMillis() - startTime;
            eventBus.publish(new FabricEvent.IntentDispatched(SOURCE, intent.id(), target.id(), duration, success));
        }
    }

    private Object doDispatch(Intent intent, String targetId, IntentHandler handler, Duration timeout) {
        Future<Object> future;
        try {
            future = executor.submit(() -> handler.handle(intent));
        } catch (RejectedExecutionException e) {
            throw new DispatchException("Dispatch rejected, executor is saturated or closed", e);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            boolean cancelled = config.isCancelOnTimeout() && future.cancel(true);
            log.warn("[{}] Intent {} timed out on {} after {}ms (cancelled={})",
                    SOURCE, intent.id(), targetId, timeout.toMillis(), cancelled);
            eventBus.publish(new FabricEvent.DispatchTimedOut(SOURCE, intent.id(), targetId,
                    timeout.toMillis(), cancelled));
            throw new DispatchTimeoutException(intent.id(), targetId, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CapFlowException capFlowException) {
                throw capFlowException;
            }
            log.debug("[{}] Intent {} failed on {}: {}", SOURCE, intent.id(), targetId,
                    cause != null ? cause.getMessage() : e.getMessage());
            throw new DispatchException("Target " + targetId + " failed: "
                    + (cause != null ? cause.getMessage() : e.getMessage()), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new DispatchException("Interrupted while waiting for " + targetId, e);
        }
    }
}
