package com.capflow.core.event;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 运行时内部事件总线
 * <p>
 * 在发布线程上同步投递，同一发布方的事件按发布顺序到达。
 * 监听器按事件类型分表存放；订阅 {@link FabricEvent} 本身即接收全部事件。
 * 监听器抛出的异常只记录日志并计数，不会传回发布方。
 * </p>
 */
@Slf4j
public class FabricEventBus {

    private final String name;

    // 事件类型 -> 监听器；FabricEvent.class 下的监听器接收全部事件
    private final Map<Class<? extends FabricEvent>, List<Consumer<? super FabricEvent>>> listeners =
            new ConcurrentHashMap<>();

    private final AtomicLong failedDeliveries = new AtomicLong();

    public FabricEventBus(String name) {
        this.name = name;
    }

    /**
     * 订阅某类事件
     *
     * @return 取消订阅的句柄
     */
    public <E extends FabricEvent> Subscription subscribe(Class<E> eventType, Consumer<E> handler) {
        Consumer<? super FabricEvent> adapter = event -> handler.accept(eventType.cast(event));
        List<Consumer<? super FabricEvent>> bucket =
                listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>());
        bucket.add(adapter);
        log.debug("[{}] Subscribed to {}", name, eventType.getSimpleName());
        return () -> bucket.remove(adapter);
    }

    /**
     * 订阅全部事件
     */
    public Subscription subscribeAll(Consumer<FabricEvent> handler) {
        return subscribe(FabricEvent.class, handler);
    }

    /**
     * 发布事件
     *
     * @return 成功投递的监听器数量
     */
    public int publish(FabricEvent event) {
        int delivered = deliver(listeners.get(event.getClass()), event);
        delivered += deliver(listeners.get(FabricEvent.class), event);
        log.trace("[{}] {} from {} delivered to {} listeners",
                name, event.getClass().getSimpleName(), event.source(), delivered);
        return delivered;
    }

    private int deliver(List<Consumer<? super FabricEvent>> bucket, FabricEvent event) {
        if (bucket == null) {
            return 0;
        }
        int delivered = 0;
        for (Consumer<? super FabricEvent> listener : bucket) {
            try {
                listener.accept(event);
                delivered++;
            } catch (RuntimeException e) {
                failedDeliveries.incrementAndGet();
                log.error("[{}] Listener failed on {} from {}",
                        name, event.getClass().getSimpleName(), event.source(), e);
            }
        }
        return delivered;
    }

    public void clear() {
        listeners.clear();
        log.debug("[{}] All subscriptions cleared", name);
    }

    public int getSubscriptionCount() {
        int count = 0;
        for (List<Consumer<? super FabricEvent>> bucket : listeners.values()) {
            count += bucket.size();
        }
        return count;
    }

    /**
     * 监听器抛出异常的累计次数
     */
    public long getFailedDeliveries() {
        return failedDeliveries.get();
    }

    /**
     * 订阅句柄
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
