package com.capflow.core.event;

import com.capflow.api.component.Health;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FabricEventBus 单元测试")
public class FabricEventBusTest {

    private FabricEventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new FabricEventBus("test");
    }

    @Test
    @DisplayName("只投递给订阅了对应类型的监听器")
    void deliversByType() {
        AtomicReference<FabricEvent.HealthProbed> received = new AtomicReference<>();
        AtomicInteger unrelated = new AtomicInteger();
        eventBus.subscribe(FabricEvent.HealthProbed.class, received::set);
        eventBus.subscribe(FabricEvent.ComponentUnregistered.class, e -> unrelated.incrementAndGet());

        int delivered = eventBus.publish(new FabricEvent.HealthProbed("discovery", "c-1", Health.HEALTHY));

        assertEquals(1, delivered);
        assertEquals("c-1", received.get().componentId());
        assertEquals(0, unrelated.get());
    }

    @Test
    @DisplayName("subscribeAll 接收全部事件")
    void subscribeAllReceivesEverything() {
        List<FabricEvent> events = new ArrayList<>();
        eventBus.subscribeAll(events::add);

        eventBus.publish(new FabricEvent.ComponentUnregistered("discovery", "a"));
        eventBus.publish(new FabricEvent.RetryAttempted("retry", 1, 10, "timeout"));

        assertEquals(2, events.size());
    }

    @Test
    @DisplayName("取消订阅后不再收到事件")
    void unsubscribeStopsDelivery() {
        AtomicInteger count = new AtomicInteger();
        FabricEventBus.Subscription subscription =
                eventBus.subscribe(FabricEvent.ComponentUnregistered.class, e -> count.incrementAndGet());

        eventBus.publish(new FabricEvent.ComponentUnregistered("discovery", "a"));
        subscription.unsubscribe();
        eventBus.publish(new FabricEvent.ComponentUnregistered("discovery", "a"));

        assertEquals(1, count.get());
        assertEquals(0, eventBus.getSubscriptionCount());
    }

    @Test
    @DisplayName("监听器异常不影响其他监听器与发布方")
    void listenerFailureIsContained() {
        AtomicInteger count = new AtomicInteger();
        eventBus.subscribe(FabricEvent.ComponentUnregistered.class, e -> {
            throw new IllegalStateException("boom");
        });
        eventBus.subscribe(FabricEvent.ComponentUnregistered.class, e -> count.incrementAndGet());

        int delivered = assertDoesNotThrow(
                () -> eventBus.publish(new FabricEvent.ComponentUnregistered("discovery", "a")));

        assertEquals(1, delivered);
        assertEquals(1, count.get());
        assertEquals(1, eventBus.getFailedDeliveries());
    }
}
