package com.capflow.core.event;

import com.capflow.api.component.Health;
import com.capflow.api.intent.CompositionStrategy;

/**
 * 运行时内部事件（组件间通信用）
 * 注意：这是内部事件，不暴露给外部
 */
public sealed interface FabricEvent {

    /**
     * 发布者，例如 discovery / router / composer / catalog
     */
    String source();

    // ===== 组件事件 =====

    record ComponentRegistered(String source, String componentId, String type, boolean replaced) implements FabricEvent {
    }

    record ComponentUnregistered(String source, String componentId) implements FabricEvent {
    }

    record ComponentMetadataUpdated(String source, String componentId) implements FabricEvent {
    }

    /**
     * 健康缓存整体刷新
     */
    record HealthRefreshed(String source, int componentCount, long unhealthyCount) implements FabricEvent {
    }

    /**
     * 单个组件健康探测完成
     */
    record HealthProbed(String source, String componentId, Health health) implements FabricEvent {
    }

    // ===== 派发事件（用于指标/监控）=====

    record IntentDispatched(String source, String intentId, String targetId, long durationMs,
                            boolean success) implements FabricEvent {
    }

    record DispatchTimedOut(String source, String intentId, String targetId, long timeoutMs,
                            boolean cancelled) implements FabricEvent {
    }

    record CompositionCompleted(String source, CompositionStrategy strategy, int intentCount, long durationMs,
                                boolean success) implements FabricEvent {
    }

    record RetryAttempted(String source, int attempt, long delayMs, String reason) implements FabricEvent {
    }

    // ===== 能力目录 =====

    record CapabilityRegistered(String source, String capabilityId, boolean replaced) implements FabricEvent {
    }
}
