package com.capflow.core.discovery;

import java.time.Instant;

/**
 * 已注册组件
 * 由 {@link ComponentDiscovery} 独占，只能通过 updateComponentMetadata 变更
 *
 * @param id           组件 ID
 * @param handle       指向实际服务的不透明句柄
 * @param metadata     补齐后的完整元数据
 * @param registeredAt 注册时间
 */
public record ComponentRecord(String id, Object handle, ComponentMetadata metadata, Instant registeredAt) {

    /**
     * 句柄的标识名，用于名称模糊匹配
     */
    public String name() {
        return handle != null ? handle.getClass().getName() : id;
    }

    public ComponentRecord withMetadata(ComponentMetadata newMetadata) {
        return new ComponentRecord(id, handle, newMetadata, registeredAt);
    }
}
