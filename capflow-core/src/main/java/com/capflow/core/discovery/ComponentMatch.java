package com.capflow.core.discovery;

import com.capflow.api.component.Health;

/**
 * 发现结果：组件 + 健康状态 + 得分
 */
public record ComponentMatch(ComponentRecord component, Health health, double score) {

    public String componentId() {
        return component.id();
    }

    public Object handle() {
        return component.handle();
    }
}
