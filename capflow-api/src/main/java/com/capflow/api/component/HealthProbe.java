package com.capflow.api.component;

/**
 * 可选的健康探针
 * 组件未实现时，发现服务退化为检查句柄本身是否存活
 */
@FunctionalInterface
public interface HealthProbe {

    Health checkHealth();
}
