package com.capflow.api.component;

import com.capflow.api.security.Capability;

import java.util.List;

/**
 * 可选的自描述接口
 * <p>
 * 注册时用于推导未显式给出的元数据；返回 null 表示不提供，由发现服务使用默认值。
 * 调用方在注册时显式传入的元数据始终优先。
 * </p>
 */
public interface Introspectable {

    default String componentType() {
        return null;
    }

    default String version() {
        return null;
    }

    default List<Capability> capabilities() {
        return null;
    }

    default List<String> dependencies() {
        return null;
    }

    default List<String> tags() {
        return null;
    }
}
