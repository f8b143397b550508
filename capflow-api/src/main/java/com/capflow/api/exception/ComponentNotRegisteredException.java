package com.capflow.api.exception;

/**
 * 组件未注册（元数据更新等操作）
 */
public class ComponentNotRegisteredException extends CapFlowException {

    public ComponentNotRegisteredException(String componentId) {
        super(ErrorCode.COMPONENT_NOT_REGISTERED, "Component not registered: " + componentId);
    }
}
