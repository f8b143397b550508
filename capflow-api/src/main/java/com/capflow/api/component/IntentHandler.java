package com.capflow.api.component;

import com.capflow.api.intent.Intent;

/**
 * 可接收派发意图的组件
 * 返回值即效果（Effect），抛出异常视为派发失败
 */
@FunctionalInterface
public interface IntentHandler {

    Object handle(Intent intent) throws Exception;
}
