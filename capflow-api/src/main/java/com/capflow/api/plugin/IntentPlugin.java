package com.capflow.api.plugin;

import com.capflow.api.exception.IntentRejectedException;
import com.capflow.api.intent.CompositionStrategy;
import com.capflow.api.intent.Intent;

import java.util.List;

/**
 * 意图插件
 * <p>
 * 在不修改核心派发路径的前提下扩展校验、转换、路由与组合。
 * 未实现的钩子默认原样透传。钩子抛出的任何异常都会在管线边界被捕获并转为失败结果；
 * 需要给出业务原因时抛出 {@link IntentRejectedException}，原因会被原样透传。
 * </p>
 *
 * @author CapFlow
 */
public interface IntentPlugin {

    PluginType type();

    /**
     * 优先级，越大越先执行
     */
    default int priority() {
        return 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * 校验钩子，返回（可能附加了信息的）意图
     */
    default Intent validate(Intent intent) {
        return intent;
    }

    /**
     * 转换钩子，意图 -> 意图
     */
    default Intent transform(Intent intent) {
        return intent;
    }

    /**
     * 路由钩子，可改写已解析出的目标 ID
     */
    default String route(Intent intent, String proposedTargetId) {
        return proposedTargetId;
    }

    /**
     * 组合钩子，可在执行前调整意图列表
     */
    default List<Intent> compose(List<Intent> intents, CompositionStrategy strategy) {
        return intents;
    }
}
