package com.capflow.core.pipeline;

import com.capflow.api.exception.IntentRejectedException;
import com.capflow.api.intent.CompositionStrategy;
import com.capflow.api.intent.Intent;
import com.capflow.api.plugin.IntentPlugin;
import com.capflow.api.plugin.PluginType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiFunction;

/**
 * 插件管道
 * <p>
 * 职责：按优先级串联各类插件的钩子，在不修改派发主流程的前提下扩展
 * 校验 / 转换 / 路由 / 组合行为。
 * </p>
 * <p>
 * 管道是显式构造、显式注入的对象，不存在进程级共享的插件表；
 * 插件抛出的任何异常都在管道边界被捕获并转成失败结果。
 * </p>
 */
@Slf4j
public class PluginPipeline {

    private final String owner;

    // 读多写少，迭代期间允许并发注册
    private final List<IntentPlugin> plugins = new CopyOnWriteArrayList<>();

    public PluginPipeline() {
        this("pipeline");
    }

    public PluginPipeline(String owner) {
        this.owner = owner;
    }

    // ================= 注册 =================

    public boolean register(IntentPlugin plugin) {
        Objects.requireNonNull(plugin, "plugin");
        if (plugins.contains(plugin)) {
            log.warn("[{}] Plugin {} already registered, ignored", owner, plugin.name());
            return false;
        }
        plugins.add(plugin);
        log.info("[{}] Plugin registered: {} (type={}, priority={})",
                owner, plugin.name(), plugin.type(), plugin.priority());
        return true;
    }

    public boolean unregister(IntentPlugin plugin) {
        boolean removed = plugins.remove(plugin);
        if (removed) {
            log.info("[{}] Plugin unregistered: {}", owner, plugin.name());
        }
        return removed;
    }

    /**
     * 指定类型的插件，按优先级降序（同优先级保持注册顺序）
     */
    public List<IntentPlugin> getPluginsByType(PluginType type) {
        List<IntentPlugin> result = new ArrayList<>();
        for (IntentPlugin plugin : plugins) {
            if (plugin.type() == type) {
                result.add(plugin);
            }
        }
        result.sort(Comparator.comparingInt(IntentPlugin::priority).reversed());
        return result;
    }

    public List<IntentPlugin> getPlugins() {
        return List.copyOf(plugins);
    }

    // ================= 执行 =================

    /**
     * 依次执行校验插件，遇到第一个失败即停止
     */
    public PipelineResult<Intent> runValidate(Intent intent) {
        return thread(PluginType.VALIDATION, intent, false, (plugin, current) -> plugin.validate(current));
    }

    /**
     * 依次执行转换插件，意图在插件间链式传递
     */
    public PipelineResult<Intent> runTransform(Intent intent) {
        return thread(PluginType.TRANSFORMATION, intent, false, (plugin, current) -> plugin.transform(current));
    }

    /**
     * 依次执行路由插件，每个插件可改写上一个给出的目标 ID（null 表示没有建议目标）
     */
    public PipelineResult<String> runRoute(Intent intent, String proposedTargetId) {
        return thread(PluginType.ROUTING, proposedTargetId, true, (plugin, current) -> plugin.route(intent, current));
    }

    public PipelineResult<List<Intent>> runCompose(List<Intent> intents, CompositionStrategy strategy) {
        return thread(PluginType.COMPOSITION, intents, false, (plugin, current) -> plugin.compose(current, strategy));
    }

    private <T> PipelineResult<T> thread(PluginType type,
                                         T initial,
                                         boolean nullable,
                                         BiFunction<IntentPlugin, T, T> hook) {
        T current = initial;
        for (IntentPlugin plugin : getPluginsByType(type)) {
            try {
                T next = hook.apply(plugin, current);
                if (next == null && !nullable) {
                    log.warn("[{}] {} plugin {} returned null", owner, type, plugin.name());
                    return PipelineResult.failed(PipelineResult.PLUGIN_RETURNED_NULL, plugin.name(), null);
                }
                current = next;
            } catch (IntentRejectedException e) {
                // 插件定义的校验错误原样透传
                log.debug("[{}] {} plugin {} rejected: {}", owner, type, plugin.name(), e.getReason());
                return PipelineResult.failed(e.getReason(), plugin.name(), e);
            } catch (RuntimeException e) {
                log.error("[{}] {} plugin {} failed", owner, type, plugin.name(), e);
                return PipelineResult.failed(PipelineResult.PLUGIN_FAILED, plugin.name(), e);
            }
        }
        return PipelineResult.ok(current);
    }
}
