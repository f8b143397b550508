package com.capflow.core.compose;

import com.capflow.api.intent.IntentResult;
import com.capflow.core.discovery.DiscoveryPattern;
import com.capflow.core.discovery.LoadBalancingStrategy;
import com.capflow.core.router.DispatchOptions;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.util.List;
import java.util.function.Predicate;

/**
 * 组合执行参数
 */
@Getter
@Builder
public class CompositionOptions {

    /**
     * 每个意图的派发超时，为空时使用配置默认值
     */
    private final Duration dispatchTimeout;

    /**
     * conditional 策略：对已累积的结果求值，返回 false 时提前结束
     * 默认"上一步成功才继续"
     */
    @Builder.Default
    private final Predicate<List<IntentResult>> continueWhile = CompositionOptions::lastSucceeded;

    /**
     * fan_out 策略：显式广播目标
     */
    private final List<String> targets;

    /**
     * fan_out 策略：未显式给出目标时用于发现目标的条件
     */
    private final DiscoveryPattern targetPattern;

    private final LoadBalancingStrategy loadBalancing;

    public static CompositionOptions defaults() {
        return CompositionOptions.builder().build();
    }

    public DispatchOptions toDispatchOptions() {
        return new DispatchOptions(dispatchTimeout, loadBalancing);
    }

    static boolean lastSucceeded(List<IntentResult> results) {
        return results.isEmpty() || results.get(results.size() - 1).isSuccess();
    }
}
