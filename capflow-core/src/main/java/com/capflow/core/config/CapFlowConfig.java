package com.capflow.core.config;

import com.capflow.core.compose.RetryPolicy;
import com.capflow.core.discovery.LoadBalancingStrategy;
import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.time.Duration;

/**
 * CapFlow Core 配置对象
 * <p>
 * 职责：作为 Core 层的唯一配置入口。配置对象显式传入需要它的服务，不存在全局单例，
 * 同一进程内可以并存多套互不干扰的运行时（例如并发执行的单元测试）。
 * </p>
 */
@Data
@Builder
@ToString
public class CapFlowConfig {

    // ================= 派发 =================

    /**
     * 单次派发等待目标响应的上限
     */
    @Builder.Default
    private Duration dispatchTimeout = Duration.ofSeconds(5);

    /**
     * 超时后是否中断仍在执行的目标任务
     * <p>
     * true: 取消对应的 Future（中断执行线程）
     * <p>
     * false: 仅向调用方报告超时，目标侧继续执行
     */
    @Builder.Default
    private boolean cancelOnTimeout = true;

    /**
     * 派发线程数
     */
    @Builder.Default
    private int dispatchThreads = Math.max(2, Runtime.getRuntime().availableProcessors());

    /**
     * 派发前是否校验目标声明的能力满足意图所需能力
     */
    @Builder.Default
    private boolean enforceCapabilities = true;

    /**
     * 路由无匹配时的兜底目标（为空表示不兜底）
     */
    private String defaultTargetId;

    /**
     * 默认负载均衡策略
     */
    @Builder.Default
    private LoadBalancingStrategy defaultLoadBalancing = LoadBalancingStrategy.ROUND_ROBIN;

    // ================= 发现 =================

    /**
     * 健康探针超时
     */
    @Builder.Default
    private Duration healthProbeTimeout = Duration.ofSeconds(30);

    /**
     * 健康缓存有效期
     */
    @Builder.Default
    private Duration healthCacheTtl = Duration.ofSeconds(30);

    /**
     * 服务内部串行循环的往返等待上限
     */
    @Builder.Default
    private Duration serviceCallTimeout = Duration.ofSeconds(5);

    // ================= 组合 =================

    /**
     * 重试叠加层的默认策略
     */
    @Builder.Default
    private RetryPolicy defaultRetry = RetryPolicy.defaults();

    // ================= 能力目录 =================

    /**
     * 启动时是否通过 ServiceLoader 自动注册能力单元
     */
    @Builder.Default
    private boolean autoDiscoverCapabilities = true;

    public static CapFlowConfig defaults() {
        return CapFlowConfig.builder().build();
    }
}
