package com.capflow.core.pipeline;

import com.capflow.api.exception.ErrorCode;
import com.capflow.api.exception.IntentRejectedException;

/**
 * 插件管道的执行结果
 * 成功时携带值；失败时携带原因（插件给出的原因原样透传）及出错插件名。
 * 成败由 success 标记决定，失败原因为空时记为 validation_failed
 *
 * @param <T> 结果类型
 */
public record PipelineResult<T>(boolean success, T value, String reason, String pluginName, Throwable cause) {

    public static final String PLUGIN_FAILED = "plugin_failed";
    public static final String PLUGIN_RETURNED_NULL = "plugin_returned_null";

    public static <T> PipelineResult<T> ok(T value) {
        return new PipelineResult<>(true, value, null, null, null);
    }

    public static <T> PipelineResult<T> failed(String reason, String pluginName, Throwable cause) {
        String effective = reason != null ? reason : ErrorCode.VALIDATION_FAILED.reason();
        return new PipelineResult<>(false, null, effective, pluginName, cause);
    }

    public boolean isOk() {
        return success;
    }

    /**
     * 成功则返回值，失败则抛出 {@link IntentRejectedException}
     */
    public T orThrow() {
        if (isOk()) {
            return value;
        }
        if (cause instanceof IntentRejectedException rejected) {
            throw rejected;
        }
        throw new IntentRejectedException(reason,
                "Rejected by plugin " + pluginName + ": " + reason, cause);
    }
}
