package com.capflow.core.compose;

import java.time.Duration;
import java.util.Objects;

/**
 * 重试策略
 *
 * @param maxRetries         首次尝试之后最多再试几次
 * @param retryDelay         基础等待时间
 * @param exponentialBackoff 是否指数退避：delay = min(base * 2^attempt, maxDelay)
 * @param maxDelay           单次等待上限
 */
public record RetryPolicy(int maxRetries, Duration retryDelay, boolean exponentialBackoff, Duration maxDelay) {

    // 2^20 倍已远超任何合理的上限，避免移位溢出
    private static final int MAX_SHIFT = 20;

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        }
        Objects.requireNonNull(retryDelay, "retryDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(100), true, Duration.ofSeconds(5));
    }

    public static RetryPolicy fixed(int maxRetries, Duration delay) {
        return new RetryPolicy(maxRetries, delay, false, delay);
    }

    public RetryPolicy withMaxRetries(int newMaxRetries) {
        return new RetryPolicy(newMaxRetries, retryDelay, exponentialBackoff, maxDelay);
    }

    /**
     * 第 attempt 次失败（从 0 开始）后的等待时间
     */
    public Duration delayFor(int attempt) {
        long base = retryDelay.toMillis();
        long cap = maxDelay.toMillis();
        if (!exponentialBackoff) {
            return Duration.ofMillis(Math.min(base, cap));
        }
        int shift = Math.min(Math.max(attempt, 0), MAX_SHIFT);
        long delay = base << shift;
        // 溢出时取上限
        if (delay < 0 || (base != 0 && delay >> shift != base)) {
            delay = cap;
        }
        return Duration.ofMillis(Math.min(delay, cap));
    }
}
