package com.capflow.core.compose;

import com.capflow.api.exception.CapFlowException;
import com.capflow.api.exception.ErrorCode;
import com.capflow.api.exception.MaxRetriesExceededException;
import com.capflow.api.intent.CompositionStrategy;
import com.capflow.api.intent.Intent;
import com.capflow.api.intent.IntentResult;
import com.capflow.core.event.FabricEvent;
import com.capflow.core.event.FabricEventBus;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 重试叠加层
 * <p>
 * 同步阻塞：两次尝试之间让调用线程休眠，不依赖后台调度。
 * 抛出异常，或组合结果中有分支失败，都算一次失败的尝试；
 * 重试耗尽后抛出 {@link MaxRetriesExceededException}，携带最后一次失败原因。
 * </p>
 */
@Slf4j
public class RetryingComposer {

    private static final String SOURCE = "retry";

    private final IntentComposer composer;
    private final RetryPolicy defaultPolicy;
    private final FabricEventBus eventBus;
    private final Sleeper sleeper;

    public RetryingComposer(IntentComposer composer, RetryPolicy defaultPolicy, FabricEventBus eventBus) {
        this(composer, defaultPolicy, eventBus, Sleeper.THREAD);
    }

    public RetryingComposer(IntentComposer composer, RetryPolicy defaultPolicy, FabricEventBus eventBus,
                            Sleeper sleeper) {
        this.composer = composer;
        this.defaultPolicy = defaultPolicy != null ? defaultPolicy : RetryPolicy.defaults();
        this.eventBus = eventBus;
        this.sleeper = sleeper != null ? sleeper : Sleeper.THREAD;
    }

    public CompositionResult compose(List<Intent> intents, CompositionStrategy strategy, CompositionOptions options) {
        return compose(intents, strategy, options, defaultPolicy);
    }

    public CompositionResult compose(List<Intent> intents,
                                     CompositionStrategy strategy,
                                     CompositionOptions options,
                                     RetryPolicy policy) {
        return execute(() -> composer.compose(intents, strategy, options), RetryingComposer::firstFailure, policy);
    }

    /**
     * 按策略重试任意操作：共 maxRetries + 1 次尝试，只以抛出异常判定失败
     */
    public <T> T execute(Supplier<T> operation, RetryPolicy policy) {
        return execute(operation, value -> Optional.empty(), policy);
    }

    /**
     * @param failureOf 从返回值中取出失败；非空即视为本次尝试失败
     */
    private <T> T execute(Supplier<T> operation, Function<T, Optional<Failure>> failureOf, RetryPolicy policy) {
        RetryPolicy effective = policy != null ? policy : defaultPolicy;
        Failure last = null;

        for (int attempt = 0; attempt <= effective.maxRetries(); attempt++) {
            RuntimeException thrown = null;
            try {
                T value = operation.get();
                Optional<Failure> failure = failureOf.apply(value);
                if (failure.isEmpty()) {
                    return value;
                }
                last = failure.get();
            } catch (RuntimeException e) {
                thrown = e;
                last = new Failure(reasonOf(e), e);
            }
            if (attempt == effective.maxRetries()) {
                break;
            }
            Duration delay = effective.delayFor(attempt);
            log.warn("[{}] Attempt {} failed ({}), retrying in {}ms",
                    SOURCE, attempt + 1, last.reason(), delay.toMillis());
            if (eventBus != null) {
                eventBus.publish(new FabricEvent.RetryAttempted(SOURCE, attempt + 1, delay.toMillis(), last.reason()));
            }
            pause(delay, thrown != null ? thrown : last.cause());
        }

        int attempts = effective.maxRetries() + 1;
        log.error("[{}] Giving up after {} attempts: {}", SOURCE, attempts, last.reason());
        throw new MaxRetriesExceededException(attempts, last.reason(), last.cause());
    }

    private void pause(Duration delay, Throwable lastFailure) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CapFlowException interrupted = new CapFlowException(ErrorCode.DISPATCH_FAILED,
                    "Interrupted while waiting to retry", e);
            if (lastFailure != null) {
                interrupted.addSuppressed(lastFailure);
            }
            throw interrupted;
        }
    }

    /**
     * 组合结果中第一个失败的分支
     */
    private static Optional<Failure> firstFailure(CompositionResult result) {
        if (result == null) {
            return Optional.empty();
        }
        return result.intentResults().stream()
                .filter(r -> !r.isSuccess())
                .findFirst()
                .map(RetryingComposer::failureOf);
    }

    private static Failure failureOf(IntentResult result) {
        String reason = result.reason() != null ? result.reason() : result.errorCode().reason();
        return new Failure(reason, result.cause());
    }

    static String reasonOf(Throwable failure) {
        if (failure instanceof CapFlowException capFlowException) {
            return capFlowException.getReason();
        }
        return failure != null ? String.valueOf(failure.getMessage()) : null;
    }

    private record Failure(String reason, Throwable cause) {
    }
}
