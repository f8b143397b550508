package com.capflow.api.exception;

import com.capflow.api.intent.IntentResult;

import java.util.List;

/**
 * 失败即停的组合策略（sequential / pipeline）在某一步失败时抛出
 * 已完成步骤的结果保留在 partialResults 中，不做回滚
 */
public class CompositionException extends CapFlowException {

    private final String strategy;
    private final List<IntentResult> partialResults;

    public CompositionException(String strategy, IntentResult failed, List<IntentResult> partialResults) {
        super(ErrorCode.COMPOSITION_FAILED,
                String.format("Composition [%s] failed at intent %s: %s", strategy, failed.intentId(), failed.reason()),
                failed.cause());
        this.strategy = strategy;
        this.partialResults = List.copyOf(partialResults);
    }

    public String getStrategy() {
        return strategy;
    }

    public List<IntentResult> getPartialResults() {
        return partialResults;
    }

    /**
     * 以失败步骤的原因为准
     */
    @Override
    public String getReason() {
        IntentResult last = partialResults.isEmpty() ? null : partialResults.get(partialResults.size() - 1);
        return last != null && last.reason() != null ? last.reason() : super.getReason();
    }
}
