package com.capflow.core.compose;

import com.capflow.api.intent.CompositionStrategy;
import com.capflow.api.intent.IntentResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 组合结果
 * <p>
 * sequential / parallel / conditional 返回按输入顺序排列的结果列表；
 * pipeline 返回单个合并后的最终结果；fan_out 返回每个目标一项。
 * </p>
 */
public sealed interface CompositionResult {

    CompositionStrategy strategy();

    /**
     * 展平后的全部单意图结果
     */
    List<IntentResult> intentResults();

    default String type() {
        return strategy().key();
    }

    default boolean allSucceeded() {
        return intentResults().stream().allMatch(IntentResult::isSuccess);
    }

    record Listed(CompositionStrategy strategy, List<IntentResult> results) implements CompositionResult {
        public Listed {
            results = List.copyOf(results);
        }

        @Override
        public List<IntentResult> intentResults() {
            return results;
        }
    }

    /**
     * @param output  最后一步的返回值
     * @param context 各步输出逐步合并后的上下文
     * @param results 每一步的结果
     */
    record Merged(Object output, Map<String, Object> context, List<IntentResult> results) implements CompositionResult {
        public Merged {
            context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
            results = List.copyOf(results);
        }

        @Override
        public CompositionStrategy strategy() {
            return CompositionStrategy.PIPELINE;
        }

        @Override
        public List<IntentResult> intentResults() {
            return results;
        }
    }

    record FanOut(List<TargetResult> results) implements CompositionResult {
        public FanOut {
            results = List.copyOf(results);
        }

        @Override
        public CompositionStrategy strategy() {
            return CompositionStrategy.FAN_OUT;
        }

        @Override
        public List<IntentResult> intentResults() {
            List<IntentResult> flattened = new ArrayList<>();
            for (TargetResult target : results) {
                flattened.addAll(target.results());
            }
            return flattened;
        }
    }

    record TargetResult(String targetId, List<IntentResult> results) {
        public TargetResult {
            results = List.copyOf(results);
        }

        public boolean allSucceeded() {
            return results.stream().allMatch(IntentResult::isSuccess);
        }
    }
}
