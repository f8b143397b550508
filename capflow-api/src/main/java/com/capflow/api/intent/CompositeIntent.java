package com.capflow.api.intent;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 组合意图
 * 不独占子意图，子意图可在别处复用
 */
public record CompositeIntent(List<Intent> intents,
                              CompositionStrategy strategy,
                              Map<String, Object> metadata) implements Serializable {

    public CompositeIntent {
        Objects.requireNonNull(strategy, "strategy");
        intents = intents == null ? List.of() : List.copyOf(intents);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public int size() {
        return intents.size();
    }
}
