package com.capflow.api.intent;

import com.capflow.api.security.Capability;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 意图工厂
 *
 * @author CapFlow
 */
public final class IntentFactory {

    private IntentFactory() {
    }

    public static Intent create(String type, Map<String, Object> payload, List<Capability> capabilities) {
        return new Intent(newId(), type, payload, capabilities, Map.of());
    }

    public static Intent create(String type, Map<String, Object> payload) {
        return create(type, payload, List.of());
    }

    /**
     * 运行时动态生成的意图，metadata 标记 dynamic=true
     */
    public static Intent createDynamic(String type, Map<String, Object> payload, List<Capability> capabilities) {
        return new Intent(newId(), type, payload, capabilities, Map.of(Intent.META_DYNAMIC, true));
    }

    public static CompositeIntent createComposite(List<Intent> intents, CompositionStrategy strategy) {
        return new CompositeIntent(intents, strategy, Map.of(Intent.META_COMPOSITE, true));
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
