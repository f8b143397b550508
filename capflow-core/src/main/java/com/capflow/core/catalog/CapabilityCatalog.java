package com.capflow.core.catalog;

import com.capflow.api.catalog.CapabilityDescriptor;
import com.capflow.api.catalog.CapabilityUnit;
import com.capflow.api.exception.CapabilityNotFoundException;
import com.capflow.core.event.FabricEvent;
import com.capflow.core.event.FabricEventBus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 能力目录
 * <p>
 * 与组件发现相互独立的一张查找表：按自由文本意图或结构化条件检索能力。
 * 重复 ID 以后注册者为准。
 * </p>
 */
@Slf4j
public class CapabilityCatalog {

    private static final String SOURCE = "catalog";

    private final Map<String, CatalogEntry> entries = new ConcurrentHashMap<>();
    private final FabricEventBus eventBus;
    private final Clock clock;

    public CapabilityCatalog(FabricEventBus eventBus) {
        this(eventBus, Clock.systemUTC());
    }

    public CapabilityCatalog(FabricEventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    // ================= 注册 =================

    /**
     * 注册单元声明的全部能力
     *
     * @return 注册的能力数量
     */
    public int register(CapabilityUnit unit) {
        Objects.requireNonNull(unit, "unit");
        List<CapabilityDescriptor> descriptors = unit.capabilities();
        int count = 0;
        if (descriptors != null) {
            for (CapabilityDescriptor descriptor : descriptors) {
                register(descriptor, unit);
                count++;
            }
        }
        log.info("[{}] Registered {} capabilities from {}", SOURCE, count, unit.getClass().getName());
        return count;
    }

    /**
     * 注册单个能力
     *
     * @return true 表示新增，false 表示覆盖了同 ID 的旧条目
     */
    public boolean register(CapabilityDescriptor descriptor, Object module) {
        if (descriptor.getId() == null || descriptor.getId().isBlank()) {
            throw new IllegalArgumentException("Capability id must not be blank");
        }
        CatalogEntry entry = CatalogEntry.of(descriptor, module, clock.instant());
        CatalogEntry previous = entries.put(entry.id(), entry);
        if (previous != null) {
            log.warn("[{}] Capability {} was overwritten by {}", SOURCE, entry.id(),
                    module != null ? module.getClass().getName() : "<none>");
        } else {
            log.debug("[{}] Capability registered: {}", SOURCE, entry.id());
        }
        if (eventBus != null) {
            eventBus.publish(new FabricEvent.CapabilityRegistered(SOURCE, entry.id(), previous != null));
        }
        return previous == null;
    }

    /**
     * 通过 ServiceLoader 发现并注册全部能力单元，单个单元失败只记录日志
     *
     * @return 注册的能力总数
     */
    public int autoDiscover(ClassLoader classLoader) {
        int total = 0;
        int units = 0;
        ServiceLoader<CapabilityUnit> loader = ServiceLoader.load(CapabilityUnit.class, classLoader);
        for (ServiceLoader.Provider<CapabilityUnit> provider : loader.stream().toList()) {
            try {
                total += register(provider.get());
                units++;
            } catch (ServiceConfigurationError | RuntimeException e) {
                log.error("[{}] Failed to register capability unit {}", SOURCE, provider.type().getName(), e);
            }
        }
        log.info("[{}] Auto-discovered {} capabilities from {} units", SOURCE, total, units);
        return total;
    }

    // ================= 查询 =================

    /**
     * 自由文本检索：查询中任一单词（忽略大小写）出现在意图描述中即命中
     */
    public List<CatalogEntry> discover(String query) {
        List<CatalogEntry> matches = new ArrayList<>();
        for (CatalogEntry entry : listAll()) {
            if (intentMatches(entry.intent(), query)) {
                matches.add(entry);
            }
        }
        return matches;
    }

    /**
     * 结构化检索，所有条件同时成立（AND）
     * <ul>
     * <li>requires：条目必须 provide 全部所列字段</li>
     * <li>provides：条目必须 require 全部所列字段</li>
     * <li>intent：同自由文本检索</li>
     * <li>其他键：字段相等</li>
     * </ul>
     */
    public List<CatalogEntry> discover(Map<String, ?> criteria) {
        List<CatalogEntry> matches = new ArrayList<>();
        for (CatalogEntry entry : listAll()) {
            if (criteriaMatch(entry, criteria)) {
                matches.add(entry);
            }
        }
        return matches;
    }

    public Optional<CatalogEntry> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(entries.get(id));
    }

    /**
     * @throws CapabilityNotFoundException ID 不存在
     */
    public CatalogEntry get(String id) {
        return find(id).orElseThrow(() -> new CapabilityNotFoundException(id));
    }

    /**
     * 全部条目，按注册时间排序
     */
    public List<CatalogEntry> listAll() {
        List<CatalogEntry> all = new ArrayList<>(entries.values());
        all.sort(Comparator.comparing(CatalogEntry::registeredAt).thenComparing(CatalogEntry::id));
        return all;
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    // ================= 匹配 =================

    static boolean intentMatches(String intent, Object query) {
        if (intent == null || !(query instanceof String text)) {
            return false;
        }
        String intentLower = intent.toLowerCase(Locale.ROOT);
        for (String word : text.toLowerCase(Locale.ROOT).trim().split("\\s+")) {
            if (intentLower.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static boolean criteriaMatch(CatalogEntry entry, Map<String, ?> criteria) {
        if (criteria == null) {
            return true;
        }
        for (Map.Entry<String, ?> criterion : criteria.entrySet()) {
            Object value = criterion.getValue();
            boolean matched = switch (criterion.getKey()) {
                case CatalogEntry.FIELD_REQUIRES -> entry.provides().containsAll(wrap(value));
                case CatalogEntry.FIELD_PROVIDES -> entry.requires().containsAll(wrap(value));
                case CatalogEntry.FIELD_INTENT -> intentMatches(entry.intent(), value);
                default -> entry.fieldEquals(criterion.getKey(), value);
            };
            if (!matched) {
                return false;
            }
        }
        return true;
    }

    private static List<String> wrap(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            List<String> fields = new ArrayList<>();
            for (Object item : collection) {
                fields.add(String.valueOf(item));
            }
            return fields;
        }
        return List.of(value.toString());
    }
}
