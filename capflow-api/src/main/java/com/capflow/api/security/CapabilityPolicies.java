package com.capflow.api.security;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Map;
import java.util.Set;

/**
 * 常用上下文策略
 */
public final class CapabilityPolicies {

    /**
     * 上下文中的时间键，值可以是 {@link LocalTime}、{@link LocalDateTime} 或 {@link Instant}
     */
    public static final String CONTEXT_TIME = "time";

    private CapabilityPolicies() {
    }

    public static CapabilityPolicy allowAll() {
        return (capability, context) -> true;
    }

    /**
     * 时间窗口门控：gatedActions 中的动作只在 [from, until) 内可用，其他动作不受限
     * <p>
     * 上下文未提供时间时使用 clock 当前时间。窗口允许跨午夜（from > until）。
     * </p>
     */
    public static CapabilityPolicy timeWindow(LocalTime from, LocalTime until, Set<String> gatedActions, Clock clock) {
        Set<String> gated = Set.copyOf(gatedActions);
        return (capability, context) -> {
            if (!gated.contains(capability.action())) {
                return true;
            }
            LocalTime now = resolveTime(context, clock);
            if (from.isBefore(until)) {
                return !now.isBefore(from) && now.isBefore(until);
            }
            return !now.isBefore(from) || now.isBefore(until);
        };
    }

    public static CapabilityPolicy timeWindow(LocalTime from, LocalTime until, Set<String> gatedActions) {
        return timeWindow(from, until, gatedActions, Clock.systemDefaultZone());
    }

    private static LocalTime resolveTime(Map<String, Object> context, Clock clock) {
        Object value = context != null ? context.get(CONTEXT_TIME) : null;
        if (value instanceof LocalTime time) {
            return time;
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalTime();
        }
        if (value instanceof Instant instant) {
            ZoneId zone = clock.getZone();
            return LocalTime.ofInstant(instant, zone);
        }
        return LocalTime.now(clock);
    }
}
