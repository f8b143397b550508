package com.capflow.core.discovery;

import com.capflow.api.component.Health;

import java.time.Duration;
import java.time.Instant;

/**
 * 健康缓存项
 */
record HealthCacheEntry(Health health, Instant checkedAt) {

    boolean isExpired(Instant now, Duration ttl) {
        return !now.isBefore(checkedAt.plus(ttl));
    }
}
