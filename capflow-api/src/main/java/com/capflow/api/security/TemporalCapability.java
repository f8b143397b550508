package com.capflow.api.security;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * 带有效期的能力，窗口为左闭右开 [validFrom, validUntil)
 */
public record TemporalCapability(Capability capability, Instant validFrom, Instant validUntil) implements Serializable {

    public TemporalCapability {
        Objects.requireNonNull(capability, "capability");
        Objects.requireNonNull(validFrom, "validFrom");
        Objects.requireNonNull(validUntil, "validUntil");
        if (validUntil.isBefore(validFrom)) {
            throw new IllegalArgumentException("validUntil must not be before validFrom");
        }
    }

    public boolean isValidAt(Instant now) {
        return !now.isBefore(validFrom) && now.isBefore(validUntil);
    }
}
