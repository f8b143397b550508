package com.capflow.api.security;

import java.io.Serializable;

/**
 * 能力撤销记录
 */
public record Revocation(Capability capability, String holder) implements Serializable {
}
