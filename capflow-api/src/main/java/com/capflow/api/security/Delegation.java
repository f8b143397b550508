package com.capflow.api.security;

import java.io.Serializable;

/**
 * 能力委派记录：grantor 将 capability 授予 grantee
 * 纯数据，创建时不产生任何副作用
 */
public record Delegation(Capability capability, String grantor, String grantee) implements Serializable {
}
