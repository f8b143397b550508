package com.capflow.api.security;

import java.io.Serializable;
import java.util.Objects;

/**
 * 能力：(动作, 资源) 二元组
 * <p>
 * 资源为不透明标识（例如文件路径），动作来自可扩展的动作集合。
 * 能力之间按结构相等比较，蕴含关系由 {@link ActionLattice} 决定。
 * </p>
 *
 * @author CapFlow
 */
public record Capability(String action, String resource) implements Serializable {

    public static final String READ = "read";
    public static final String WRITE = "write";
    public static final String DELETE = "delete";
    public static final String ADMIN = "admin";

    public Capability {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(resource, "resource");
    }

    public static Capability of(String action, String resource) {
        return new Capability(action, resource);
    }

    public static Capability read(String resource) {
        return new Capability(READ, resource);
    }

    public static Capability write(String resource) {
        return new Capability(WRITE, resource);
    }

    public static Capability delete(String resource) {
        return new Capability(DELETE, resource);
    }

    public static Capability admin(String resource) {
        return new Capability(ADMIN, resource);
    }

    /**
     * 使用默认动作格判断是否蕴含另一能力
     */
    public boolean implies(Capability other) {
        return ActionLattice.defaults().implies(this, other);
    }

    /**
     * 同资源、换动作
     */
    public Capability withAction(String newAction) {
        return new Capability(newAction, resource);
    }

    @Override
    public String toString() {
        return action + "(" + resource + ")";
    }
}
