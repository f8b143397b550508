package com.capflow.api.plugin;

/**
 * 插件类型，决定插件的哪个钩子被管线调用
 */
public enum PluginType {
    VALIDATION,
    TRANSFORMATION,
    ROUTING,
    COMPOSITION
}
