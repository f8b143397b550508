package com.capflow.core.discovery;

import com.capflow.api.component.Introspectable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 注册时推导组件元数据
 * <p>
 * 推导来源依次为：句柄实现的 {@link Introspectable} → 句柄类名 → 默认值。
 * 结果是一份字段齐全的元数据，调用方传入的元数据随后在其上覆盖。
 * </p>
 */
class MetadataIntrospector {

    static final String GENERIC_TYPE = "generic";

    // 类名后缀，推导类型时去掉：FileReactor -> file
    private static final List<String> TYPE_SUFFIXES =
            List.of("Reactor", "Handler", "Service", "Component", "Processor", "Actor");

    ComponentMetadata derive(Object handle) {
        Introspectable introspectable = handle instanceof Introspectable i ? i : null;

        String type = introspectable != null ? introspectable.componentType() : null;
        String version = introspectable != null ? introspectable.version() : null;

        ComponentMetadata.ComponentMetadataBuilder builder = ComponentMetadata.builder()
                .type(type != null ? type : typeFromName(handle))
                .version(version != null ? version : ComponentMetadata.DEFAULT_VERSION)
                .capabilities(orEmpty(introspectable != null ? introspectable.capabilities() : null))
                .dependencies(orEmpty(introspectable != null ? introspectable.dependencies() : null))
                .tags(new LinkedHashSet<>(orEmpty(introspectable != null ? introspectable.tags() : null)))
                .interfaces(interfacesOf(handle));
        return builder.build();
    }

    static String typeFromName(Object handle) {
        if (handle == null) {
            return GENERIC_TYPE;
        }
        String simpleName = handle.getClass().getSimpleName();
        // 匿名类、Lambda 等没有稳定的名字
        if (simpleName.isEmpty() || simpleName.contains("$")) {
            return GENERIC_TYPE;
        }
        for (String suffix : TYPE_SUFFIXES) {
            if (simpleName.length() > suffix.length() && simpleName.endsWith(suffix)) {
                simpleName = simpleName.substring(0, simpleName.length() - suffix.length());
                break;
            }
        }
        return toSnakeCase(simpleName);
    }

    private static String toSnakeCase(String camel) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < camel.length(); i++) {
            char c = camel.charAt(i);
            if (Character.isUpperCase(c) && i > 0 && !Character.isUpperCase(camel.charAt(i - 1))) {
                sb.append('_');
            }
            sb.append(Character.toLowerCase(c));
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    private static List<String> interfacesOf(Object handle) {
        if (handle == null) {
            return List.of();
        }
        Set<String> names = new LinkedHashSet<>();
        for (Class<?> type = handle.getClass(); type != null && type != Object.class; type = type.getSuperclass()) {
            for (Class<?> iface : type.getInterfaces()) {
                names.add(iface.getSimpleName());
            }
        }
        return new ArrayList<>(names);
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : List.of();
    }
}
