package com.capflow.core.discovery;

import com.capflow.api.component.Health;
import com.capflow.api.security.Capability;
import lombok.Builder;

import java.util.List;
import java.util.Set;

/**
 * 发现查询条件
 * 任一字段为 null 即通配（any），组件需满足全部非通配字段
 *
 * @param name         句柄名或组件 ID 的子串
 * @param type         组件类型，精确匹配
 * @param capabilities 所需能力，每项都须被组件某个能力蕴含
 * @param version      版本，精确匹配
 * @param health       当前健康状态，精确匹配
 * @param tags         必须全部具备的标签
 */
@Builder(toBuilder = true)
public record DiscoveryPattern(String name,
                               String type,
                               List<Capability> capabilities,
                               String version,
                               Health health,
                               Set<String> tags) {

    private static final DiscoveryPattern ANY = DiscoveryPattern.builder().build();

    public static DiscoveryPattern any() {
        return ANY;
    }

    public static DiscoveryPattern ofType(String type) {
        return DiscoveryPattern.builder().type(type).build();
    }
}
