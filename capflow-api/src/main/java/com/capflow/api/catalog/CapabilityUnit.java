package com.capflow.api.catalog;

import java.util.List;

/**
 * 能力单元：一组能力声明的载体
 * <p>
 * 通过 {@code META-INF/services/com.capflow.api.catalog.CapabilityUnit} 发布的实现
 * 会在启动时被能力目录自动发现并注册。
 * </p>
 *
 * @author CapFlow
 */
public interface CapabilityUnit {

    List<CapabilityDescriptor> capabilities();
}
