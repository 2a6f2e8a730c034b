package com.wshg.synergy.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Optional;
import java.util.Set;

/**
 * 设备目录中的一条设备记录，单次运行内只读。
 * deviceClass 与 areaId 可能缺失，统一通过 {@link #deviceClass()}、{@link #area()} 读取。
 */
@Value
@Builder(toBuilder = true)
public class Device {

    String deviceId;
    /** 显示名称，如「厨房人体传感器」 */
    String name;
    /** 粗粒度类别：sensor / light / climate ... */
    String domain;
    /** 细分类型：motion / door / temperature ...，可为空 */
    String deviceClass;
    /** 所在区域，如 kitchen，可为空 */
    String areaId;
    @Singular
    Set<String> capabilities;
    /** 来源平台：zha / mqtt / hue ... */
    String integration;

    public Optional<String> deviceClass() {
        return isBlank(deviceClass) ? Optional.empty() : Optional.of(deviceClass.trim());
    }

    public Optional<String> area() {
        return isBlank(areaId) ? Optional.empty() : Optional.of(areaId.trim());
    }

    public boolean sharesAreaWith(Device other) {
        return other != null && area().isPresent() && area().equals(other.area());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
