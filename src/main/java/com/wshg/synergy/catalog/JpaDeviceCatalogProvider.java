package com.wshg.synergy.catalog;

import com.wshg.synergy.domain.Device;
import com.wshg.synergy.entity.SmartHomeDevice;
import com.wshg.synergy.exception.CatalogUnavailableException;
import com.wshg.synergy.repository.SmartHomeDeviceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 从本地设备表 smart_home_device 读取已启用的设备。
 */
@Slf4j
@RequiredArgsConstructor
public class JpaDeviceCatalogProvider implements DeviceCatalogProvider {

    private final SmartHomeDeviceRepository deviceRepository;

    @Override
    public List<Device> listDevices() {
        List<SmartHomeDevice> rows;
        try {
            rows = deviceRepository.findByEnabledTrue();
        } catch (DataAccessException e) {
            throw new CatalogUnavailableException("读取设备表失败", e);
        }
        log.info("[设备目录] 设备表已启用设备数={}", rows.size());
        return rows.stream().map(JpaDeviceCatalogProvider::toDevice).collect(Collectors.toList());
    }

    @Override
    public Set<String> getCapabilities(String deviceId) {
        try {
            return deviceRepository.findByDeviceId(deviceId)
                    .map(d -> d.getCapabilities() == null ? Set.<String>of() : Set.copyOf(d.getCapabilities()))
                    .orElse(Set.of());
        } catch (DataAccessException e) {
            throw new CatalogUnavailableException("读取设备能力失败: " + deviceId, e);
        }
    }

    static Device toDevice(SmartHomeDevice d) {
        Set<String> caps = d.getCapabilities() == null ? Set.of() : new LinkedHashSet<>(d.getCapabilities());
        return Device.builder()
                .deviceId(d.getDeviceId())
                .name(d.getDeviceName())
                .domain(d.getDomain())
                .deviceClass(d.getDeviceClass())
                .areaId(d.getAreaId())
                .integration(d.getIntegration())
                .capabilities(caps)
                .build();
    }
}
