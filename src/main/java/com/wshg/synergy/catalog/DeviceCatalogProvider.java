package com.wshg.synergy.catalog;

import com.wshg.synergy.domain.Device;

import java.util.List;
import java.util.Set;

/**
 * 设备目录：本模块只读取，不修改。
 * 拉取失败抛出 {@link com.wshg.synergy.exception.CatalogUnavailableException}。
 */
public interface DeviceCatalogProvider {

    List<Device> listDevices();

    Set<String> getCapabilities(String deviceId);
}
