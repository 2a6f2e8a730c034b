package com.wshg.synergy.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wshg.synergy.domain.Device;
import com.wshg.synergy.dto.DataApiDevice;
import com.wshg.synergy.dto.DataApiEntity;
import com.wshg.synergy.dto.DeviceCapabilityResponse;
import com.wshg.synergy.exception.CatalogUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 通过 data-api 拉取设备目录：每个实体（entity）对应一个 Device，
 * 实体没有区域时沿用其归属硬件设备的区域。能力从 device-intelligence 服务按硬件设备查询。
 */
@Slf4j
public class DataApiDeviceCatalogProvider implements DeviceCatalogProvider {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String dataApiBaseUrl;
    private final String intelligenceBaseUrl;
    private final int limit;

    /** entity_id -> 归属硬件 device_id，由最近一次 listDevices 填充 */
    private final Map<String, String> parentDevices = new ConcurrentHashMap<>();

    public DataApiDeviceCatalogProvider(RestTemplate restTemplate, ObjectMapper objectMapper,
                                        String dataApiBaseUrl, String intelligenceBaseUrl, int limit) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.dataApiBaseUrl = dataApiBaseUrl.replaceAll("/$", "");
        this.intelligenceBaseUrl = intelligenceBaseUrl.replaceAll("/$", "");
        this.limit = limit;
    }

    @Override
    public List<Device> listDevices() {
        List<DataApiDevice> hardware = fetchList("/api/devices", "devices", DataApiDevice.class);
        List<DataApiEntity> entities = fetchList("/api/entities", "entities", DataApiEntity.class);
        log.info("[设备目录] data-api 返回 设备数={}, 实体数={}", hardware.size(), entities.size());

        Map<String, DataApiDevice> deviceMap = new HashMap<>();
        for (DataApiDevice d : hardware) {
            if (d.getDeviceId() != null) deviceMap.put(d.getDeviceId(), d);
        }

        List<Device> devices = new ArrayList<>(entities.size());
        for (DataApiEntity e : entities) {
            if (e.getEntityId() == null || Boolean.TRUE.equals(e.getDisabled())) continue;
            DataApiDevice parent = e.getDeviceId() != null ? deviceMap.get(e.getDeviceId()) : null;
            String area = e.getAreaId() != null ? e.getAreaId() : parent != null ? parent.getAreaId() : null;
            String domain = e.getDomain() != null ? e.getDomain() : domainOf(e.getEntityId());
            if (e.getDeviceId() != null) parentDevices.put(e.getEntityId(), e.getDeviceId());
            devices.add(Device.builder()
                    .deviceId(e.getEntityId())
                    .name(e.getFriendlyName() != null ? e.getFriendlyName() : parent != null ? parent.getName() : null)
                    .domain(domain)
                    .deviceClass(e.getDeviceClass())
                    .areaId(area)
                    .integration(e.getPlatform())
                    .build());
        }
        return devices;
    }

    @Override
    public Set<String> getCapabilities(String deviceId) {
        String hardwareId = parentDevices.get(deviceId);
        if (hardwareId == null) return Set.of();
        String url = intelligenceBaseUrl + "/api/devices/" + hardwareId + "/capabilities";
        DeviceCapabilityResponse[] caps;
        try {
            caps = restTemplate.getForObject(url, DeviceCapabilityResponse[].class);
        } catch (RestClientException e) {
            throw new CatalogUnavailableException("查询设备能力失败: " + hardwareId, e);
        }
        if (caps == null) return Set.of();
        Set<String> names = new LinkedHashSet<>();
        for (DeviceCapabilityResponse c : caps) {
            if (c.getCapabilityName() != null && !Boolean.FALSE.equals(c.getExposed())) names.add(c.getCapabilityName());
        }
        return names;
    }

    /**
     * data-api 可能直接返回数组，也可能包一层 {"devices": [...]}。
     */
    private <T> List<T> fetchList(String path, String wrapperField, Class<T> type) {
        String url = dataApiBaseUrl + path + "?limit=" + limit;
        JsonNode body;
        try {
            body = restTemplate.getForObject(url, JsonNode.class);
        } catch (RestClientException e) {
            throw new CatalogUnavailableException("data-api 请求失败: " + url, e);
        }
        JsonNode array = body == null ? null : body.isArray() ? body : body.get(wrapperField);
        if (array == null || !array.isArray()) {
            log.warn("[设备目录] data-api 响应格式异常 url={}", url);
            return List.of();
        }
        List<T> out = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            try {
                out.add(objectMapper.treeToValue(node, type));
            } catch (JsonProcessingException e) {
                log.warn("[设备目录] 跳过无法解析的记录 url={}: {}", url, e.getOriginalMessage());
            }
        }
        return out;
    }

    private static String domainOf(String entityId) {
        int dot = entityId.indexOf('.');
        return dot > 0 ? entityId.substring(0, dot) : null;
    }
}
