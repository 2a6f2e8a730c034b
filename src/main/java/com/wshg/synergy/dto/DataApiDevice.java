package com.wshg.synergy.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * data-api /api/devices 单条硬件设备（实体的归属设备）。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DataApiDevice {
    @JsonProperty("device_id")
    private String deviceId;
    private String name;
    private String manufacturer;
    private String model;
    @JsonProperty("area_id")
    private String areaId;
}
