package com.wshg.synergy.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * data-api /api/entities 单条实体。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DataApiEntity {
    @JsonProperty("entity_id")
    private String entityId;
    @JsonProperty("device_id")
    private String deviceId;
    private String domain;
    @JsonProperty("device_class")
    private String deviceClass;
    private String platform;
    @JsonProperty("area_id")
    private String areaId;
    @JsonProperty("friendly_name")
    private String friendlyName;
    private Boolean disabled;
}
