package com.wshg.synergy.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * device-intelligence /api/devices/{deviceId}/capabilities 单条能力。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeviceCapabilityResponse {
    @JsonProperty("device_id")
    private String deviceId;
    @JsonProperty("capability_name")
    private String capabilityName;
    @JsonProperty("capability_type")
    private String capabilityType;
    private Boolean exposed;
}
