package com.wshg.synergy.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 一条候选自动化链路：2~5 个互不重复的设备，以及每一跳的相似度。
 * 仅在一次发现运行内存在，不持久化。
 */
@Value
@Builder(toBuilder = true)
public class DevicePath {

    @Singular
    List<Device> devices;
    /** 相邻设备间的相似度（含同区域加成），长度 = devices.size() - 1 */
    @Singular
    List<Double> hopSimilarities;
    double score;

    public int getDepth() {
        return devices.size() - 1;
    }

    public int size() {
        return devices.size();
    }

    public List<String> getDeviceIds() {
        return devices.stream().map(Device::getDeviceId).collect(Collectors.toList());
    }

    public String getTriggerDeviceId() {
        return devices.isEmpty() ? null : devices.get(0).getDeviceId();
    }

    @Override
    public String toString() {
        return String.join(" -> ", getDeviceIds()) + String.format(" (score=%.3f)", score);
    }
}
