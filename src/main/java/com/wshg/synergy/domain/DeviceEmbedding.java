package com.wshg.synergy.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * 设备向量缓存条目：每个设备一条，model_version 属于缓存键的一部分。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DeviceEmbedding {

    String deviceId;
    /** L2 归一化后的向量 */
    float[] vector;
    /** 生成该向量的描述文本，保留以便审计 */
    String descriptorText;
    String modelVersion;
    double embeddingNorm;
    Instant generatedAt;

    /** 向量数组独立的副本，缓存内外不共享同一个数组 */
    public DeviceEmbedding copy() {
        return vector == null ? this : toBuilder().vector(vector.clone()).build();
    }
}
