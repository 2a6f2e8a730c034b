package com.wshg.synergy.domain;

import lombok.Builder;
import lombok.Value;

/**
 * 一次向量生成运行的统计。
 */
@Value
@Builder
public class EmbeddingRunStats {

    int total;
    int generated;
    int cached;
    int descriptorErrors;
    int storageErrors;
    long durationMs;
    String modelVersion;

    public int getErrors() {
        return descriptorErrors + storageErrors;
    }

    /** 出现过单设备失败（描述生成或存储），运行本身仍算完成 */
    public boolean isDegraded() {
        return getErrors() > 0;
    }
}
