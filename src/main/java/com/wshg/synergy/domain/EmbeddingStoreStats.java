package com.wshg.synergy.domain;

import lombok.Builder;
import lombok.Value;

/**
 * 向量缓存概况：总量、当前模型下仍新鲜的数量、最旧/最新条目的天数（缓存为空时为 null）。
 */
@Value
@Builder
public class EmbeddingStoreStats {

    int totalEmbeddings;
    int freshEmbeddings;
    String modelVersion;
    Long oldestEmbeddingDays;
    Long newestEmbeddingDays;
}
