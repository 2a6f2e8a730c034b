package com.wshg.synergy.embedding;

import java.util.List;

/**
 * 向量模型：把一批描述文本映射为定长、L2 归一化的向量（点积即余弦相似度）。
 * 模型实例创建一次后复用，由向量生成器在首次使用时 load、关闭时 close。
 * 任何失败都抛出 {@link com.wshg.synergy.exception.ModelUnavailableException}，不返回零向量。
 */
public interface EmbeddingModel {

    /** 幂等，重复调用不会重复加载 */
    void load();

    List<float[]> encode(List<String> texts, int batchSize);

    /** 模型/量化标识，写入缓存的 model_version */
    String version();

    /** 向量维度，未加载时可能为 0 */
    int dimensions();

    void close();
}
