package com.wshg.synergy.embedding;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 离线哈希向量（synergy.mock=true）：把描述文本的词散列到固定维度后 L2 归一化。
 * 结果只取决于文本，适合开发与测试，语义质量远不如真实模型。
 */
@Slf4j
public class HashingEmbeddingModel implements EmbeddingModel {

    private static final Set<String> STOP_WORDS = Set.of("a", "an", "the", "that", "in", "with", "and", "of");

    private final int dimensions;
    private final String revision;

    public HashingEmbeddingModel(int dimensions, String revision) {
        if (dimensions < 8) throw new IllegalArgumentException("dimensions 过小: " + dimensions);
        this.dimensions = dimensions;
        this.revision = revision;
    }

    @Override
    public void load() {
        log.debug("[向量模型] 哈希向量无需加载, dim={}", dimensions);
    }

    @Override
    public List<float[]> encode(List<String> texts, int batchSize) {
        if (texts == null || texts.isEmpty()) return List.of();
        List<float[]> out = new ArrayList<>(texts.size());
        for (String text : texts) out.add(embed(text));
        return out;
    }

    private float[] embed(String text) {
        float[] v = new float[dimensions];
        String normalized = text == null ? "" : text.toLowerCase(Locale.ROOT);
        for (String token : normalized.split("[^a-z0-9]+")) {
            if (token.isEmpty() || STOP_WORDS.contains(token)) continue;
            v[Math.floorMod(token.hashCode(), dimensions)] += 1.0f;
        }
        // 没有有效词时落到固定桶
        if (VectorMath.norm(v) == 0) v[0] = 1.0f;
        return VectorMath.normalize(v);
    }

    @Override
    public String version() {
        return "hashing:" + dimensions + "@" + revision;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public void close() {
        // 无资源
    }
}
