package com.wshg.synergy.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * DashScope / OpenAI 兼容 Embedding 响应体。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class EmbeddingResponse {

    private List<EmbeddingData> data;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingData {
        private int index;
        private List<Double> embedding;
        @JsonProperty("object")
        private String objectType;
    }

    /** 按 index 排序后的向量列表，与请求中的 input 顺序一致 */
    public List<List<Double>> getOrderedEmbeddings() {
        if (data == null || data.isEmpty()) return List.of();
        return data.stream()
                .sorted(Comparator.comparingInt(EmbeddingData::getIndex))
                .map(EmbeddingData::getEmbedding)
                .collect(Collectors.toList());
    }
}
