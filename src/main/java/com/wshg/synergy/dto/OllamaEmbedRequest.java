package com.wshg.synergy.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Ollama /api/embed 请求体，input 为一批描述文本。
 * 文档：https://docs.ollama.com/capabilities/embeddings
 */
@Data
@Builder
public class OllamaEmbedRequest {
    private String model;
    private List<String> input;
    /** 超出上下文长度时截断而不是报错 */
    @Builder.Default
    private Boolean truncate = true;

    public static OllamaEmbedRequest batch(String model, List<String> texts) {
        return OllamaEmbedRequest.builder().model(model).input(texts).build();
    }
}
