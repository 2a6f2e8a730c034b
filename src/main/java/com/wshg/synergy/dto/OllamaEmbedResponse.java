package com.wshg.synergy.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Ollama /api/embed 响应体。
 * 返回格式：{ "model": "...", "embeddings": [[0.1, -0.2, ...], [...]] }
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class OllamaEmbedResponse {
    private String model;
    private List<List<Double>> embeddings;
}
