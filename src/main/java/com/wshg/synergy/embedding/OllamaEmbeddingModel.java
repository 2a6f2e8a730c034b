package com.wshg.synergy.embedding;

import com.wshg.synergy.dto.OllamaEmbedRequest;
import com.wshg.synergy.dto.OllamaEmbedResponse;
import com.wshg.synergy.exception.ModelUnavailableException;
import org.springframework.http.HttpEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * 本地模式向量模型：Ollama /api/embed（默认 all-minilm）。
 */
public class OllamaEmbeddingModel extends RemoteEmbeddingModel {

    private static final String OLLAMA_EMBED_PATH = "/api/embed";

    private final RestTemplate restTemplate;
    private final String url;
    private final String model;
    private final String revision;

    public OllamaEmbeddingModel(RestTemplate restTemplate, String baseUrl, String model, String revision) {
        this.restTemplate = restTemplate;
        this.url = trimBase(baseUrl, "http://localhost:11434") + OLLAMA_EMBED_PATH;
        this.model = model;
        this.revision = revision;
    }

    @Override
    protected List<List<Double>> requestBatch(List<String> texts) {
        ResponseEntity<OllamaEmbedResponse> res = restTemplate.postForEntity(
                url, new HttpEntity<>(OllamaEmbedRequest.batch(model, texts), jsonHeaders()), OllamaEmbedResponse.class);
        if (!res.getStatusCode().is2xxSuccessful() || res.getBody() == null) {
            throw new ModelUnavailableException("Ollama 响应异常 url=" + url + ", status=" + res.getStatusCode());
        }
        return res.getBody().getEmbeddings();
    }

    @Override
    public String version() {
        return "ollama:" + model + "@" + revision;
    }
}
