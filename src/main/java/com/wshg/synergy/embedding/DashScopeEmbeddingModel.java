package com.wshg.synergy.embedding;

import com.wshg.synergy.dto.EmbeddingRequest;
import com.wshg.synergy.dto.EmbeddingResponse;
import com.wshg.synergy.exception.ModelUnavailableException;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * 线上模式向量模型：阿里云 DashScope OpenAI 兼容接口 /v1/embeddings。
 */
public class DashScopeEmbeddingModel extends RemoteEmbeddingModel {

    private static final String EMBEDDINGS_PATH = "/v1/embeddings";

    private final RestTemplate restTemplate;
    private final String url;
    private final String apiKey;
    private final String model;
    private final int requestedDimensions;
    private final String revision;

    public DashScopeEmbeddingModel(RestTemplate restTemplate, String baseUrl, String apiKey,
                                   String model, int dimensions, String revision) {
        this.restTemplate = restTemplate;
        this.url = trimBase(baseUrl, "https://dashscope.aliyuncs.com/compatible-mode") + EMBEDDINGS_PATH;
        this.apiKey = apiKey;
        this.model = model;
        this.requestedDimensions = dimensions;
        this.revision = revision;
    }

    @Override
    protected List<List<Double>> requestBatch(List<String> texts) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ModelUnavailableException("未配置 qwen-api-key，无法调用 DashScope Embedding");
        }
        HttpHeaders headers = jsonHeaders();
        headers.setBearerAuth(apiKey);
        EmbeddingRequest req = EmbeddingRequest.batch(model, texts, requestedDimensions);
        ResponseEntity<EmbeddingResponse> res = restTemplate.postForEntity(
                url, new HttpEntity<>(req, headers), EmbeddingResponse.class);
        if (!res.getStatusCode().is2xxSuccessful() || res.getBody() == null) {
            throw new ModelUnavailableException("DashScope 响应异常 status=" + res.getStatusCode());
        }
        return res.getBody().getOrderedEmbeddings();
    }

    @Override
    public String version() {
        return "dashscope:" + model + ":" + requestedDimensions + "@" + revision;
    }
}
