package com.wshg.synergy.config;

import com.wshg.synergy.embedding.DashScopeEmbeddingModel;
import com.wshg.synergy.embedding.EmbeddingModel;
import com.wshg.synergy.embedding.HashingEmbeddingModel;
import com.wshg.synergy.embedding.OllamaEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * 向量模型选择：mock=true 用离线哈希向量；本地模式用 Ollama；线上模式用 DashScope。
 */
@Slf4j
@Configuration
public class EmbeddingModelConfig {

    @Bean
    public EmbeddingModel embeddingModel(SynergyProperties props, RestTemplate restTemplate) {
        EmbeddingModel model;
        if (props.isMock()) {
            model = new HashingEmbeddingModel(props.getHashingDimensions(), props.getEmbeddingModelRevision());
        } else if (props.isLocal()) {
            model = new OllamaEmbeddingModel(restTemplate, props.getOllamaBaseUrl(),
                    props.getOllamaEmbeddingModel(), props.getEmbeddingModelRevision());
        } else {
            model = new DashScopeEmbeddingModel(restTemplate, props.getQwenBaseUrl(), props.getQwenApiKey(),
                    props.getEmbeddingModel(), props.getEmbeddingDimensions(), props.getEmbeddingModelRevision());
        }
        log.info("[向量模型] 使用 {}", model.version());
        return model;
    }
}
