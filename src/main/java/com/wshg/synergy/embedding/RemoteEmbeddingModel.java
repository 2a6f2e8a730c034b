package com.wshg.synergy.embedding;

import com.wshg.synergy.exception.ModelUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;

/**
 * HTTP 向量模型公共部分：按 batchSize 分批请求、校验条数与维度、统一 L2 归一化。
 */
@Slf4j
public abstract class RemoteEmbeddingModel implements EmbeddingModel {

    private static final String PROBE_TEXT = "device";

    private volatile boolean loaded;
    private volatile int dimensions;

    /** 单批请求，返回与 texts 同序的原始向量 */
    protected abstract List<List<Double>> requestBatch(List<String> texts);

    @Override
    public synchronized void load() {
        if (loaded) return;
        log.info("[向量模型] 加载 {}", version());
        List<float[]> probe = encodeChecked(List.of(PROBE_TEXT));
        dimensions = probe.get(0).length;
        loaded = true;
        log.info("[向量模型] 已就绪 {}, dim={}", version(), dimensions);
    }

    @Override
    public List<float[]> encode(List<String> texts, int batchSize) {
        if (texts == null || texts.isEmpty()) return List.of();
        if (!loaded) load();
        int size = Math.max(1, batchSize);
        List<float[]> out = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += size) {
            List<String> batch = texts.subList(from, Math.min(from + size, texts.size()));
            out.addAll(encodeChecked(batch));
        }
        log.debug("[向量模型] 向量化完成 count={}, batchSize={}", out.size(), size);
        return out;
    }

    private List<float[]> encodeChecked(List<String> batch) {
        List<List<Double>> raw;
        try {
            raw = requestBatch(batch);
        } catch (RestClientException e) {
            throw new ModelUnavailableException("向量模型调用失败: " + version(), e);
        }
        if (raw == null || raw.size() != batch.size()) {
            throw new ModelUnavailableException(String.format("向量条数不匹配: texts=%d, embeddings=%d",
                    batch.size(), raw == null ? 0 : raw.size()));
        }
        List<float[]> vectors = new ArrayList<>(raw.size());
        for (List<Double> values : raw) {
            if (values == null || values.isEmpty()) {
                throw new ModelUnavailableException("向量模型返回空向量: " + version());
            }
            if (dimensions > 0 && values.size() != dimensions) {
                throw new ModelUnavailableException(String.format("向量维度变化: 期望 %d, 实际 %d", dimensions, values.size()));
            }
            float[] arr = new float[values.size()];
            for (int i = 0; i < arr.length; i++) arr[i] = values.get(i).floatValue();
            try {
                vectors.add(VectorMath.normalize(arr));
            } catch (IllegalArgumentException e) {
                throw new ModelUnavailableException("向量模型返回零向量: " + version(), e);
            }
        }
        return vectors;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public synchronized void close() {
        if (loaded) log.info("[向量模型] 释放 {}", version());
        loaded = false;
    }

    protected static HttpHeaders jsonHeaders() {
        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_JSON);
        return h;
    }

    protected static String trimBase(String base, String fallback) {
        if (base == null || base.isBlank()) base = fallback;
        return base.replaceAll("/$", "");
    }
}
