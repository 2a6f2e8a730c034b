package com.wshg.synergy.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wshg.synergy.domain.DeviceEmbedding;
import com.wshg.synergy.domain.Freshness;
import com.wshg.synergy.entity.DeviceEmbeddingEntity;
import com.wshg.synergy.exception.StorageException;
import com.wshg.synergy.repository.DeviceEmbeddingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 设备向量缓存 MySQL 实现：启动时从表加载到内存，增删改同步到 MySQL。
 * 新鲜度判定与遍历读取都走内存，不逐条查库。
 */
@Slf4j
public class MysqlDeviceEmbeddingStore implements DeviceEmbeddingStore {

    private final DeviceEmbeddingRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, DeviceEmbedding> cache = new ConcurrentHashMap<>();

    public MysqlDeviceEmbeddingStore(DeviceEmbeddingRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @PostConstruct
    public void loadFromDb() {
        int skipped = 0;
        for (DeviceEmbeddingEntity e : repository.findAll()) {
            DeviceEmbedding embedding = toEmbedding(e);
            if (embedding == null) {
                skipped++;
                continue;
            }
            cache.put(embedding.getDeviceId(), embedding);
        }
        log.info("[向量缓存-MySQL] 已从 MySQL 加载: {} 条, 无法解析跳过: {} 条", cache.size(), skipped);
    }

    private DeviceEmbedding toEmbedding(DeviceEmbeddingEntity e) {
        if (e == null || e.getDeviceId() == null) return null;
        float[] vector = parseVector(e.getDeviceId(), e.getEmbeddingJson());
        if (vector == null) return null;
        return DeviceEmbedding.builder()
                .deviceId(e.getDeviceId())
                .vector(vector)
                .descriptorText(e.getDescriptorText())
                .modelVersion(e.getModelVersion())
                .embeddingNorm(e.getEmbeddingNorm() != null ? e.getEmbeddingNorm() : 0d)
                .generatedAt(e.getGeneratedAt())
                .build();
    }

    private float[] parseVector(String deviceId, String json) {
        if (json == null || json.isBlank()) return null;
        try {
            float[] vector = objectMapper.readValue(json, float[].class);
            return vector == null || vector.length == 0 ? null : vector;
        } catch (JsonProcessingException ex) {
            log.warn("[向量缓存-MySQL] 向量解析失败 deviceId={}: {}", deviceId, ex.getMessage());
            return null;
        }
    }

    private DeviceEmbeddingEntity toEntity(DeviceEmbedding embedding) {
        String json;
        try {
            json = objectMapper.writeValueAsString(embedding.getVector() != null ? embedding.getVector() : new float[0]);
        } catch (JsonProcessingException e) {
            throw new StorageException("向量序列化失败: " + embedding.getDeviceId(), e);
        }
        return DeviceEmbeddingEntity.builder()
                .deviceId(embedding.getDeviceId())
                .embeddingJson(json)
                .descriptorText(embedding.getDescriptorText())
                .modelVersion(embedding.getModelVersion())
                .embeddingNorm(embedding.getEmbeddingNorm())
                .generatedAt(embedding.getGeneratedAt())
                .build();
    }

    @Override
    public Optional<DeviceEmbedding> get(String deviceId) {
        if (deviceId == null) return Optional.empty();
        DeviceEmbedding e = cache.get(deviceId);
        return e == null ? Optional.empty() : Optional.of(e.copy());
    }

    @Override
    public void upsert(DeviceEmbedding embedding) {
        if (embedding == null || embedding.getDeviceId() == null) {
            throw new IllegalArgumentException("embedding 与 deviceId 不能为空");
        }
        DeviceEmbeddingEntity entity = toEntity(embedding);
        try {
            repository.save(entity);
        } catch (DataAccessException e) {
            throw new StorageException("向量写入 MySQL 失败: " + embedding.getDeviceId(), e);
        }
        cache.put(embedding.getDeviceId(), embedding.copy());
        log.debug("[向量缓存-MySQL] 写入 deviceId={}, version={}", embedding.getDeviceId(), embedding.getModelVersion());
    }

    @Override
    public Freshness freshness(String deviceId, String currentModelVersion, Duration maxAge) {
        Freshness f = FreshnessPolicy.evaluate(cache.get(deviceId), currentModelVersion, maxAge, clock);
        if (f != Freshness.FRESH && f != Freshness.MISSING) {
            log.debug("[向量缓存-MySQL] 缓存过期 deviceId={}, 原因={}", deviceId, f);
        }
        return f;
    }

    @Override
    public Map<String, float[]> all() {
        Map<String, float[]> vectors = new HashMap<>();
        cache.forEach((id, e) -> vectors.put(id, e.getVector().clone()));
        return vectors;
    }

    @Override
    public List<DeviceEmbedding> findAll() {
        List<DeviceEmbedding> list = new ArrayList<>(cache.size());
        for (DeviceEmbedding e : cache.values()) list.add(e.copy());
        return list;
    }

    @Override
    public void delete(String deviceId) {
        if (deviceId == null) return;
        try {
            if (repository.existsById(deviceId)) repository.deleteById(deviceId);
        } catch (DataAccessException e) {
            throw new StorageException("删除向量失败: " + deviceId, e);
        }
        cache.remove(deviceId);
    }

    @Override
    public void clear() {
        long n;
        try {
            n = repository.count();
            repository.deleteAll();
        } catch (DataAccessException e) {
            throw new StorageException("清空向量缓存失败", e);
        }
        cache.clear();
        log.info("[向量缓存-MySQL] clear 已清空, 原条目数={}", n);
    }

    @Override
    public int size() {
        return cache.size();
    }
}
