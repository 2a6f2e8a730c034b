package com.wshg.synergy.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wshg.synergy.domain.DeviceEmbedding;
import com.wshg.synergy.domain.Freshness;
import com.wshg.synergy.exception.StorageException;
import lombok.extern.slf4j.Slf4j;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存设备向量缓存。
 * 当 synergy.embedding-store-type=file 且配置 embedding-store-path 时，启动时从文件加载、变更时持久化到文件。
 */
@Slf4j
public class InMemoryDeviceEmbeddingStore implements DeviceEmbeddingStore {

    private final String storePath;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, DeviceEmbedding> store = new ConcurrentHashMap<>();

    public InMemoryDeviceEmbeddingStore(String storePath, ObjectMapper objectMapper, Clock clock) {
        this.storePath = storePath;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @PostConstruct
    public void loadFromFile() {
        Path path = resolvePath();
        if (path == null || !Files.exists(path)) return;
        try {
            List<DeviceEmbedding> list = objectMapper.readValue(Files.readString(path), new TypeReference<>() {});
            if (list != null) {
                for (DeviceEmbedding e : list) {
                    if (e != null && e.getDeviceId() != null) store.put(e.getDeviceId(), e);
                }
                log.info("[向量缓存-文件] 已从文件加载: {} 条, 路径: {}", store.size(), path);
            }
        } catch (IOException e) {
            log.warn("[向量缓存-文件] 加载失败, 以空缓存启动: {}", path, e);
        }
    }

    private Path resolvePath() {
        if (storePath == null || storePath.isBlank()) return null;
        return Path.of(storePath).toAbsolutePath();
    }

    private void saveToFile() throws IOException {
        Path path = resolvePath();
        if (path == null) return;
        if (path.getParent() != null) Files.createDirectories(path.getParent());
        List<DeviceEmbedding> list = new ArrayList<>(store.values());
        list.sort(Comparator.comparing(DeviceEmbedding::getDeviceId));
        Files.writeString(path, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(list));
    }

    @Override
    public Optional<DeviceEmbedding> get(String deviceId) {
        if (deviceId == null) return Optional.empty();
        DeviceEmbedding e = store.get(deviceId);
        return e == null ? Optional.empty() : Optional.of(e.copy());
    }

    @Override
    public synchronized void upsert(DeviceEmbedding embedding) {
        if (embedding == null || embedding.getDeviceId() == null) {
            throw new IllegalArgumentException("embedding 与 deviceId 不能为空");
        }
        DeviceEmbedding previous = store.put(embedding.getDeviceId(), embedding.copy());
        try {
            saveToFile();
        } catch (IOException e) {
            if (previous != null) store.put(previous.getDeviceId(), previous);
            else store.remove(embedding.getDeviceId());
            throw new StorageException("向量缓存持久化失败: " + embedding.getDeviceId(), e);
        }
    }

    /**
     * 配置了文件路径时整批只写一次文件；写文件失败则整批回滚，全部计为失败。
     */
    @Override
    public synchronized Map<String, StorageException> upsertAll(List<DeviceEmbedding> embeddings) {
        if (resolvePath() == null) return DeviceEmbeddingStore.super.upsertAll(embeddings);
        for (DeviceEmbedding e : embeddings) {
            if (e == null || e.getDeviceId() == null) {
                throw new IllegalArgumentException("embedding 与 deviceId 不能为空");
            }
        }
        Map<String, DeviceEmbedding> previous = new LinkedHashMap<>();
        for (DeviceEmbedding e : embeddings) {
            if (!previous.containsKey(e.getDeviceId())) previous.put(e.getDeviceId(), store.get(e.getDeviceId()));
            store.put(e.getDeviceId(), e.copy());
        }
        try {
            saveToFile();
            return Map.of();
        } catch (IOException e) {
            log.warn("[向量缓存-文件] 批量持久化失败, 回滚 {} 条: {}", previous.size(), e.getMessage());
            Map<String, StorageException> failed = new LinkedHashMap<>();
            StorageException error = new StorageException("向量缓存持久化失败", e);
            previous.forEach((id, old) -> {
                if (old != null) store.put(id, old);
                else store.remove(id);
                failed.put(id, error);
            });
            return failed;
        }
    }

    @Override
    public Freshness freshness(String deviceId, String currentModelVersion, Duration maxAge) {
        Freshness f = FreshnessPolicy.evaluate(store.get(deviceId), currentModelVersion, maxAge, clock);
        if (f != Freshness.FRESH && f != Freshness.MISSING) {
            log.debug("[向量缓存-文件] 缓存过期 deviceId={}, 原因={}", deviceId, f);
        }
        return f;
    }

    @Override
    public Map<String, float[]> all() {
        Map<String, float[]> vectors = new HashMap<>();
        store.forEach((id, e) -> {
            if (e.getVector() != null) vectors.put(id, e.getVector().clone());
        });
        return vectors;
    }

    @Override
    public List<DeviceEmbedding> findAll() {
        List<DeviceEmbedding> list = new ArrayList<>(store.size());
        for (DeviceEmbedding e : store.values()) list.add(e.copy());
        return list;
    }

    @Override
    public synchronized void delete(String deviceId) {
        if (deviceId == null) return;
        DeviceEmbedding removed = store.remove(deviceId);
        if (removed == null) return;
        try {
            saveToFile();
        } catch (IOException e) {
            store.put(deviceId, removed);
            throw new StorageException("向量缓存持久化失败: " + deviceId, e);
        }
    }

    /**
     * 清空所有缓存。
     */
    @Override
    public synchronized void clear() {
        int n = store.size();
        store.clear();
        if (n > 0) log.info("[向量缓存-文件] clear 已清空, 原条目数={}", n);
        try {
            saveToFile();
        } catch (IOException e) {
            throw new StorageException("向量缓存持久化失败", e);
        }
    }

    @Override
    public int size() {
        return store.size();
    }
}
