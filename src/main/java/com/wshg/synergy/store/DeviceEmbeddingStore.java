package com.wshg.synergy.store;

import com.wshg.synergy.domain.DeviceEmbedding;
import com.wshg.synergy.domain.Freshness;
import com.wshg.synergy.exception.StorageException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 设备向量缓存抽象：支持内存+文件或 MySQL 持久化。
 * model_version 是缓存键的一部分，模型升级后旧条目自然判定为不新鲜，无需迁移。
 */
public interface DeviceEmbeddingStore {

    Optional<DeviceEmbedding> get(String deviceId);

    /** 按 deviceId 插入或覆盖 */
    void upsert(DeviceEmbedding embedding);

    /**
     * 批量写入。默认逐条 upsert，单条失败不影响其余条目。
     *
     * @return 写入失败的 deviceId 及原因，全部成功时为空
     */
    default Map<String, StorageException> upsertAll(List<DeviceEmbedding> embeddings) {
        Map<String, StorageException> failed = new LinkedHashMap<>();
        for (DeviceEmbedding e : embeddings) {
            try {
                upsert(e);
            } catch (StorageException ex) {
                failed.put(e.getDeviceId(), ex);
            }
        }
        return failed;
    }

    Freshness freshness(String deviceId, String currentModelVersion, Duration maxAge);

    default boolean isFresh(String deviceId, String currentModelVersion, Duration maxAge) {
        return freshness(deviceId, currentModelVersion, maxAge).isFresh();
    }

    /** deviceId -> 向量，供链路遍历使用 */
    Map<String, float[]> all();

    List<DeviceEmbedding> findAll();

    /** 显式失效单个设备的缓存 */
    void delete(String deviceId);

    void clear();

    int size();
}
