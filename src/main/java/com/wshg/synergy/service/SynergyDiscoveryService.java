package com.wshg.synergy.service;

import com.wshg.synergy.catalog.DeviceCatalogProvider;
import com.wshg.synergy.config.SynergyProperties;
import com.wshg.synergy.domain.Device;
import com.wshg.synergy.domain.DevicePath;
import com.wshg.synergy.domain.EmbeddingRunStats;
import com.wshg.synergy.domain.EmbeddingStoreStats;
import com.wshg.synergy.domain.PathSearchOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 链路发现入口：向量生成与多跳遍历。
 * 生成过程持有写锁，遍历持有读锁，遍历期间不会看到写了一半的缓存。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SynergyDiscoveryService {

    private final DeviceEmbeddingGenerator embeddingGenerator;
    private final ChainPathFinder pathFinder;
    private final DeviceCatalogProvider catalogProvider;
    private final SynergyProperties props;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * 生成（或刷新）全部设备向量。
     */
    public EmbeddingRunStats generateAllEmbeddings(boolean forceRefresh) {
        lock.writeLock().lock();
        try {
            return embeddingGenerator.run(forceRefresh);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 按配置的默认参数发现链路。
     */
    public List<DevicePath> findPaths(Collection<String> triggerDeviceIds) {
        return findPaths(triggerDeviceIds, props.getPathMaxDepth(), props.getPathMinSimilarity(), props.getPathTopKPerHop());
    }

    /**
     * @param triggerDeviceIds 触发设备 ID，不在目录中的忽略
     * @param maxDepth         链路设备数上限，2~5
     * @param minSimilarity    每一跳的最低相似度
     * @param topKPerHop       每一跳保留的候选数
     * @throws IllegalArgumentException 参数越界
     */
    public List<DevicePath> findPaths(Collection<String> triggerDeviceIds, int maxDepth, double minSimilarity, int topKPerHop) {
        PathSearchOptions options = new PathSearchOptions(maxDepth, minSimilarity, topKPerHop);
        if (triggerDeviceIds == null || triggerDeviceIds.isEmpty()) return List.of();

        lock.readLock().lock();
        try {
            List<Device> catalog = catalogProvider.listDevices();
            Map<String, Device> byId = new LinkedHashMap<>();
            for (Device d : catalog) {
                if (d != null && d.getDeviceId() != null) byId.putIfAbsent(d.getDeviceId(), d);
            }
            List<Device> triggers = new ArrayList<>();
            for (String id : new LinkedHashSet<>(triggerDeviceIds)) {
                Device d = byId.get(id);
                if (d == null) {
                    log.warn("[链路发现] 触发设备不在目录中, 跳过 deviceId={}", id);
                    continue;
                }
                triggers.add(d);
            }
            return pathFinder.findPaths(triggers, byId.values(), options);
        } finally {
            lock.readLock().unlock();
        }
    }

    public EmbeddingStoreStats embeddingStats() {
        return embeddingGenerator.stats();
    }

    public void invalidateEmbedding(String deviceId) {
        lock.writeLock().lock();
        try {
            embeddingGenerator.invalidate(deviceId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void invalidateAllEmbeddings() {
        lock.writeLock().lock();
        try {
            embeddingGenerator.invalidateAll();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
