package com.wshg.synergy.service;

import com.wshg.synergy.catalog.DeviceCatalogProvider;
import com.wshg.synergy.config.SynergyProperties;
import com.wshg.synergy.domain.Device;
import com.wshg.synergy.domain.DeviceEmbedding;
import com.wshg.synergy.domain.EmbeddingRunStats;
import com.wshg.synergy.domain.EmbeddingStoreStats;
import com.wshg.synergy.embedding.EmbeddingModel;
import com.wshg.synergy.embedding.VectorMath;
import com.wshg.synergy.exception.CatalogUnavailableException;
import com.wshg.synergy.exception.DescriptorBuildException;
import com.wshg.synergy.exception.ModelUnavailableException;
import com.wshg.synergy.exception.StorageException;
import com.wshg.synergy.store.DeviceEmbeddingStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 设备向量生成：拉取设备目录 → 生成描述 → 批量向量化 → 写入向量缓存，仍新鲜的条目跳过。
 * 单个设备的描述或存储失败只计数不中断；向量模型失败直接抛出，整次运行中止。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeviceEmbeddingGenerator {

    private final DeviceCatalogProvider catalogProvider;
    private final DeviceDescriptorBuilder descriptorBuilder;
    private final EmbeddingModel embeddingModel;
    private final DeviceEmbeddingStore embeddingStore;
    private final SynergyProperties props;
    private final Clock clock;

    /**
     * 启动时加载向量模型。模型服务暂不可用时只告警，下次 run 会再次尝试加载。
     */
    @PostConstruct
    public void init() {
        try {
            embeddingModel.load();
        } catch (ModelUnavailableException e) {
            log.warn("[向量生成] 启动时向量模型不可用, 将在下次生成时重试: {}", e.getMessage());
        }
    }

    /**
     * 为目录中全部设备生成向量。
     *
     * @param forceRefresh true 时忽略缓存全部重新生成
     */
    public EmbeddingRunStats run(boolean forceRefresh) {
        long start = System.currentTimeMillis();
        embeddingModel.load();
        String version = embeddingModel.version();
        Duration maxAge = props.getEmbeddingMaxAge();
        log.info("[向量生成] 开始, forceRefresh={}, version={}, maxAgeDays={}", forceRefresh, version, props.getEmbeddingMaxAgeDays());

        List<Device> devices = catalogProvider.listDevices();
        int cached = 0;
        int descriptorErrors = 0;
        int storageErrors = 0;
        int generated = 0;

        List<Device> pendingDevices = new ArrayList<>();
        List<String> pendingTexts = new ArrayList<>();
        for (Device device : devices) {
            String deviceId = device != null ? device.getDeviceId() : null;
            if (!forceRefresh && deviceId != null) {
                try {
                    if (embeddingStore.isFresh(deviceId, version, maxAge)) {
                        cached++;
                        continue;
                    }
                } catch (StorageException e) {
                    log.warn("[向量生成] 缓存检查失败, 按未命中处理 deviceId={}: {}", deviceId, e.getMessage());
                }
            }
            try {
                Device enriched = withCapabilities(device);
                String text = descriptorBuilder.build(enriched);
                pendingDevices.add(enriched);
                pendingTexts.add(text);
                log.debug("[向量生成] 描述 {} -> {}", deviceId, text);
            } catch (DescriptorBuildException e) {
                descriptorErrors++;
                log.warn("[向量生成] 描述生成失败 deviceId={}: {}", deviceId, e.getMessage());
            }
        }

        if (pendingTexts.isEmpty()) {
            log.info("[向量生成] 全部命中缓存, 无需生成");
        }
        int batchSize = Math.max(1, props.getEmbeddingBatchSize());
        for (int from = 0; from < pendingTexts.size(); from += batchSize) {
            int to = Math.min(from + batchSize, pendingTexts.size());
            List<String> texts = pendingTexts.subList(from, to);
            List<float[]> vectors = embeddingModel.encode(texts, batchSize);
            Instant now = clock.instant();
            List<DeviceEmbedding> batch = new ArrayList<>(texts.size());
            for (int i = 0; i < texts.size(); i++) {
                float[] vector = vectors.get(i);
                batch.add(DeviceEmbedding.builder()
                        .deviceId(pendingDevices.get(from + i).getDeviceId())
                        .vector(vector)
                        .descriptorText(texts.get(i))
                        .modelVersion(version)
                        .embeddingNorm(VectorMath.norm(vector))
                        .generatedAt(now)
                        .build());
            }
            Map<String, StorageException> failed = embeddingStore.upsertAll(batch);
            failed.forEach((deviceId, e) -> log.warn("[向量生成] 写入失败 deviceId={}: {}", deviceId, e.getMessage()));
            storageErrors += failed.size();
            generated += batch.size() - failed.size();
            log.info("[向量生成] 批次完成 {}/{}", to, pendingTexts.size());
        }

        EmbeddingRunStats stats = EmbeddingRunStats.builder()
                .total(devices.size())
                .generated(generated)
                .cached(cached)
                .descriptorErrors(descriptorErrors)
                .storageErrors(storageErrors)
                .durationMs(System.currentTimeMillis() - start)
                .modelVersion(version)
                .build();
        log.info("[向量生成] 完成: 设备总数={}, 生成={}, 缓存命中={}, 失败={}, 耗时={}ms",
                stats.getTotal(), stats.getGenerated(), stats.getCached(), stats.getErrors(), stats.getDurationMs());
        if (stats.isDegraded()) {
            log.warn("[向量生成] 本次运行存在失败设备: 描述失败={}, 存储失败={}", descriptorErrors, storageErrors);
        }
        return stats;
    }

    /**
     * 设备记录自身没有能力列表时向目录补查一次；查不到不影响生成。
     */
    private Device withCapabilities(Device device) {
        if (device == null || device.getDeviceId() == null) return device;
        if (device.getCapabilities() != null && !device.getCapabilities().isEmpty()) return device;
        try {
            Set<String> caps = catalogProvider.getCapabilities(device.getDeviceId());
            if (caps == null || caps.isEmpty()) return device;
            return device.toBuilder().capabilities(caps).build();
        } catch (CatalogUnavailableException e) {
            log.debug("[向量生成] 无法获取能力 deviceId={}: {}", device.getDeviceId(), e.getMessage());
            return device;
        }
    }

    /**
     * 向量缓存概况：总量、当前模型下新鲜数量、最旧与最新条目的天数。
     */
    public EmbeddingStoreStats stats() {
        List<DeviceEmbedding> all = embeddingStore.findAll();
        String version = embeddingModel.version();
        Duration maxAge = props.getEmbeddingMaxAge();
        Instant now = clock.instant();
        Instant oldest = null;
        Instant newest = null;
        int fresh = 0;
        for (DeviceEmbedding e : all) {
            if (embeddingStore.isFresh(e.getDeviceId(), version, maxAge)) fresh++;
            Instant t = e.getGeneratedAt();
            if (t == null) continue;
            if (oldest == null || t.isBefore(oldest)) oldest = t;
            if (newest == null || t.isAfter(newest)) newest = t;
        }
        return EmbeddingStoreStats.builder()
                .totalEmbeddings(all.size())
                .freshEmbeddings(fresh)
                .modelVersion(version)
                .oldestEmbeddingDays(oldest != null ? Duration.between(oldest, now).toDays() : null)
                .newestEmbeddingDays(newest != null ? Duration.between(newest, now).toDays() : null)
                .build();
    }

    public void invalidate(String deviceId) {
        embeddingStore.delete(deviceId);
        log.info("[向量生成] 已失效 deviceId={}", deviceId);
    }

    public void invalidateAll() {
        embeddingStore.clear();
    }

    @PreDestroy
    public void shutdown() {
        embeddingModel.close();
    }
}
