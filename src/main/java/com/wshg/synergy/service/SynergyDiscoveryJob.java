package com.wshg.synergy.service;

import com.wshg.synergy.catalog.DeviceCatalogProvider;
import com.wshg.synergy.config.SynergyProperties;
import com.wshg.synergy.domain.Device;
import com.wshg.synergy.domain.DevicePath;
import com.wshg.synergy.domain.EmbeddingRunStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 定时发现：先刷新向量，再以传感器类设备为触发点遍历，结果交给建议下游。
 * 任何失败只记录日志，等待下一次调度。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SynergyDiscoveryJob {

    private final SynergyDiscoveryService discoveryService;
    private final DeviceCatalogProvider catalogProvider;
    private final SuggestionPipeline suggestionPipeline;
    private final SynergyProperties props;

    @Scheduled(cron = "${synergy.discovery-cron:0 0 3 * * *}")
    public void runScheduled() {
        if (!props.isDiscoveryEnabled()) {
            log.debug("[定时发现] 已禁用, 跳过");
            return;
        }
        try {
            runOnce();
        } catch (RuntimeException e) {
            log.error("[定时发现] 运行失败, 等待下次调度", e);
        }
    }

    /**
     * 执行一次完整发现，返回提交给下游的链路。
     */
    public List<DevicePath> runOnce() {
        EmbeddingRunStats stats = discoveryService.generateAllEmbeddings(false);
        if (stats.isDegraded()) {
            log.warn("[定时发现] 向量生成存在失败设备 {} 个, 这些设备不参与本次遍历", stats.getErrors());
        }
        Set<String> domains = props.getTriggerDomains().stream()
                .map(d -> d.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        List<String> triggerIds = catalogProvider.listDevices().stream()
                .filter(d -> d.getDomain() != null && domains.contains(d.getDomain().toLowerCase(Locale.ROOT)))
                .map(Device::getDeviceId)
                .collect(Collectors.toList());
        log.info("[定时发现] 触发设备数={}", triggerIds.size());
        List<DevicePath> paths = discoveryService.findPaths(triggerIds);
        suggestionPipeline.submit(paths);
        return paths;
    }
}
