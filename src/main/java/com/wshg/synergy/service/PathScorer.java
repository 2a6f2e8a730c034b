package com.wshg.synergy.service;

import com.wshg.synergy.config.SynergyProperties;
import com.wshg.synergy.domain.Device;
import com.wshg.synergy.domain.DevicePath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 链路评分，取值 [0,1]：
 * semanticWeight × 相邻跳平均相似度 + areaWeight × (全部同区域 ? 1 : 0) + diversityWeight × 不同类别数 / 设备数。
 * 权重来自配置（默认 0.4 / 0.3 / 0.3），可按需调整。
 */
@Component
@RequiredArgsConstructor
public class PathScorer {

    private final SynergyProperties props;

    public double score(DevicePath path) {
        List<Device> devices = path.getDevices();
        if (devices.size() < 2) return 0;
        double raw = props.getScoreSemanticWeight() * meanSimilarity(path.getHopSimilarities())
                + props.getScoreAreaWeight() * areaConsistency(devices)
                + props.getScoreDiversityWeight() * domainDiversity(devices);
        return Math.max(0, Math.min(1, raw));
    }

    /** 遍历时已算好的相邻相似度，不再重算 */
    static double meanSimilarity(List<Double> hops) {
        if (hops == null || hops.isEmpty()) return 0;
        double sum = 0;
        for (Double h : hops) sum += h;
        return sum / hops.size();
    }

    /** 缺少区域的设备不算同区域 */
    static double areaConsistency(List<Device> devices) {
        Optional<String> first = devices.get(0).area();
        if (first.isEmpty()) return 0;
        for (Device d : devices) {
            if (!first.equals(d.area())) return 0;
        }
        return 1;
    }

    static double domainDiversity(List<Device> devices) {
        long distinct = devices.stream().map(Device::getDomain).filter(Objects::nonNull).distinct().count();
        return (double) distinct / devices.size();
    }
}
