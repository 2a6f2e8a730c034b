package com.wshg.synergy.store;

import com.wshg.synergy.domain.DeviceEmbedding;
import com.wshg.synergy.domain.Freshness;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 新鲜度判定：模型版本一致且生成时间在 maxAge 之内。
 */
final class FreshnessPolicy {

    private FreshnessPolicy() {
    }

    static Freshness evaluate(DeviceEmbedding stored, String currentModelVersion, Duration maxAge, Clock clock) {
        if (stored == null) return Freshness.MISSING;
        if (stored.getModelVersion() == null || !stored.getModelVersion().equals(currentModelVersion)) {
            return Freshness.VERSION_MISMATCH;
        }
        Instant generatedAt = stored.getGeneratedAt();
        if (generatedAt == null) return Freshness.EXPIRED;
        Duration age = Duration.between(generatedAt, clock.instant());
        return age.compareTo(maxAge) < 0 ? Freshness.FRESH : Freshness.EXPIRED;
    }
}
