package com.wshg.synergy.domain;

/**
 * 缓存新鲜度判定结果。只有 FRESH 的向量可直接用于遍历，其余都需要重新生成。
 */
public enum Freshness {
    FRESH,
    MISSING,
    VERSION_MISMATCH,
    EXPIRED;

    public boolean isFresh() {
        return this == FRESH;
    }
}
