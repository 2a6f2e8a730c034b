package com.wshg.synergy.domain;

/**
 * 多跳遍历参数。maxDepth 为链路包含的设备数上限，取值 2~5。
 */
public record PathSearchOptions(int maxDepth, double minSimilarity, int topKPerHop) {

    public static final int MIN_DEPTH = 2;
    public static final int MAX_DEPTH = 5;

    public PathSearchOptions {
        if (maxDepth < MIN_DEPTH || maxDepth > MAX_DEPTH) {
            throw new IllegalArgumentException("maxDepth 必须在 " + MIN_DEPTH + "~" + MAX_DEPTH + " 之间: " + maxDepth);
        }
        if (topKPerHop < 1) {
            throw new IllegalArgumentException("topKPerHop 必须 >= 1: " + topKPerHop);
        }
        if (Double.isNaN(minSimilarity)) {
            throw new IllegalArgumentException("minSimilarity 不能为 NaN");
        }
    }
}
