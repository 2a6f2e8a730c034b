package com.wshg.synergy.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.env.Environment;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 链路发现配置：向量模型、向量缓存、设备目录、多跳遍历与评分权重。
 * - local：Ollama 本地向量模型
 * - online：阿里云 DashScope 向量模型
 * - mock=true：离线哈希向量，不依赖任何模型服务
 */
@ConfigurationProperties(prefix = "synergy")
public class SynergyProperties {

    private Environment environment;

    @Autowired
    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }

    /** 是否本地模式（否则为线上阿里云） */
    public boolean isLocal() {
        if (environment == null) return true;
        String[] active = environment.getActiveProfiles();
        if (active.length == 0) {
            String def = environment.getProperty("spring.profiles.active", "local");
            return "local".equalsIgnoreCase(def);
        }
        return "local".equalsIgnoreCase(active[0]);
    }

    // ---------- 向量模型 ----------
    private boolean mock = false;
    /** 模型修订号，写入 model_version；升级量化或权重时修改，使全部缓存失效 */
    private String embeddingModelRevision = "v1";
    private int embeddingBatchSize = 32;
    private String ollamaBaseUrl = "http://localhost:11434";
    private String ollamaEmbeddingModel = "all-minilm";
    private String qwenBaseUrl = "https://dashscope.aliyuncs.com/compatible-mode";
    private String qwenApiKey;
    private String embeddingModel = "text-embedding-v3";
    private int embeddingDimensions = 1024;
    /** mock 模式哈希向量维度 */
    private int hashingDimensions = 384;

    // ---------- 向量缓存 ----------
    private String embeddingStoreType = "mysql";
    /** 向量缓存文件路径（仅 embedding-store-type=file 时生效，为空则只在内存中） */
    private String embeddingStorePath = "data/device-embeddings.json";
    private int embeddingMaxAgeDays = 30;

    // ---------- 设备目录 ----------
    private String catalogType = "jpa";
    private String dataApiBaseUrl = "http://localhost:8006";
    private String deviceIntelligenceBaseUrl = "http://localhost:8021";
    private int dataApiLimit = 1000;

    // ---------- 多跳遍历 ----------
    /** 链路最多包含的设备数，取值 2~5 */
    private int pathMaxDepth = 3;
    private double pathMinSimilarity = 0.6;
    private int pathTopKPerHop = 5;
    /** 同一区域设备的相似度加成 */
    private double sameAreaBonus = 0.1;
    /** 链路评分低于此值丢弃 */
    private double pathAcceptanceFloor = 0.5;
    /** 单个触发设备的遍历时限（毫秒） */
    private long pathTimeoutMs = 5_000;
    private int traversalThreads = 4;

    // ---------- 评分权重 ----------
    private double scoreSemanticWeight = 0.4;
    private double scoreAreaWeight = 0.3;
    private double scoreDiversityWeight = 0.3;

    // ---------- 定时任务 ----------
    private boolean discoveryEnabled = true;
    private List<String> triggerDomains = new ArrayList<>(List.of("binary_sensor", "sensor"));

    public boolean isMock() { return mock; }
    public void setMock(boolean mock) { this.mock = mock; }
    public String getEmbeddingModelRevision() { return embeddingModelRevision; }
    public void setEmbeddingModelRevision(String embeddingModelRevision) { this.embeddingModelRevision = embeddingModelRevision; }
    public int getEmbeddingBatchSize() { return embeddingBatchSize; }
    public void setEmbeddingBatchSize(int embeddingBatchSize) { this.embeddingBatchSize = embeddingBatchSize; }
    public String getOllamaBaseUrl() { return ollamaBaseUrl; }
    public void setOllamaBaseUrl(String ollamaBaseUrl) { this.ollamaBaseUrl = ollamaBaseUrl; }
    public String getOllamaEmbeddingModel() { return ollamaEmbeddingModel; }
    public void setOllamaEmbeddingModel(String ollamaEmbeddingModel) { this.ollamaEmbeddingModel = ollamaEmbeddingModel; }
    public String getQwenBaseUrl() { return qwenBaseUrl; }
    public void setQwenBaseUrl(String qwenBaseUrl) { this.qwenBaseUrl = qwenBaseUrl; }
    public String getQwenApiKey() { return qwenApiKey; }
    public void setQwenApiKey(String qwenApiKey) { this.qwenApiKey = qwenApiKey; }
    public String getEmbeddingModel() { return embeddingModel; }
    public void setEmbeddingModel(String embeddingModel) { this.embeddingModel = embeddingModel; }
    public int getEmbeddingDimensions() { return embeddingDimensions; }
    public void setEmbeddingDimensions(int embeddingDimensions) { this.embeddingDimensions = embeddingDimensions; }
    public int getHashingDimensions() { return hashingDimensions; }
    public void setHashingDimensions(int hashingDimensions) { this.hashingDimensions = hashingDimensions; }

    public String getEmbeddingStoreType() { return embeddingStoreType; }
    public void setEmbeddingStoreType(String embeddingStoreType) { this.embeddingStoreType = embeddingStoreType; }
    public String getEmbeddingStorePath() { return embeddingStorePath; }
    public void setEmbeddingStorePath(String embeddingStorePath) { this.embeddingStorePath = embeddingStorePath; }
    public int getEmbeddingMaxAgeDays() { return embeddingMaxAgeDays; }
    public void setEmbeddingMaxAgeDays(int embeddingMaxAgeDays) { this.embeddingMaxAgeDays = embeddingMaxAgeDays; }

    public String getCatalogType() { return catalogType; }
    public void setCatalogType(String catalogType) { this.catalogType = catalogType; }
    public String getDataApiBaseUrl() { return dataApiBaseUrl; }
    public void setDataApiBaseUrl(String dataApiBaseUrl) { this.dataApiBaseUrl = dataApiBaseUrl; }
    public String getDeviceIntelligenceBaseUrl() { return deviceIntelligenceBaseUrl; }
    public void setDeviceIntelligenceBaseUrl(String deviceIntelligenceBaseUrl) { this.deviceIntelligenceBaseUrl = deviceIntelligenceBaseUrl; }
    public int getDataApiLimit() { return dataApiLimit; }
    public void setDataApiLimit(int dataApiLimit) { this.dataApiLimit = dataApiLimit; }

    public int getPathMaxDepth() { return pathMaxDepth; }
    public void setPathMaxDepth(int pathMaxDepth) { this.pathMaxDepth = pathMaxDepth; }
    public double getPathMinSimilarity() { return pathMinSimilarity; }
    public void setPathMinSimilarity(double pathMinSimilarity) { this.pathMinSimilarity = pathMinSimilarity; }
    public int getPathTopKPerHop() { return pathTopKPerHop; }
    public void setPathTopKPerHop(int pathTopKPerHop) { this.pathTopKPerHop = pathTopKPerHop; }
    public double getSameAreaBonus() { return sameAreaBonus; }
    public void setSameAreaBonus(double sameAreaBonus) { this.sameAreaBonus = sameAreaBonus; }
    public double getPathAcceptanceFloor() { return pathAcceptanceFloor; }
    public void setPathAcceptanceFloor(double pathAcceptanceFloor) { this.pathAcceptanceFloor = pathAcceptanceFloor; }
    public long getPathTimeoutMs() { return pathTimeoutMs; }
    public void setPathTimeoutMs(long pathTimeoutMs) { this.pathTimeoutMs = pathTimeoutMs; }
    public int getTraversalThreads() { return traversalThreads; }
    public void setTraversalThreads(int traversalThreads) { this.traversalThreads = traversalThreads; }

    public double getScoreSemanticWeight() { return scoreSemanticWeight; }
    public void setScoreSemanticWeight(double scoreSemanticWeight) { this.scoreSemanticWeight = scoreSemanticWeight; }
    public double getScoreAreaWeight() { return scoreAreaWeight; }
    public void setScoreAreaWeight(double scoreAreaWeight) { this.scoreAreaWeight = scoreAreaWeight; }
    public double getScoreDiversityWeight() { return scoreDiversityWeight; }
    public void setScoreDiversityWeight(double scoreDiversityWeight) { this.scoreDiversityWeight = scoreDiversityWeight; }

    public boolean isDiscoveryEnabled() { return discoveryEnabled; }
    public void setDiscoveryEnabled(boolean discoveryEnabled) { this.discoveryEnabled = discoveryEnabled; }
    public List<String> getTriggerDomains() { return triggerDomains; }
    public void setTriggerDomains(List<String> triggerDomains) { this.triggerDomains = triggerDomains; }

    public Duration getEmbeddingMaxAge() { return Duration.ofDays(embeddingMaxAgeDays); }
    public Duration getPathTimeout() { return Duration.ofMillis(pathTimeoutMs); }
}
