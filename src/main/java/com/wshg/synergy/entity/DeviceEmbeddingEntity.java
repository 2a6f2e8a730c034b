package com.wshg.synergy.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 设备向量缓存表（MySQL），embedding-store-type=mysql 时使用。每个设备一行。
 */
@Entity
@Table(name = "device_embedding", indexes = @Index(name = "idx_model_version", columnList = "model_version"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeviceEmbeddingEntity {

    @Id
    @Column(name = "device_id", length = 128)
    private String deviceId;

    @Column(name = "embedding_json", columnDefinition = "TEXT", nullable = false)
    private String embeddingJson;

    @Column(name = "descriptor_text", columnDefinition = "TEXT", nullable = false)
    private String descriptorText;

    @Column(name = "model_version", length = 128, nullable = false)
    private String modelVersion;

    @Column(name = "embedding_norm")
    private Double embeddingNorm;

    @Column(name = "generated_at", nullable = false)
    private Instant generatedAt;
}
