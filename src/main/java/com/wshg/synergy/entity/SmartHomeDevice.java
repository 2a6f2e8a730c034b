package com.wshg.synergy.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 智能家居设备表：设备目录的本地数据源，存储类别、区域与能力列表。
 */
@Entity
@Table(name = "smart_home_device")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SmartHomeDevice {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** 设备唯一标识，如 binary_sensor.kitchen_motion */
    @Column(nullable = false, unique = true, length = 128)
    private String deviceId;

    /** 设备显示名称，如「厨房人体传感器」 */
    @Column(length = 128)
    private String deviceName;

    /** 设备类别：sensor / binary_sensor / light / lock / climate ... */
    @Column(nullable = false, length = 32)
    private String domain;

    /** 细分类型：motion / door / temperature ...，可为空 */
    @Column(length = 32)
    private String deviceClass;

    /** 区域标识，如 kitchen，可为空 */
    @Column(length = 64)
    private String areaId;

    /** 接入平台：zha / mqtt / hue ... */
    @Column(length = 64)
    private String integration;

    /** 能力列表：brightness / color / position ... */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "smart_home_device_capability", joinColumns = @JoinColumn(name = "device_pk"))
    @Column(name = "capability", length = 64)
    @Builder.Default
    private Set<String> capabilities = new LinkedHashSet<>();

    /** 是否启用 */
    @Column(nullable = false)
    @Builder.Default
    private Boolean enabled = true;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    public void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = Instant.now();
    }
}
