package com.wshg.synergy.repository;

import com.wshg.synergy.entity.DeviceEmbeddingEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DeviceEmbeddingRepository extends JpaRepository<DeviceEmbeddingEntity, String> {
}
