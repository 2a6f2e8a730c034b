package com.wshg.synergy.repository;

import com.wshg.synergy.entity.SmartHomeDevice;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface SmartHomeDeviceRepository extends JpaRepository<SmartHomeDevice, Long> {

    List<SmartHomeDevice> findByEnabledTrue();

    Optional<SmartHomeDevice> findByDeviceId(String deviceId);
}
