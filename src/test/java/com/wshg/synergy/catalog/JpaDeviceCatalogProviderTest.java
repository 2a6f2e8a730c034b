package com.wshg.synergy.catalog;

import com.wshg.synergy.domain.Device;
import com.wshg.synergy.entity.SmartHomeDevice;
import com.wshg.synergy.repository.SmartHomeDeviceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class JpaDeviceCatalogProviderTest {

    @Autowired
    private SmartHomeDeviceRepository repository;

    private JpaDeviceCatalogProvider provider;

    @BeforeEach
    void setUp() {
        provider = new JpaDeviceCatalogProvider(repository);
        repository.save(SmartHomeDevice.builder()
                .deviceId("light.kitchen")
                .deviceName("厨房灯")
                .domain("light")
                .areaId("kitchen")
                .integration("hue")
                .capabilities(new LinkedHashSet<>(List.of("brightness", "color")))
                .build());
        repository.save(SmartHomeDevice.builder()
                .deviceId("binary_sensor.kitchen_motion")
                .deviceName("厨房人体传感器")
                .domain("binary_sensor")
                .deviceClass("motion")
                .areaId("kitchen")
                .build());
        repository.save(SmartHomeDevice.builder()
                .deviceId("switch.retired")
                .domain("switch")
                .enabled(false)
                .build());
    }

    @Test
    void shouldListOnlyEnabledDevices() {
        List<Device> devices = provider.listDevices();

        assertThat(devices).extracting(Device::getDeviceId)
                .containsExactlyInAnyOrder("light.kitchen", "binary_sensor.kitchen_motion");
        Device motion = devices.stream().filter(d -> d.getDomain().equals("binary_sensor")).findFirst().orElseThrow();
        assertThat(motion.deviceClass()).contains("motion");
        assertThat(motion.area()).contains("kitchen");
    }

    @Test
    void shouldReadCapabilities() {
        assertThat(provider.getCapabilities("light.kitchen")).containsExactlyInAnyOrder("brightness", "color");
        assertThat(provider.getCapabilities("unknown.device")).isEqualTo(Set.of());
    }
}
