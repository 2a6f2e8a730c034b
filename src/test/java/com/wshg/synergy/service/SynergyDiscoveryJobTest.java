package com.wshg.synergy.service;

import com.wshg.synergy.catalog.DeviceCatalogProvider;
import com.wshg.synergy.config.SynergyProperties;
import com.wshg.synergy.domain.Device;
import com.wshg.synergy.domain.DevicePath;
import com.wshg.synergy.domain.EmbeddingRunStats;
import com.wshg.synergy.exception.ModelUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SynergyDiscoveryJobTest {

    private SynergyDiscoveryService discoveryService;
    private DeviceCatalogProvider catalog;
    private SuggestionPipeline pipeline;
    private SynergyProperties props;
    private SynergyDiscoveryJob job;

    @BeforeEach
    void setUp() {
        discoveryService = mock(SynergyDiscoveryService.class);
        catalog = mock(DeviceCatalogProvider.class);
        pipeline = mock(SuggestionPipeline.class);
        props = new SynergyProperties();
        job = new SynergyDiscoveryJob(discoveryService, catalog, pipeline, props);
        when(discoveryService.generateAllEmbeddings(false)).thenReturn(EmbeddingRunStats.builder().total(3).build());
        when(catalog.listDevices()).thenReturn(List.of(
                Device.builder().deviceId("binary_sensor.kitchen_motion").domain("binary_sensor").build(),
                Device.builder().deviceId("sensor.kitchen_temp").domain("sensor").build(),
                Device.builder().deviceId("light.kitchen").domain("light").build()));
    }

    @Test
    void shouldUseSensorsAsTriggersAndSubmitPaths() {
        List<DevicePath> paths = List.of(DevicePath.builder().score(0.9).build());
        when(discoveryService.findPaths(List.of("binary_sensor.kitchen_motion", "sensor.kitchen_temp"))).thenReturn(paths);

        job.runOnce();

        verify(pipeline).submit(paths);
    }

    @Test
    void shouldSkipWhenDisabled() {
        props.setDiscoveryEnabled(false);

        job.runScheduled();

        verifyNoInteractions(discoveryService, pipeline);
    }

    @Test
    void shouldSwallowFailuresInScheduledRun() {
        when(discoveryService.generateAllEmbeddings(anyBoolean())).thenThrow(new ModelUnavailableException("down"));

        assertThatCode(() -> job.runScheduled()).doesNotThrowAnyException();
        verifyNoInteractions(pipeline);
    }
}
