package com.wshg.synergy.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wshg.synergy.config.SynergyProperties;
import com.wshg.synergy.domain.Device;
import com.wshg.synergy.domain.DeviceEmbedding;
import com.wshg.synergy.domain.DevicePath;
import com.wshg.synergy.domain.PathSearchOptions;
import com.wshg.synergy.embedding.EmbeddingModel;
import com.wshg.synergy.embedding.VectorMath;
import com.wshg.synergy.store.InMemoryDeviceEmbeddingStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ChainPathFinderTest {

    private static final Instant NOW = Instant.parse("2026-03-01T03:00:00Z");
    private static final String VERSION = "test-model@v1";

    private static final Device MOTION = device("binary_sensor.kitchen_motion", "binary_sensor", "motion", "kitchen");
    private static final Device LIGHT = device("light.kitchen", "light", null, "kitchen");
    private static final Device FAN = device("fan.kitchen", "fan", null, "kitchen");
    private static final Device LOCK = device("lock.front", "lock", null, "entry");
    private static final List<Device> CATALOG = List.of(MOTION, LIGHT, FAN, LOCK);

    private SynergyProperties props;
    private InMemoryDeviceEmbeddingStore store;
    private ExecutorService executor;
    private ChainPathFinder finder;

    @BeforeEach
    void setUp() {
        props = new SynergyProperties();
        store = new InMemoryDeviceEmbeddingStore(null, new ObjectMapper().findAndRegisterModules(),
                Clock.fixed(NOW, ZoneOffset.UTC));
        EmbeddingModel model = mock(EmbeddingModel.class);
        when(model.version()).thenReturn(VERSION);
        executor = Executors.newFixedThreadPool(2);
        finder = new ChainPathFinder(store, model, new PathScorer(props), props, executor);

        put(MOTION, VERSION, 1f, 0f, 0f);
        put(LIGHT, VERSION, 0.8f, 0.6f, 0f);
        put(FAN, VERSION, 0.6f, 0.8f, 0f);
        put(LOCK, VERSION, 0f, 0f, 1f);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldLinkKitchenMotionToKitchenLight() {
        List<DevicePath> paths = finder.findPaths(List.of(MOTION), CATALOG, new PathSearchOptions(2, 0.5, 5));

        assertThat(paths).isNotEmpty();
        DevicePath best = paths.get(0);
        assertThat(best.getDeviceIds()).containsExactly("binary_sensor.kitchen_motion", "light.kitchen");
        assertThat(best.getHopSimilarities().get(0)).isCloseTo(0.9, within(1e-6));
        assertThat(best.getScore()).isCloseTo(0.96, within(1e-6));
        assertThat(paths).noneMatch(p -> p.getDeviceIds().contains("lock.front"));
    }

    @Test
    void shouldRankThreeDeviceChainsByScore() {
        List<DevicePath> paths = finder.findPaths(List.of(MOTION), CATALOG, new PathSearchOptions(3, 0.6, 5));

        assertThat(paths).extracting(DevicePath::getDeviceIds).containsExactly(
                List.of("binary_sensor.kitchen_motion", "light.kitchen", "fan.kitchen"),
                List.of("binary_sensor.kitchen_motion", "fan.kitchen", "light.kitchen"));
        assertThat(paths.get(0).getScore()).isGreaterThan(paths.get(1).getScore());
    }

    @Test
    void shouldKeepPathInvariants() {
        PathSearchOptions options = new PathSearchOptions(3, 0.0, 5);

        List<DevicePath> paths = finder.findPaths(CATALOG, CATALOG, options);

        assertThat(paths).isNotEmpty();
        assertThat(paths).allSatisfy(p -> {
            assertThat(p.size()).isEqualTo(options.maxDepth());
            assertThat(new HashSet<>(p.getDeviceIds())).hasSize(p.size());
            assertThat(p.getHopSimilarities()).hasSize(p.size() - 1)
                    .allSatisfy(s -> assertThat(s).isBetween(options.minSimilarity(), 1.0));
            assertThat(p.getScore()).isBetween(props.getPathAcceptanceFloor(), 1.0);
        });
        for (int i = 1; i < paths.size(); i++) {
            assertThat(paths.get(i - 1).getScore()).isGreaterThanOrEqualTo(paths.get(i).getScore());
        }
    }

    @Test
    void shouldReturnNothingForUnreachableThreshold() {
        assertThat(finder.findPaths(CATALOG, CATALOG, new PathSearchOptions(2, 1.1, 5))).isEmpty();
    }

    @Test
    void shouldCapSimilarityAtOne() {
        ChainPathFinder.Node a = new ChainPathFinder.Node(LIGHT, VectorMath.normalize(new float[]{1f, 1f, 0f}));
        ChainPathFinder.Node b = new ChainPathFinder.Node(FAN, VectorMath.normalize(new float[]{1f, 1f, 0f}));

        assertThat(finder.similarity(a, b)).isEqualTo(1.0);
    }

    @Test
    void shouldLimitCandidatesPerHop() {
        List<DevicePath> paths = finder.findPaths(List.of(MOTION), CATALOG, new PathSearchOptions(2, 0.0, 1));

        assertThat(paths).extracting(DevicePath::getDeviceIds)
                .containsExactly(List.of("binary_sensor.kitchen_motion", "light.kitchen"));
    }

    @Test
    void shouldReturnEmptyWhenDeadlineAlreadyPassed() {
        props.setPathTimeoutMs(0);

        assertThat(finder.findPaths(CATALOG, CATALOG, new PathSearchOptions(3, 0.0, 5))).isEmpty();
    }

    @Test
    void shouldKeepAcceptedPathsWhenDeadlineExpiresMidSearch() {
        PathScorer slowScorer = mock(PathScorer.class);
        when(slowScorer.score(any())).thenAnswer(invocation -> {
            Thread.sleep(100);
            return 0.9;
        });
        EmbeddingModel model = mock(EmbeddingModel.class);
        when(model.version()).thenReturn(VERSION);
        ChainPathFinder slowFinder = new ChainPathFinder(store, model, slowScorer, props, executor);
        props.setPathTimeoutMs(250);

        List<DevicePath> paths = slowFinder.findPaths(List.of(MOTION), CATALOG, new PathSearchOptions(3, 0.0, 5));

        // 3 x 2 complete paths exist from the trigger; only the ones scored before the deadline survive
        assertThat(paths).isNotEmpty().hasSizeLessThan(6);
        assertThat(paths).allSatisfy(p -> {
            assertThat(p.size()).isEqualTo(3);
            assertThat(p.getScore()).isEqualTo(0.9);
        });
    }

    @Test
    void shouldSkipStaleEmbeddings() {
        put(LIGHT, "test-model@v0", 0.8f, 0.6f, 0f);

        List<DevicePath> paths = finder.findPaths(List.of(MOTION), CATALOG, new PathSearchOptions(2, 0.6, 5));

        assertThat(paths).extracting(DevicePath::getDeviceIds)
                .containsExactly(List.of("binary_sensor.kitchen_motion", "fan.kitchen"));
    }

    @Test
    void shouldSkipTriggerWithoutEmbedding() {
        Device orphan = device("sensor.garage_temp", "sensor", "temperature", "garage");

        assertThat(finder.findPaths(List.of(orphan), CATALOG, new PathSearchOptions(2, 0.0, 5))).isEmpty();
    }

    @Test
    void shouldIgnoreDevicesOutsideCatalog() {
        List<DevicePath> paths = finder.findPaths(List.of(MOTION), List.of(MOTION, FAN, LOCK),
                new PathSearchOptions(2, 0.6, 5));

        assertThat(paths).allSatisfy(p -> assertThat(p.getDeviceIds()).doesNotContain("light.kitchen"));
    }

    @Test
    void shouldBeDeterministicAcrossRuns() {
        PathSearchOptions options = new PathSearchOptions(3, 0.0, 3);

        List<String> first = finder.findPaths(CATALOG, CATALOG, options).stream()
                .map(DevicePath::toString).collect(Collectors.toList());
        List<String> second = finder.findPaths(CATALOG, CATALOG, options).stream()
                .map(DevicePath::toString).collect(Collectors.toList());

        assertThat(second).isEqualTo(first);
    }

    @Test
    void shouldRejectInvalidOptions() {
        assertThatThrownBy(() -> new PathSearchOptions(1, 0.5, 5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PathSearchOptions(6, 0.5, 5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PathSearchOptions(3, 0.5, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    private void put(Device device, String version, float... vector) {
        store.upsert(DeviceEmbedding.builder()
                .deviceId(device.getDeviceId())
                .vector(vector)
                .descriptorText(device.getDeviceId())
                .modelVersion(version)
                .embeddingNorm(VectorMath.norm(vector))
                .generatedAt(NOW)
                .build());
    }

    private static Device device(String id, String domain, String deviceClass, String area) {
        return Device.builder().deviceId(id).domain(domain).deviceClass(deviceClass).areaId(area).build();
    }
}
