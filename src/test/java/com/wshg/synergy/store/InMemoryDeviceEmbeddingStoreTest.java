package com.wshg.synergy.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wshg.synergy.domain.DeviceEmbedding;
import com.wshg.synergy.domain.Freshness;
import com.wshg.synergy.exception.StorageException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryDeviceEmbeddingStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T03:00:00Z");
    private static final Duration MAX_AGE = Duration.ofDays(30);
    private static final String VERSION = "hashing:64@v1";

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void shouldPersistAndReloadFromFile() {
        String file = tempDir.resolve("cache/embeddings.json").toString();
        InMemoryDeviceEmbeddingStore store = new InMemoryDeviceEmbeddingStore(file, objectMapper, clock);
        store.upsert(embedding("light.kitchen", VERSION, NOW.minus(Duration.ofDays(1))));
        store.upsert(embedding("binary_sensor.kitchen_motion", VERSION, NOW));

        InMemoryDeviceEmbeddingStore reloaded = new InMemoryDeviceEmbeddingStore(file, objectMapper, clock);
        reloaded.loadFromFile();

        assertThat(reloaded.size()).isEqualTo(2);
        DeviceEmbedding light = reloaded.get("light.kitchen").orElseThrow();
        assertThat(light.getVector()).containsExactly(0.6f, 0.8f);
        assertThat(light.getModelVersion()).isEqualTo(VERSION);
        assertThat(light.getGeneratedAt()).isEqualTo(NOW.minus(Duration.ofDays(1)));
        assertThat(reloaded.isFresh("light.kitchen", VERSION, MAX_AGE)).isTrue();
    }

    @Test
    void shouldReportEachFreshnessState() {
        InMemoryDeviceEmbeddingStore store = new InMemoryDeviceEmbeddingStore(null, objectMapper, clock);
        store.upsert(embedding("fresh", VERSION, NOW.minus(Duration.ofDays(29))));
        store.upsert(embedding("old", VERSION, NOW.minus(Duration.ofDays(31))));
        store.upsert(embedding("other", "hashing:64@v0", NOW));

        assertThat(store.freshness("fresh", VERSION, MAX_AGE)).isEqualTo(Freshness.FRESH);
        assertThat(store.freshness("old", VERSION, MAX_AGE)).isEqualTo(Freshness.EXPIRED);
        assertThat(store.freshness("other", VERSION, MAX_AGE)).isEqualTo(Freshness.VERSION_MISMATCH);
        assertThat(store.freshness("missing", VERSION, MAX_AGE)).isEqualTo(Freshness.MISSING);
    }

    @Test
    void shouldTreatEveryEntryAsStaleAfterVersionBump() {
        InMemoryDeviceEmbeddingStore store = new InMemoryDeviceEmbeddingStore("", objectMapper, clock);
        store.upsert(embedding("a", VERSION, NOW));
        store.upsert(embedding("b", VERSION, NOW));

        assertThat(store.isFresh("a", "hashing:64@v2", MAX_AGE)).isFalse();
        assertThat(store.isFresh("b", "hashing:64@v2", MAX_AGE)).isFalse();
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void shouldReturnDefensiveCopiesFromAll() {
        InMemoryDeviceEmbeddingStore store = new InMemoryDeviceEmbeddingStore(null, objectMapper, clock);
        store.upsert(embedding("a", VERSION, NOW));

        Map<String, float[]> snapshot = store.all();
        snapshot.get("a")[0] = 42f;

        assertThat(store.get("a").orElseThrow().getVector()[0]).isEqualTo(0.6f);
    }

    @Test
    void shouldNotShareVectorArraysWithCallers() {
        InMemoryDeviceEmbeddingStore store = new InMemoryDeviceEmbeddingStore(null, objectMapper, clock);
        DeviceEmbedding original = embedding("a", VERSION, NOW);
        store.upsert(original);

        original.getVector()[0] = 7f;
        store.get("a").orElseThrow().getVector()[0] = 42f;
        store.findAll().get(0).getVector()[1] = 42f;

        assertThat(store.get("a").orElseThrow().getVector()).containsExactly(0.6f, 0.8f);
        assertThat(store.all().get("a")).containsExactly(0.6f, 0.8f);
    }

    @Test
    void shouldPersistWholeBatch() {
        String file = tempDir.resolve("batch.json").toString();
        InMemoryDeviceEmbeddingStore store = new InMemoryDeviceEmbeddingStore(file, objectMapper, clock);

        Map<String, StorageException> failed = store.upsertAll(List.of(
                embedding("a", VERSION, NOW), embedding("b", VERSION, NOW), embedding("c", VERSION, NOW)));

        InMemoryDeviceEmbeddingStore reloaded = new InMemoryDeviceEmbeddingStore(file, objectMapper, clock);
        reloaded.loadFromFile();
        assertThat(failed).isEmpty();
        assertThat(reloaded.size()).isEqualTo(3);
    }

    @Test
    void shouldRollBackWholeBatchWhenFileCannotBeWritten() throws Exception {
        Path blocker = Files.createFile(tempDir.resolve("blocker"));
        InMemoryDeviceEmbeddingStore store = new InMemoryDeviceEmbeddingStore(
                blocker.resolve("embeddings.json").toString(), objectMapper, clock);

        Map<String, StorageException> failed = store.upsertAll(List.of(
                embedding("a", VERSION, NOW), embedding("b", VERSION, NOW)));

        assertThat(failed).containsOnlyKeys("a", "b");
        assertThat(store.size()).isZero();
    }

    @Test
    void shouldDeleteAndClear() {
        InMemoryDeviceEmbeddingStore store = new InMemoryDeviceEmbeddingStore(null, objectMapper, clock);
        store.upsert(embedding("a", VERSION, NOW));
        store.upsert(embedding("b", VERSION, NOW));

        store.delete("a");
        assertThat(store.get("a")).isEmpty();
        assertThat(store.size()).isEqualTo(1);

        store.clear();
        assertThat(store.findAll()).isEmpty();
    }

    @Test
    void shouldRollBackWhenFileCannotBeWritten() throws Exception {
        Path blocker = Files.createFile(tempDir.resolve("not-a-dir"));
        InMemoryDeviceEmbeddingStore store = new InMemoryDeviceEmbeddingStore(
                blocker.resolve("embeddings.json").toString(), objectMapper, clock);

        assertThatThrownBy(() -> store.upsert(embedding("a", VERSION, NOW))).isInstanceOf(StorageException.class);
        assertThat(store.get("a")).isEmpty();
    }

    @Test
    void shouldStartEmptyWhenFileIsCorrupt() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{not json");
        InMemoryDeviceEmbeddingStore store = new InMemoryDeviceEmbeddingStore(file.toString(), objectMapper, clock);

        store.loadFromFile();

        assertThat(store.size()).isZero();
    }

    private static DeviceEmbedding embedding(String id, String version, Instant generatedAt) {
        return DeviceEmbedding.builder()
                .deviceId(id)
                .vector(new float[]{0.6f, 0.8f})
                .descriptorText("Light that controls lighting in kitchen area")
                .modelVersion(version)
                .embeddingNorm(1.0)
                .generatedAt(generatedAt)
                .build();
    }
}
