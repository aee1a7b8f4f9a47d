package io.tagvault.core.retention;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.tagvault.core.MutableClock;
import io.tagvault.core.config.model.EncryptionConfig;
import io.tagvault.core.config.model.RetentionConfig;
import io.tagvault.core.crypto.EncryptionGate;
import io.tagvault.core.crypto.FileKeyRingStore;
import io.tagvault.core.memory.FileSnapshotStore;
import io.tagvault.core.memory.Memory;
import io.tagvault.core.memory.TaggedMemoryStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MaintenanceSchedulerTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));

    @TempDir
    Path tempDir;

    @Test
    void shouldSweepExpiredRecordsAndSave() throws Exception {
        TaggedMemoryStore store = newStore();
        store.store(JsonNodeFactory.instance.textNode("short lived"), List.of(), Duration.ofSeconds(1));
        String kept = store.store(JsonNodeFactory.instance.textNode("long lived"), List.of());
        clock.advance(Duration.ofSeconds(2));

        try (MaintenanceScheduler scheduler = new MaintenanceScheduler(store, Duration.ofMinutes(30), true)) {
            PruneResult result = scheduler.runOnce();

            assertThat(result.expired()).isEqualTo(1);
        }

        assertThat(store.ids()).containsExactly(kept);
        assertThat(Files.readString(tempDir.resolve("memories.json"))).contains(kept).doesNotContain("short lived");
    }

    @Test
    void shouldSkipSaveWhenNotConfigured() throws Exception {
        TaggedMemoryStore store = newStore();
        store.store(JsonNodeFactory.instance.textNode("note"), List.of());

        try (MaintenanceScheduler scheduler = new MaintenanceScheduler(store, Duration.ofMinutes(30), false)) {
            assertThat(scheduler.runOnce()).isEqualTo(PruneResult.NONE);
        }

        assertThat(Files.exists(tempDir.resolve("memories.json"))).isFalse();
    }

    @Test
    void shouldKeepSealedRecordsReadableAcrossRepeatedRotations() throws Exception {
        TaggedMemoryStore store = newStore();
        String first = store.store(JsonNodeFactory.instance.objectNode().put("diary", "first"), List.of("personal"));

        try (MaintenanceScheduler scheduler = new MaintenanceScheduler(store, Duration.ofMinutes(30), true)) {
            for (int i = 0; i < 2; i++) {
                clock.advance(Duration.ofDays(91));
                store.store(JsonNodeFactory.instance.objectNode().put("diary", "entry " + i), List.of("personal"));
                scheduler.runOnce();
            }
            clock.advance(Duration.ofDays(91));
            scheduler.runOnce();
        }

        Memory memory = store.get(first).orElseThrow();
        assertThat(memory.readable()).isTrue();
        assertThat(memory.payload().path("diary").asText()).isEqualTo("first");
    }

    @Test
    void shouldWaitForRunningSweepOnClose() throws Exception {
        TaggedMemoryStore store = newStore();
        store.store(JsonNodeFactory.instance.textNode("note"), List.of());
        Path file = tempDir.resolve("memories.json");

        MaintenanceScheduler scheduler = new MaintenanceScheduler(store, Duration.ofMillis(10), true);
        scheduler.start();
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (!Files.exists(file) && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        scheduler.close();

        assertThat(Files.exists(file)).isTrue();
        assertThat(scheduler.terminated()).isTrue();
    }

    @Test
    void shouldRejectNonPositiveInterval() throws Exception {
        TaggedMemoryStore store = newStore();

        assertThatThrownBy(() -> new MaintenanceScheduler(store, Duration.ZERO, true))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private TaggedMemoryStore newStore() throws Exception {
        return new TaggedMemoryStore(
            new FileSnapshotStore(tempDir.resolve("memories.json")),
            new EncryptionGate(EncryptionConfig.defaults(), new FileKeyRingStore(tempDir.resolve("keyring.json")), clock),
            new RetentionManager(RetentionConfig.defaults()),
            clock
        );
    }
}
